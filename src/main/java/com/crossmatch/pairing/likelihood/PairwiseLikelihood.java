package com.crossmatch.pairing.likelihood;

import com.crossmatch.pairing.core.model.Catalogue;
import com.crossmatch.pairing.core.model.Source;
import com.crossmatch.pairing.grid.GridIndexer;
import com.crossmatch.pairing.grid.PriorDensityGrids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Combines astrometry, photometry, priors and (optionally) perturbation grids into
 * the per-pair and per-field-source factors of a hypothesis score.
 *
 * <p>Without perturbation modelling the astrometric term is the closed-form Gaussian.
 * With it, the score uses the Hankel-transformed likelihood with both sources perturbed.</p>
 */
public class PairwiseLikelihood {
    private static final Logger log = LoggerFactory.getLogger(PairwiseLikelihood.class);
    private static final double[] NO_LEVELS = new double[0];

    private final PriorDensityGrids priors;
    private final PhotometricLikelihood photometry;
    private final GridIndexer perturbation;
    private final ContaminationLikelihood contamination;

    /**
     * Likelihood without perturbation modelling.
     */
    public PairwiseLikelihood(PriorDensityGrids priors, PhotometricLikelihood photometry) {
        this(priors, photometry, null, null);
    }

    /**
     * @param perturbation  grid lookups, or null to disable perturbation modelling
     * @param contamination Hankel likelihoods on the shared frequency grid, required with {@code perturbation}
     */
    public PairwiseLikelihood(PriorDensityGrids priors, PhotometricLikelihood photometry,
                              GridIndexer perturbation, ContaminationLikelihood contamination) {
        this.priors = Objects.requireNonNull(priors, "priors is required");
        this.photometry = photometry != null ? photometry : NoOpPhotometricLikelihood.INSTANCE;
        if ((perturbation == null) != (contamination == null)) {
            throw new IllegalArgumentException("Perturbation grids and contamination likelihood go together");
        }
        if (perturbation != null && perturbation.kernelLength() != contamination.grid().size()) {
            throw new IllegalArgumentException("Fourier kernels hold " + perturbation.kernelLength()
                    + " samples but the frequency grid has " + contamination.grid().size());
        }
        this.perturbation = perturbation;
        this.contamination = contamination;
    }

    public boolean isPerturbationEnabled() {
        return perturbation != null;
    }

    public boolean isPhotometryEnabled() {
        return photometry.isEnabled();
    }

    public PairLikelihood pair(Source a, Source b) {
        if (a.catalogue() != Catalogue.A || b.catalogue() != Catalogue.B) {
            throw new IllegalArgumentException("Expected a catalogue a and a catalogue b source, got "
                    + a + " and " + b);
        }
        double separation = SkySeparation.haversineDegrees(a.longitude(), a.latitude(), b.longitude(), b.latitude());
        double c = photometry.counterpart(a, b);
        double nc = priors.counterpartDensity(a, b);

        if (perturbation == null) {
            double g = AstrometricLikelihood.gaussian(separation, a.uncertainty(), b.uncertainty());
            return new PairLikelihood(separation, g, c, nc, ContaminatedMatchLikelihoods.unperturbed(g),
                    0.0, 0.0, NO_LEVELS, NO_LEVELS);
        }

        double toArcsec = SkySeparation.ARCSEC_PER_DEGREE;
        ContaminatedMatchLikelihoods g = contamination.compute(separation * toArcsec,
                a.uncertainty() * toArcsec, b.uncertainty() * toArcsec,
                perturbation.fourierKernel(a), perturbation.fourierKernel(b));
        double[][] probs = g.contaminationProbabilities(
                perturbation.contaminationFractions(a), perturbation.contaminationFractions(b));
        log.trace("pair.likelihood a={} b={} sep={} gcc={} gnn={}", a.index(), b.index(), separation,
                g.gcc(), g.gnn());
        return new PairLikelihood(separation, g.gcc(), c, nc, g,
                perturbation.contaminationFlux(a), perturbation.contaminationFlux(b), probs[0], probs[1]);
    }

    public FieldLikelihood field(Source source) {
        return new FieldLikelihood(priors.fieldDensity(source), photometry.field(source));
    }
}
