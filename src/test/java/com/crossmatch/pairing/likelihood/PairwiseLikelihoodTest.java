package com.crossmatch.pairing.likelihood;

import com.crossmatch.pairing.core.model.Catalogue;
import com.crossmatch.pairing.core.model.ModelReference;
import com.crossmatch.pairing.core.model.Source;
import com.crossmatch.pairing.grid.CurveCube;
import com.crossmatch.pairing.grid.GridIndexer;
import com.crossmatch.pairing.grid.PerturbationGrids;
import com.crossmatch.pairing.grid.PriorDensityGrids;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PairwiseLikelihood Tests")
class PairwiseLikelihoodTest {

    private static final double ARCSEC = 1.0 / 3600.0;
    private static final ModelReference REF = ModelReference.of(0, 0, 0);

    @Mock
    private PhotometricLikelihood photometry;

    private final Source a = new Source(Catalogue.A, 3, 10.0, 0.0, 0.1 * ARCSEC, new double[]{18.0}, 0, REF);
    private final Source b = new Source(Catalogue.B, 7, 10.0 + 0.2 * ARCSEC, 0.0, 0.08 * ARCSEC,
            new double[]{17.5}, 0, REF);

    private PriorDensityGrids priors;

    @BeforeEach
    void setUp() {
        priors = PriorDensityGrids.uniform(150.0, 550.0, 125.0);
    }

    @Nested
    @DisplayName("Without perturbation")
    class Unperturbed {

        @Test
        @DisplayName("Pair terms should combine the Gaussian, photometry and counterpart prior")
        void pairTerms() {
            when(photometry.counterpart(a, b)).thenReturn(2.5);
            PairwiseLikelihood likelihood = new PairwiseLikelihood(priors, photometry);

            PairLikelihood pair = likelihood.pair(a, b);

            double g = AstrometricLikelihood.gaussian(pair.separation(), a.uncertainty(), b.uncertainty());
            assertEquals(0.2, pair.separation() * 3600.0, 1e-9);
            assertEquals(g, pair.astrometric());
            assertEquals(2.5, pair.photometric());
            assertEquals(150.0, pair.counterpartPrior());
            assertEquals(150.0 * g * 2.5, pair.factor(), 1e-9 * pair.factor());
            assertEquals(g * 2.5, pair.likelihoodOnly(), 1e-9 * pair.likelihoodOnly());
            assertEquals(0.0, pair.contaminationFluxA());
            assertEquals(0, pair.contaminationProbA().length);
            assertFalse(likelihood.isPerturbationEnabled());
        }

        @Test
        @DisplayName("Field terms should use each source's own field prior")
        void fieldTerms() {
            when(photometry.field(any(Source.class))).thenReturn(0.4);
            PairwiseLikelihood likelihood = new PairwiseLikelihood(priors, photometry);

            assertEquals(550.0 * 0.4, likelihood.field(a).factor(), 1e-12);
            assertEquals(125.0 * 0.4, likelihood.field(b).factor(), 1e-12);
            verify(photometry, times(2)).field(any(Source.class));
        }

        @Test
        @DisplayName("Missing photometry should contribute a factor of one")
        void noPhotometry() {
            PairwiseLikelihood likelihood = new PairwiseLikelihood(priors, null);
            assertFalse(likelihood.isPhotometryEnabled());
            assertEquals(1.0, likelihood.pair(a, b).photometric());
            assertEquals(550.0, likelihood.field(a).factor());
        }

        @Test
        @DisplayName("Sources must be passed as a then b")
        void catalogueOrder() {
            PairwiseLikelihood likelihood = new PairwiseLikelihood(priors, NoOpPhotometricLikelihood.INSTANCE);
            assertThrows(IllegalArgumentException.class, () -> likelihood.pair(b, a));
            verifyNoInteractions(photometry);
        }
    }

    @Nested
    @DisplayName("With perturbation")
    class Perturbed {

        private final FrequencyGrid grid = FrequencyGrid.linear(100.0, 4001);

        private PerturbationGrids grids(double fraction, double flux) {
            double[] kernel = new double[grid.size()];
            java.util.Arrays.fill(kernel, 1.0);
            return new PerturbationGrids(
                    CurveCube.heap(1, 1, 1, 2, fraction, fraction / 2),
                    CurveCube.scalar(flux),
                    CurveCube.heap(1, 1, 1, grid.size(), kernel));
        }

        @Test
        @DisplayName("Unit kernels should reproduce the unperturbed astrometric term")
        void unitKernels() {
            PairwiseLikelihood plain = new PairwiseLikelihood(priors, NoOpPhotometricLikelihood.INSTANCE);
            PairwiseLikelihood perturbed = new PairwiseLikelihood(priors, NoOpPhotometricLikelihood.INSTANCE,
                    new GridIndexer(grids(0.2, 1.5), grids(0.4, 0.5)), new ContaminationLikelihood(grid));

            PairLikelihood expected = plain.pair(a, b);
            PairLikelihood actual = perturbed.pair(a, b);

            assertTrue(perturbed.isPerturbationEnabled());
            assertEquals(expected.astrometric(), actual.astrometric(), expected.astrometric() * 1e-3);
            assertEquals(1.5, actual.contaminationFluxA());
            assertEquals(0.5, actual.contaminationFluxB());
            assertArrayEquals(new double[]{0.2, 0.1}, actual.contaminationProbA(), 1e-6);
            assertArrayEquals(new double[]{0.4, 0.2}, actual.contaminationProbB(), 1e-6);
        }

        @Test
        @DisplayName("Kernel length must match the frequency grid")
        void kernelMismatch() {
            GridIndexer indexer = new GridIndexer(grids(0.2, 1.0), grids(0.2, 1.0));
            ContaminationLikelihood shortGrid = new ContaminationLikelihood(FrequencyGrid.linear(10.0, 11));
            assertThrows(IllegalArgumentException.class, () -> new PairwiseLikelihood(priors,
                    NoOpPhotometricLikelihood.INSTANCE, indexer, shortGrid));
        }

        @Test
        @DisplayName("Grids and contamination likelihood must be supplied together")
        void bothOrNeither() {
            assertThrows(IllegalArgumentException.class, () -> new PairwiseLikelihood(priors,
                    NoOpPhotometricLikelihood.INSTANCE, null, new ContaminationLikelihood(grid)));
        }
    }
}
