package com.crossmatch.pairing.likelihood;

/**
 * Everything the resolver needs about one candidate (a, b) pair.
 *
 * @param separation          great-circle separation, degrees
 * @param astrometric         match likelihood G entering the score, per square degree
 * @param photometric         photometric counterpart likelihood c
 * @param counterpartPrior    counterpart prior density Nc, per square degree
 * @param contamination       likelihoods per contamination scenario
 * @param contaminationFluxA  average contaminating flux of the a source (0 without perturbation grids)
 * @param contaminationFluxB  average contaminating flux of the b source (0 without perturbation grids)
 * @param contaminationProbA  per flux-cut level probability that the a source is contaminated
 * @param contaminationProbB  per flux-cut level probability that the b source is contaminated
 */
public record PairLikelihood(
        double separation,
        double astrometric,
        double photometric,
        double counterpartPrior,
        ContaminatedMatchLikelihoods contamination,
        double contaminationFluxA,
        double contaminationFluxB,
        double[] contaminationProbA,
        double[] contaminationProbB
) {
    /** Score factor {@code Nc * G * c}; exactly 0 when {@code Nc} or {@code c} is 0, even for an infinite G. */
    public double factor() {
        if (counterpartPrior == 0.0 || photometric == 0.0) {
            return 0.0;
        }
        return counterpartPrior * astrometric * photometric;
    }

    /** Whether the counterpart prior allows this pair at all. */
    public boolean permitted() {
        return counterpartPrior > 0.0;
    }

    /** Score factor with the prior replaced by 1. */
    public double likelihoodOnly() {
        if (photometric == 0.0) {
            return 0.0;
        }
        return astrometric * photometric;
    }
}
