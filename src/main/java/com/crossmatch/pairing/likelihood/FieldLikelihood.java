package com.crossmatch.pairing.likelihood;

/**
 * Factor an unpaired source contributes to a hypothesis score.
 *
 * @param prior       field prior density, per square degree
 * @param photometric photometric field likelihood (1 when photometry is off)
 */
public record FieldLikelihood(double prior, double photometric) {

    public double factor() {
        if (prior == 0.0) {
            return 0.0;
        }
        return prior * photometric;
    }

    public boolean permitted() {
        return prior > 0.0;
    }
}
