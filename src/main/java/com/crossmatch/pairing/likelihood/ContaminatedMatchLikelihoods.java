package com.crossmatch.pairing.likelihood;

import java.util.Objects;

/**
 * Match likelihoods of a pair under each contamination scenario, per square degree.
 *
 * @param gcc both sources perturbed
 * @param gcn only the catalogue a source perturbed
 * @param gnc only the catalogue b source perturbed
 * @param gnn neither perturbed
 */
public record ContaminatedMatchLikelihoods(double gcc, double gcn, double gnc, double gnn) {

    /**
     * All four scenarios sharing one likelihood, used when perturbation is not modelled.
     */
    public static ContaminatedMatchLikelihoods unperturbed(double g) {
        return new ContaminatedMatchLikelihoods(g, g, g, g);
    }

    /**
     * Probability, per flux-cut level, that each source of the pair is contaminated.
     * Levels whose total weight is zero get probability zero.
     *
     * @return two arrays, catalogue a first
     */
    public double[][] contaminationProbabilities(double[] fractionsA, double[] fractionsB) {
        Objects.requireNonNull(fractionsA, "fractionsA is required");
        Objects.requireNonNull(fractionsB, "fractionsB is required");
        if (fractionsA.length != fractionsB.length) {
            throw new IllegalArgumentException("Flux-level counts differ: " + fractionsA.length
                    + " vs " + fractionsB.length);
        }
        double[] probA = new double[fractionsA.length];
        double[] probB = new double[fractionsA.length];
        for (int k = 0; k < fractionsA.length; k++) {
            double pa = fractionsA[k];
            double pb = fractionsB[k];
            double both = gcc * pa * pb;
            double onlyA = gcn * pa * (1.0 - pb);
            double onlyB = gnc * (1.0 - pa) * pb;
            double neither = gnn * (1.0 - pa) * (1.0 - pb);
            double total = both + onlyA + onlyB + neither;
            if (total != 0.0) {
                probA[k] = (both + onlyA) / total;
                probB[k] = (both + onlyB) / total;
            }
        }
        return new double[][]{probA, probB};
    }
}
