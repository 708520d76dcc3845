package com.crossmatch.pairing.likelihood;

import java.util.Objects;

/**
 * Inverse zeroth-order Hankel transform of a circularly symmetric fourier-space function:
 * {@code f(r) = sum 2 pi rho F(rho) J0(2 pi rho r) drho}.
 */
public final class HankelTransform {

    private HankelTransform() {
    }

    /**
     * @param fourier samples of F on the grid
     * @param grid    frequency grid in inverse arcseconds
     * @param radius  radius in arcseconds
     * @return f(radius) per square arcsecond
     */
    public static double inverse(double[] fourier, FrequencyGrid grid, double radius) {
        return inverse(grid, radius, fourier)[0];
    }

    /**
     * Transforms several functions at one radius, evaluating J0 once per frequency sample.
     *
     * @return f(radius) per square arcsecond, one value per function in argument order
     */
    public static double[] inverse(FrequencyGrid grid, double radius, double[]... fouriers) {
        Objects.requireNonNull(grid, "grid is required");
        int n = grid.size();
        for (double[] fourier : fouriers) {
            Objects.requireNonNull(fourier, "fourier is required");
            if (fourier.length != n) {
                throw new IllegalArgumentException("Expected " + n + " fourier samples, got " + fourier.length);
            }
        }
        double[] sums = new double[fouriers.length];
        for (int i = 0; i < n; i++) {
            double rho = grid.rho(i);
            double w = rho * BesselJ0.value(2.0 * Math.PI * rho * radius) * grid.drho(i);
            for (int k = 0; k < fouriers.length; k++) {
                sums[k] += w * fouriers[k][i];
            }
        }
        for (int k = 0; k < sums.length; k++) {
            sums[k] *= 2.0 * Math.PI;
        }
        return sums;
    }
}
