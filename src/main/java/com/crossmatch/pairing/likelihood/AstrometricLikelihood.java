package com.crossmatch.pairing.likelihood;

/**
 * Closed-form 2-D Gaussian match likelihood.
 */
public final class AstrometricLikelihood {

    private AstrometricLikelihood() {
    }

    /**
     * {@code 1/(2 pi s2) exp(-sep^2 / (2 s2))} with {@code s2 = sigmaA^2 + sigmaB^2}.
     * Units are the inverse square of the separation's units.
     *
     * <p>With zero combined uncertainty the likelihood degenerates to a delta:
     * infinite at zero separation and zero elsewhere.</p>
     */
    public static double gaussian(double separation, double sigmaA, double sigmaB) {
        double s2 = sigmaA * sigmaA + sigmaB * sigmaB;
        if (s2 == 0.0) {
            return separation == 0.0 ? Double.POSITIVE_INFINITY : 0.0;
        }
        return Math.exp(-separation * separation / (2.0 * s2)) / (2.0 * Math.PI * s2);
    }
}
