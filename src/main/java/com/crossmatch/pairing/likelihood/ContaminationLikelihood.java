package com.crossmatch.pairing.likelihood;

import java.util.Objects;

/**
 * Perturbation-aware match likelihoods from the sources' fourier kernels.
 *
 * <p>Each scenario is the inverse Hankel transform of the relevant kernel product
 * times the Gaussian term {@code exp(-2 pi^2 rho^2 (sigmaA^2 + sigmaB^2))}.
 * Inputs are in arcseconds; outputs are converted to per square degree.</p>
 */
public class ContaminationLikelihood {

    private static final double SQ_ARCSEC_PER_SQ_DEGREE =
            SkySeparation.ARCSEC_PER_DEGREE * SkySeparation.ARCSEC_PER_DEGREE;

    private final FrequencyGrid grid;

    public ContaminationLikelihood(FrequencyGrid grid) {
        this.grid = Objects.requireNonNull(grid, "grid is required");
    }

    public FrequencyGrid grid() {
        return grid;
    }

    /**
     * @param separationArcsec pair separation, arcsec
     * @param sigmaAArcsec     catalogue a uncertainty, arcsec
     * @param sigmaBArcsec     catalogue b uncertainty, arcsec
     * @param kernelA          catalogue a fourier kernel on the grid
     * @param kernelB          catalogue b fourier kernel on the grid
     */
    public ContaminatedMatchLikelihoods compute(double separationArcsec, double sigmaAArcsec, double sigmaBArcsec,
                                                double[] kernelA, double[] kernelB) {
        int n = grid.size();
        if (kernelA.length != n || kernelB.length != n) {
            throw new IllegalArgumentException("Kernels must hold " + n + " samples, got "
                    + kernelA.length + " and " + kernelB.length);
        }
        double s2 = sigmaAArcsec * sigmaAArcsec + sigmaBArcsec * sigmaBArcsec;
        double[] cc = new double[n];
        double[] cn = new double[n];
        double[] nc = new double[n];
        double[] nn = new double[n];
        for (int i = 0; i < n; i++) {
            double rho = grid.rho(i);
            double gamma = Math.exp(-2.0 * Math.PI * Math.PI * rho * rho * s2);
            cc[i] = gamma * kernelA[i] * kernelB[i];
            cn[i] = gamma * kernelA[i];
            nc[i] = gamma * kernelB[i];
            nn[i] = gamma;
        }
        double[] g = HankelTransform.inverse(grid, separationArcsec, cc, cn, nc, nn);
        // truncated integrals can ring slightly negative in the far tail
        return new ContaminatedMatchLikelihoods(
                Math.max(0.0, SQ_ARCSEC_PER_SQ_DEGREE * g[0]),
                Math.max(0.0, SQ_ARCSEC_PER_SQ_DEGREE * g[1]),
                Math.max(0.0, SQ_ARCSEC_PER_SQ_DEGREE * g[2]),
                Math.max(0.0, SQ_ARCSEC_PER_SQ_DEGREE * g[3]));
    }
}
