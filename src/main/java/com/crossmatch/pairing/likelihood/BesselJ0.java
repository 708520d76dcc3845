package com.crossmatch.pairing.likelihood;

/**
 * Zeroth-order Bessel function of the first kind.
 *
 * <p>Rational approximation below |x| = 8 and the asymptotic phase-amplitude
 * form above it (Numerical Recipes, 2nd ed., section 6.5). Absolute error is
 * below 1e-8 over the real line.</p>
 */
public final class BesselJ0 {

    private BesselJ0() {
    }

    public static double value(double x) {
        double ax = Math.abs(x);
        if (ax < 8.0) {
            double y = x * x;
            double num = 57568490574.0 + y * (-13362590354.0 + y * (651619640.7
                    + y * (-11214424.18 + y * (77392.33017 + y * (-184.9052456)))));
            double den = 57568490411.0 + y * (1029532985.0 + y * (9494680.718
                    + y * (59272.64853 + y * (267.8532712 + y))));
            return num / den;
        }
        double z = 8.0 / ax;
        double y = z * z;
        double xx = ax - 0.785398164;
        double p = 1.0 + y * (-0.1098628627e-2 + y * (0.2734510407e-4
                + y * (-0.2073370639e-5 + y * 0.2093887211e-6)));
        double q = -0.1562499995e-1 + y * (0.1430488765e-3
                + y * (-0.6911147651e-5 + y * (0.7621095161e-6 - y * 0.934935152e-7)));
        return Math.sqrt(0.636619772 / ax) * (Math.cos(xx) * p - z * Math.sin(xx) * q);
    }
}
