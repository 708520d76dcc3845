package com.crossmatch.pairing.likelihood;

import com.crossmatch.pairing.core.model.Source;

/**
 * Photometry switched off: every likelihood is 1, so only astrometry and priors decide.
 */
public class NoOpPhotometricLikelihood implements PhotometricLikelihood {

    public static final NoOpPhotometricLikelihood INSTANCE = new NoOpPhotometricLikelihood();

    @Override
    public double counterpart(Source a, Source b) {
        return 1.0;
    }

    @Override
    public double field(Source source) {
        return 1.0;
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
