package com.crossmatch.pairing.likelihood;

import com.crossmatch.pairing.core.model.Source;

/**
 * Photometric likelihoods entering the pair and field factors of a hypothesis score.
 * {@link NoOpPhotometricLikelihood} disables photometry by returning 1 everywhere.
 */
public interface PhotometricLikelihood {

    /** Likelihood {@code c} that the two sources' magnitudes come from one object. */
    double counterpart(Source a, Source b);

    /** Likelihood {@code f} of the source's magnitude as an unmatched field source. */
    double field(Source source);

    boolean isEnabled();
}
