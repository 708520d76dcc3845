package com.crossmatch.pairing.likelihood;

import com.crossmatch.pairing.core.model.Source;
import com.crossmatch.pairing.grid.PhotometricLikelihoodCubes;

import java.util.Objects;

/**
 * Photometric likelihoods read from precomputed magnitude-binned cubes.
 */
public class CubePhotometricLikelihood implements PhotometricLikelihood {

    private final PhotometricLikelihoodCubes cubes;

    public CubePhotometricLikelihood(PhotometricLikelihoodCubes cubes) {
        this.cubes = Objects.requireNonNull(cubes, "cubes is required");
    }

    @Override
    public double counterpart(Source a, Source b) {
        return cubes.counterpartLikelihood(a, b);
    }

    @Override
    public double field(Source source) {
        return cubes.fieldLikelihood(source);
    }

    @Override
    public boolean isEnabled() {
        return true;
    }
}
