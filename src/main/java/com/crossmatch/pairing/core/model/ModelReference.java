package com.crossmatch.pairing.core.model;

/**
 * Index triple pointing a source into its catalogue's precomputed grids.
 *
 * @param densityIndex  normalising-density (or density-magnitude) bin
 * @param filterIndex   filter the grids were simulated in
 * @param pointingIndex sky pointing the grids were simulated at
 */
public record ModelReference(int densityIndex, int filterIndex, int pointingIndex) {
    public ModelReference {
        if (densityIndex < 0 || filterIndex < 0 || pointingIndex < 0) {
            throw new IllegalArgumentException("Model reference indices must be non-negative, got ("
                    + densityIndex + ", " + filterIndex + ", " + pointingIndex + ")");
        }
    }

    public static ModelReference of(int densityIndex, int filterIndex, int pointingIndex) {
        return new ModelReference(densityIndex, filterIndex, pointingIndex);
    }

    @Override
    public String toString() {
        return "(" + densityIndex + ", " + filterIndex + ", " + pointingIndex + ")";
    }
}
