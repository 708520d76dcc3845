package com.crossmatch.pairing.core.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * A single catalogue detection. Immutable once loaded.
 *
 * @param catalogue      catalogue the source belongs to
 * @param index          catalogue-wide zero-based index
 * @param longitude      first sky coordinate, degrees
 * @param latitude       second sky coordinate, degrees
 * @param uncertainty    1-sigma circular positional uncertainty, degrees
 * @param magnitudes     per-filter magnitudes (NaN where undetected)
 * @param bestFilter     index into {@code magnitudes} of the filter used for photometry
 * @param modelReference reference into the catalogue's grids
 */
public record Source(
        Catalogue catalogue,
        int index,
        double longitude,
        double latitude,
        double uncertainty,
        double[] magnitudes,
        int bestFilter,
        ModelReference modelReference
) {
    public Source {
        Objects.requireNonNull(catalogue, "catalogue is required");
        Objects.requireNonNull(modelReference, "modelReference is required");
        Objects.requireNonNull(magnitudes, "magnitudes is required");
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative");
        }
        if (!(uncertainty >= 0.0)) {
            throw new IllegalArgumentException("uncertainty must be non-negative, got " + uncertainty);
        }
        if (bestFilter < 0 || bestFilter >= magnitudes.length) {
            throw new IllegalArgumentException("bestFilter " + bestFilter
                    + " outside magnitude vector of length " + magnitudes.length);
        }
        magnitudes = magnitudes.clone();
    }

    @Override
    public double[] magnitudes() {
        return magnitudes.clone();
    }

    /**
     * Magnitude in the source's best filter.
     */
    public double bestMagnitude() {
        return magnitudes[bestFilter];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Source other)) return false;
        return catalogue == other.catalogue
                && index == other.index
                && Double.compare(longitude, other.longitude) == 0
                && Double.compare(latitude, other.latitude) == 0
                && Double.compare(uncertainty, other.uncertainty) == 0
                && bestFilter == other.bestFilter
                && Arrays.equals(magnitudes, other.magnitudes)
                && modelReference.equals(other.modelReference);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(catalogue, index, longitude, latitude, uncertainty, bestFilter, modelReference);
        return 31 * result + Arrays.hashCode(magnitudes);
    }

    @Override
    public String toString() {
        return "Source{" + catalogue.label() + index +
                ", lon=" + longitude +
                ", lat=" + latitude +
                ", sigma=" + uncertainty +
                ", ref=" + modelReference + '}';
    }
}
