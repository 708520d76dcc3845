package com.crossmatch.pairing.resolution;

import com.crossmatch.pairing.core.model.Catalogue;

import java.util.Objects;

/**
 * A source left without a counterpart.
 *
 * @param catalogue   the source's catalogue
 * @param index       catalogue-wide source index
 * @param probability posterior probability that the source is genuinely unmatched
 */
public record FieldAssignment(Catalogue catalogue, int index, double probability) {
    public FieldAssignment {
        Objects.requireNonNull(catalogue, "catalogue is required");
    }
}
