package com.crossmatch.pairing.accumulate;

import com.crossmatch.pairing.core.model.Catalogue;

import java.util.Objects;

/**
 * A catalogue whose recorded source count does not balance.
 *
 * @param catalogue the catalogue side
 * @param direction whether too few or too many sources were recorded
 * @param count     size of the discrepancy
 */
public record ReconciliationWarning(Catalogue catalogue, Direction direction, int count) {

    public enum Direction {
        /** Sources in neither the counterpart, field nor rejected lists. */
        MISSING,
        /** More indices recorded than the catalogue holds. */
        SURPLUS
    }

    public ReconciliationWarning {
        Objects.requireNonNull(catalogue, "catalogue is required");
        Objects.requireNonNull(direction, "direction is required");
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive");
        }
    }

    public String message() {
        String side = "catalogue " + catalogue.label();
        if (direction == Direction.MISSING) {
            return count + " " + side + (count == 1 ? " source" : " sources")
                    + " not in either counterpart, field, or rejected source lists";
        }
        return count + " additional " + side + (count == 1 ? " index" : " indices")
                + " recorded, check results for duplications";
    }

    @Override
    public String toString() {
        return message();
    }
}
