package com.crossmatch.pairing.core.model;

import java.util.Arrays;

/**
 * A group of mutually-reachable candidate matches across both catalogues.
 * An island may hold sources from only one catalogue ("lonely" sources)
 * or none at all (a group fully rejected upstream).
 *
 * @param index    position of the island in the grouping stage's output
 * @param aIndices catalogue-wide indices of the island's catalogue a sources
 * @param bIndices catalogue-wide indices of the island's catalogue b sources
 */
public record Island(int index, int[] aIndices, int[] bIndices) {
    public Island {
        if (index < 0) {
            throw new IllegalArgumentException("island index must be non-negative");
        }
        aIndices = aIndices != null ? aIndices.clone() : new int[0];
        bIndices = bIndices != null ? bIndices.clone() : new int[0];
        for (int a : aIndices) {
            if (a < 0) {
                throw new IllegalArgumentException("Island " + index + " holds negative a index " + a);
            }
        }
        for (int b : bIndices) {
            if (b < 0) {
                throw new IllegalArgumentException("Island " + index + " holds negative b index " + b);
            }
        }
    }

    @Override
    public int[] aIndices() {
        return aIndices.clone();
    }

    @Override
    public int[] bIndices() {
        return bIndices.clone();
    }

    public int aCount() {
        return aIndices.length;
    }

    public int bCount() {
        return bIndices.length;
    }

    public int aIndex(int position) {
        return aIndices[position];
    }

    public int bIndex(int position) {
        return bIndices[position];
    }

    /**
     * Total number of sources across both catalogues.
     */
    public int size() {
        return aIndices.length + bIndices.length;
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Island other)) return false;
        return index == other.index
                && Arrays.equals(aIndices, other.aIndices)
                && Arrays.equals(bIndices, other.bIndices);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * index + Arrays.hashCode(aIndices)) + Arrays.hashCode(bIndices);
    }

    @Override
    public String toString() {
        return "Island{" + index +
                ", a=" + Arrays.toString(aIndices) +
                ", b=" + Arrays.toString(bIndices) + '}';
    }
}
