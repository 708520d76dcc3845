package com.crossmatch.pairing.store;

import java.util.Arrays;
import java.util.Objects;

/**
 * {@link DoubleStore} backed by a heap array.
 */
public final class HeapDoubleStore implements DoubleStore {

    private final double[] values;

    private HeapDoubleStore(double[] values) {
        this.values = values;
    }

    /**
     * Wraps a defensive copy of the given values.
     */
    public static HeapDoubleStore of(double... values) {
        Objects.requireNonNull(values, "values is required");
        return new HeapDoubleStore(values.clone());
    }

    /**
     * Store of the given length with every value set to {@code fill}.
     */
    public static HeapDoubleStore filled(int length, double fill) {
        double[] values = new double[length];
        Arrays.fill(values, fill);
        return new HeapDoubleStore(values);
    }

    @Override
    public long length() {
        return values.length;
    }

    @Override
    public double get(long offset) {
        return values[Math.toIntExact(offset)];
    }

    @Override
    public double[] slice(long offset, int count) {
        int from = Math.toIntExact(offset);
        Objects.checkFromIndexSize(from, count, values.length);
        return Arrays.copyOfRange(values, from, from + count);
    }

    @Override
    public boolean isMapped() {
        return false;
    }
}
