package com.crossmatch.pairing.grid;

import com.crossmatch.pairing.core.model.ModelReference;
import com.crossmatch.pairing.store.DoubleStore;
import com.crossmatch.pairing.store.HeapDoubleStore;
import com.crossmatch.pairing.store.MappedDoubleStore;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Read-only cube holding one fixed-length curve per (density, filter, pointing) cell.
 *
 * <p>Values are laid out in (density, filter, pointing, curve) order, curve fastest.
 * A cube with curve length 1 holds one scalar per cell.</p>
 */
public final class CurveCube {

    private final int densityCount;
    private final int filterCount;
    private final int pointingCount;
    private final int curveLength;
    private final DoubleStore store;

    private CurveCube(int densityCount, int filterCount, int pointingCount, int curveLength, DoubleStore store) {
        if (densityCount <= 0 || filterCount <= 0 || pointingCount <= 0 || curveLength <= 0) {
            throw new IllegalArgumentException("Cube dimensions must be positive, got "
                    + densityCount + "x" + filterCount + "x" + pointingCount + "x" + curveLength);
        }
        long expected = (long) densityCount * filterCount * pointingCount * curveLength;
        if (store.length() != expected) {
            throw new IllegalArgumentException("Store holds " + store.length() + " values, cube "
                    + densityCount + "x" + filterCount + "x" + pointingCount + "x" + curveLength
                    + " needs " + expected);
        }
        this.densityCount = densityCount;
        this.filterCount = filterCount;
        this.pointingCount = pointingCount;
        this.curveLength = curveLength;
        this.store = store;
    }

    public static CurveCube of(int densityCount, int filterCount, int pointingCount, int curveLength,
                               DoubleStore store) {
        Objects.requireNonNull(store, "store is required");
        return new CurveCube(densityCount, filterCount, pointingCount, curveLength, store);
    }

    /**
     * Heap-resident cube over a copy of {@code values}.
     */
    public static CurveCube heap(int densityCount, int filterCount, int pointingCount, int curveLength,
                                 double... values) {
        return of(densityCount, filterCount, pointingCount, curveLength, HeapDoubleStore.of(values));
    }

    /**
     * Cube served from a memory-mapped little-endian float64 file.
     */
    public static CurveCube mapped(int densityCount, int filterCount, int pointingCount, int curveLength,
                                   Path file) {
        return of(densityCount, filterCount, pointingCount, curveLength, MappedDoubleStore.open(file));
    }

    /**
     * Cube where every cell holds the same curve.
     */
    public static CurveCube uniform(int densityCount, int filterCount, int pointingCount, double... curve) {
        Objects.requireNonNull(curve, "curve is required");
        int cells = densityCount * filterCount * pointingCount;
        double[] values = new double[cells * curve.length];
        for (int cell = 0; cell < cells; cell++) {
            System.arraycopy(curve, 0, values, cell * curve.length, curve.length);
        }
        return heap(densityCount, filterCount, pointingCount, curve.length, values);
    }

    /**
     * Single-cell scalar cube, for references (0, 0, 0).
     */
    public static CurveCube scalar(double value) {
        return heap(1, 1, 1, 1, value);
    }

    public int densityCount() {
        return densityCount;
    }

    public int filterCount() {
        return filterCount;
    }

    public int pointingCount() {
        return pointingCount;
    }

    public int curveLength() {
        return curveLength;
    }

    public boolean isMapped() {
        return store.isMapped();
    }

    public boolean contains(ModelReference ref) {
        return ref.densityIndex() < densityCount
                && ref.filterIndex() < filterCount
                && ref.pointingIndex() < pointingCount;
    }

    /**
     * @throws IndexOutOfBoundsException if the reference lies outside the cube
     */
    public void validate(ModelReference ref) {
        if (!contains(ref)) {
            throw new IndexOutOfBoundsException("Model reference " + ref + " outside cube of shape ("
                    + densityCount + ", " + filterCount + ", " + pointingCount + ")");
        }
    }

    public double[] curve(ModelReference ref) {
        return store.slice(offset(ref), curveLength);
    }

    public double value(ModelReference ref, int position) {
        Objects.checkIndex(position, curveLength);
        return store.get(offset(ref) + position);
    }

    /**
     * The cell's only value; the cube must have curve length 1.
     */
    public double scalar(ModelReference ref) {
        if (curveLength != 1) {
            throw new IllegalStateException("Cube holds curves of length " + curveLength + ", not scalars");
        }
        return store.get(offset(ref));
    }

    /**
     * Smallest value held anywhere in the cube, NaN if any value is NaN.
     */
    public double minimum() {
        double min = Double.POSITIVE_INFINITY;
        for (long i = 0; i < store.length(); i++) {
            double v = store.get(i);
            if (Double.isNaN(v)) {
                return Double.NaN;
            }
            min = Math.min(min, v);
        }
        return min;
    }

    private long offset(ModelReference ref) {
        validate(ref);
        long cell = ((long) ref.densityIndex() * filterCount + ref.filterIndex()) * pointingCount
                + ref.pointingIndex();
        return cell * curveLength;
    }

    @Override
    public String toString() {
        return "CurveCube{" + densityCount + "x" + filterCount + "x" + pointingCount +
                ", curveLength=" + curveLength +
                ", mapped=" + store.isMapped() + '}';
    }
}
