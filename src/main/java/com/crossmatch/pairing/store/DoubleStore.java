package com.crossmatch.pairing.store;

/**
 * Read-only flat array of doubles addressed by a long offset.
 * Implementations must tolerate concurrent readers without locking.
 */
public interface DoubleStore {

    long length();

    double get(long offset);

    /**
     * Copies {@code count} consecutive values starting at {@code offset}.
     */
    default double[] slice(long offset, int count) {
        if (offset < 0 || count < 0 || offset + count > length()) {
            throw new IndexOutOfBoundsException("slice [" + offset + ", " + (offset + count)
                    + ") outside store of length " + length());
        }
        double[] out = new double[count];
        for (int i = 0; i < count; i++) {
            out[i] = get(offset + i);
        }
        return out;
    }

    /**
     * Whether values are served from a memory-mapped file rather than the heap.
     */
    boolean isMapped();
}
