package com.crossmatch.pairing.hypothesis;

import java.util.Arrays;

/**
 * One complete assignment within an island: each catalogue a position is paired
 * with a distinct catalogue b position or left as field ({@link #FIELD}).
 * Positions are island-local, not catalogue indices.
 */
public final class Hypothesis {

    public static final int FIELD = -1;

    private final int[] pairing;
    private final int bCount;

    public Hypothesis(int[] pairing, int bCount) {
        this.pairing = pairing.clone();
        this.bCount = bCount;
        boolean[] used = new boolean[bCount];
        for (int a = 0; a < this.pairing.length; a++) {
            int b = this.pairing[a];
            if (b == FIELD) {
                continue;
            }
            if (b < 0 || b >= bCount || used[b]) {
                throw new IllegalArgumentException("Invalid pairing " + Arrays.toString(pairing)
                        + " for " + bCount + " b sources");
            }
            used[b] = true;
        }
    }

    public int aCount() {
        return pairing.length;
    }

    public int bCount() {
        return bCount;
    }

    /**
     * Position of the b source paired with {@code aPosition}, or {@link #FIELD}.
     */
    public int partnerOf(int aPosition) {
        return pairing[aPosition];
    }

    public int pairCount() {
        int n = 0;
        for (int b : pairing) {
            if (b != FIELD) {
                n++;
            }
        }
        return n;
    }

    public boolean isAllField() {
        return pairCount() == 0;
    }

    public boolean isPairedB(int bPosition) {
        for (int b : pairing) {
            if (b == bPosition) {
                return true;
            }
        }
        return false;
    }

    public int[] pairing() {
        return pairing.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Hypothesis other)) return false;
        return bCount == other.bCount && Arrays.equals(pairing, other.pairing);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(pairing) + bCount;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Hypothesis{");
        boolean first = true;
        for (int a = 0; a < pairing.length; a++) {
            if (pairing[a] == FIELD) {
                continue;
            }
            if (!first) {
                sb.append(", ");
            }
            sb.append('a').append(a).append("-b").append(pairing[a]);
            first = false;
        }
        return sb.append(first ? "all field}" : "}").toString();
    }
}
