package com.crossmatch.pairing.hypothesis;

import com.crossmatch.pairing.core.model.Island;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Enumerates every partial bijection between an island's a and b sources.
 *
 * <p>Depth-first over a positions; each position is tried as field first, then
 * paired with each unused b position in ascending order. The first hypothesis
 * visited is therefore always the all-field one, and the order is deterministic.</p>
 */
public class HypothesisEnumerator {

    public static final int DEFAULT_MAX_ISLAND_SIZE = 14;

    private final int maxIslandSize;

    public HypothesisEnumerator() {
        this(DEFAULT_MAX_ISLAND_SIZE);
    }

    public HypothesisEnumerator(int maxIslandSize) {
        if (maxIslandSize <= 0) {
            throw new IllegalArgumentException("maxIslandSize must be positive");
        }
        this.maxIslandSize = maxIslandSize;
    }

    public int getMaxIslandSize() {
        return maxIslandSize;
    }

    /**
     * @throws OversizedIslandException if the island exceeds the enumeration bound
     */
    public void checkBound(Island island) {
        if (island.size() > maxIslandSize) {
            throw new OversizedIslandException(island.index(), island.aCount(), island.bCount(), maxIslandSize);
        }
    }

    /**
     * Visits every hypothesis for {@code m} a and {@code n} b sources.
     *
     * @return number of hypotheses visited
     */
    public long forEach(int m, int n, HypothesisVisitor visitor) {
        if (m < 0 || n < 0) {
            throw new IllegalArgumentException("Source counts must be non-negative");
        }
        if (m + n > maxIslandSize) {
            throw new IllegalArgumentException(m + "+" + n + " sources exceed the enumeration bound of "
                    + maxIslandSize);
        }
        int[] pairing = new int[m];
        Arrays.fill(pairing, Hypothesis.FIELD);
        return descend(0, pairing, new boolean[n], visitor);
    }

    /**
     * Materialises every hypothesis, in enumeration order.
     */
    public List<Hypothesis> enumerate(int m, int n) {
        List<Hypothesis> out = new ArrayList<>();
        forEach(m, n, (pairing, bUsed) -> out.add(new Hypothesis(pairing, n)));
        return out;
    }

    /**
     * Number of partial bijections: sum over k of C(m,k) C(n,k) k!.
     */
    public static long count(int m, int n) {
        long total = 0;
        long term = 1;
        for (int k = 0; k <= Math.min(m, n); k++) {
            total += term;
            term = term * (m - k) * (n - k) / (k + 1);
        }
        return total;
    }

    private long descend(int a, int[] pairing, boolean[] bUsed, HypothesisVisitor visitor) {
        if (a == pairing.length) {
            visitor.visit(pairing, bUsed);
            return 1;
        }
        long visited = descend(a + 1, pairing, bUsed, visitor);
        for (int b = 0; b < bUsed.length; b++) {
            if (bUsed[b]) {
                continue;
            }
            bUsed[b] = true;
            pairing[a] = b;
            visited += descend(a + 1, pairing, bUsed, visitor);
            pairing[a] = Hypothesis.FIELD;
            bUsed[b] = false;
        }
        return visited;
    }
}
