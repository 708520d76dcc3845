package com.crossmatch.pairing.batch;

import com.crossmatch.pairing.core.model.Island;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * The grouping stage's islands, in its output order.
 */
public final class IslandMembership {

    private final List<Island> islands;

    private IslandMembership(List<Island> islands) {
        this.islands = List.copyOf(islands);
    }

    public static IslandMembership of(List<Island> islands) {
        Objects.requireNonNull(islands, "islands is required");
        for (int i = 0; i < islands.size(); i++) {
            if (islands.get(i).index() != i) {
                throw new IllegalArgumentException("Island at position " + i + " carries index "
                        + islands.get(i).index());
            }
        }
        return new IslandMembership(islands);
    }

    /**
     * Builds islands from padded per-island lists.
     *
     * @param aLists  catalogue a indices per island, indexed {@code [island][slot]}; slots past the count are padding
     * @param bLists  catalogue b indices per island, same layout
     * @param aCounts number of valid catalogue a slots per island
     * @param bCounts number of valid catalogue b slots per island
     */
    public static IslandMembership fromPaddedLists(int[][] aLists, int[][] bLists, int[] aCounts, int[] bCounts) {
        Objects.requireNonNull(aLists, "aLists is required");
        Objects.requireNonNull(bLists, "bLists is required");
        Objects.requireNonNull(aCounts, "aCounts is required");
        Objects.requireNonNull(bCounts, "bCounts is required");
        int n = aLists.length;
        if (bLists.length != n || aCounts.length != n || bCounts.length != n) {
            throw new IllegalArgumentException("Membership lists disagree on island count: "
                    + n + ", " + bLists.length + ", " + aCounts.length + ", " + bCounts.length);
        }
        List<Island> islands = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            islands.add(new Island(i, slots(aLists[i], aCounts[i], i, "a"), slots(bLists[i], bCounts[i], i, "b")));
        }
        return new IslandMembership(islands);
    }

    public int size() {
        return islands.size();
    }

    public Island get(int index) {
        return islands.get(index);
    }

    public List<Island> islands() {
        return islands;
    }

    /**
     * Islands in {@code [from, to)}.
     */
    public List<Island> range(int from, int to) {
        return islands.subList(from, to);
    }

    public int largestIslandSize() {
        int max = 0;
        for (Island island : islands) {
            max = Math.max(max, island.size());
        }
        return max;
    }

    private static int[] slots(int[] padded, int count, int island, String catalogue) {
        int length = padded == null ? 0 : padded.length;
        if (count < 0 || count > length) {
            throw new IllegalArgumentException("Island " + island + " claims " + count + " catalogue "
                    + catalogue + " sources but its list holds " + length);
        }
        return count == 0 ? new int[0] : Arrays.copyOf(padded, count);
    }
}
