package com.crossmatch.pairing.batch;

/**
 * A contiguous range {@code [fromIsland, toIsland)} of islands processed by one worker.
 */
public record Chunk(int index, int fromIsland, int toIsland) {
    public Chunk {
        if (index < 0 || fromIsland < 0 || toIsland < fromIsland) {
            throw new IllegalArgumentException("Invalid chunk " + index + " [" + fromIsland + ", " + toIsland + ")");
        }
    }

    public int size() {
        return toIsland - fromIsland;
    }
}
