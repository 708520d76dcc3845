package com.crossmatch.pairing.batch;

/**
 * An island that could not be resolved and was flagged instead.
 */
public record IslandAnomaly(int islandIndex, int aCount, int bCount, String reason) {
}
