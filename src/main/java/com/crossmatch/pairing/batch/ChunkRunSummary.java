package com.crossmatch.pairing.batch;

/**
 * How far a scheduler run got.
 */
public record ChunkRunSummary(int totalChunks, int dispatched, int completed, boolean cancelled) {
}
