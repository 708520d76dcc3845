package com.crossmatch.pairing.batch;

/**
 * Receives finished chunks on the thread that called {@link ChunkScheduler#run}.
 */
@FunctionalInterface
public interface ChunkListener {

    void onChunk(ChunkResult result);
}
