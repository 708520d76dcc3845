package com.crossmatch.pairing.batch;

/**
 * Processes every island of a chunk on a worker thread.
 */
@FunctionalInterface
public interface ChunkWorker {

    ChunkResult process(Chunk chunk);
}
