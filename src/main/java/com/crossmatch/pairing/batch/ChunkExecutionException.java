package com.crossmatch.pairing.batch;

/**
 * Thrown when a chunk fails with a checked exception or the run is interrupted.
 * Unchecked worker failures propagate unwrapped.
 */
public class ChunkExecutionException extends RuntimeException {

    public ChunkExecutionException(String message) {
        super(message);
    }

    public ChunkExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
