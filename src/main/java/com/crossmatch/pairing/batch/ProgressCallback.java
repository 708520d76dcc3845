package com.crossmatch.pairing.batch;

/**
 * Callback for tracking progress of a pairing run or an export.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param processed units processed so far (chunks for a run, records for an export)
     * @param total     total units, -1 if unknown
     * @param message   progress message
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};
}
