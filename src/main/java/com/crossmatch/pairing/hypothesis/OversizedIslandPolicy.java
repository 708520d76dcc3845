package com.crossmatch.pairing.hypothesis;

/**
 * What a run does with an island too large to enumerate.
 */
public enum OversizedIslandPolicy {
    /** Abort the run with {@link OversizedIslandException}. */
    FAIL,
    /** Log, count and record the island as an anomaly; its sources stay unrecorded. */
    FLAG
}
