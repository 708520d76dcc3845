package com.crossmatch.pairing.metrics;

import com.crossmatch.pairing.accumulate.ReconciliationWarning;
import com.crossmatch.pairing.hypothesis.OversizedIslandPolicy;

import java.time.Duration;

/**
 * Interface for recording pairing metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordRunDuration(Duration duration, boolean cancelled);

    void recordChunkDuration(Duration duration);

    void incrementIslandsResolved(int count);

    void recordHypothesisCount(long count);

    void incrementDegenerateIslands();

    void incrementOversizedIslands(OversizedIslandPolicy policy);

    void recordCounterpartProbability(double probability);

    void incrementReconciliationWarning(ReconciliationWarning warning);
}
