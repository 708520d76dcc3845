package com.crossmatch.pairing.metrics;

import com.crossmatch.pairing.accumulate.ReconciliationWarning;
import com.crossmatch.pairing.hypothesis.OversizedIslandPolicy;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordRunDuration(Duration duration, boolean cancelled) {
    }

    @Override
    public void recordChunkDuration(Duration duration) {
    }

    @Override
    public void incrementIslandsResolved(int count) {
    }

    @Override
    public void recordHypothesisCount(long count) {
    }

    @Override
    public void incrementDegenerateIslands() {
    }

    @Override
    public void incrementOversizedIslands(OversizedIslandPolicy policy) {
    }

    @Override
    public void recordCounterpartProbability(double probability) {
    }

    @Override
    public void incrementReconciliationWarning(ReconciliationWarning warning) {
    }
}
