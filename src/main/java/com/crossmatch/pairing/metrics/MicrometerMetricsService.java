package com.crossmatch.pairing.metrics;

import com.crossmatch.pairing.accumulate.ReconciliationWarning;
import com.crossmatch.pairing.hypothesis.OversizedIslandPolicy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code pairing.run.duration}: Timer (tag: cancelled)</li>
 *   <li>{@code pairing.chunk.duration}: Timer</li>
 *   <li>{@code pairing.islands.resolved}: Counter</li>
 *   <li>{@code pairing.islands.degenerate}: Counter</li>
 *   <li>{@code pairing.islands.oversized}: Counter (tag: policy)</li>
 *   <li>{@code pairing.island.hypotheses}: DistributionSummary</li>
 *   <li>{@code pairing.counterpart.probability}: DistributionSummary</li>
 *   <li>{@code pairing.reconciliation.warnings}: Counter (tags: catalogue, direction)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer chunkTimer;
    private final Counter islandsResolved;
    private final Counter degenerateIslands;
    private final DistributionSummary hypothesisSummary;
    private final DistributionSummary probabilitySummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.chunkTimer = Timer.builder("pairing.chunk.duration")
                .description("Duration of resolving one chunk of islands")
                .register(registry);
        this.islandsResolved = Counter.builder("pairing.islands.resolved")
                .description("Number of islands resolved")
                .register(registry);
        this.degenerateIslands = Counter.builder("pairing.islands.degenerate")
                .description("Islands whose normalising integral was zero or not finite")
                .register(registry);
        this.hypothesisSummary = DistributionSummary.builder("pairing.island.hypotheses")
                .description("Number of hypotheses enumerated per island")
                .register(registry);
        this.probabilitySummary = DistributionSummary.builder("pairing.counterpart.probability")
                .description("Posterior probability of accepted counterparts")
                .register(registry);
    }

    @Override
    public void recordRunDuration(Duration duration, boolean cancelled) {
        String key = "run:" + cancelled;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("pairing.run.duration")
                        .description("Duration of complete pairing runs")
                        .tag("cancelled", Boolean.toString(cancelled))
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordChunkDuration(Duration duration) {
        chunkTimer.record(duration);
    }

    @Override
    public void incrementIslandsResolved(int count) {
        islandsResolved.increment(count);
    }

    @Override
    public void recordHypothesisCount(long count) {
        hypothesisSummary.record(count);
    }

    @Override
    public void incrementDegenerateIslands() {
        degenerateIslands.increment();
    }

    @Override
    public void incrementOversizedIslands(OversizedIslandPolicy policy) {
        String key = "oversized:" + policy.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("pairing.islands.oversized")
                        .description("Islands exceeding the enumeration bound")
                        .tag("policy", policy.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordCounterpartProbability(double probability) {
        probabilitySummary.record(probability);
    }

    @Override
    public void incrementReconciliationWarning(ReconciliationWarning warning) {
        String key = "reconcile:" + warning.catalogue().name() + ":" + warning.direction().name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("pairing.reconciliation.warnings")
                        .description("Source accounting mismatches after reconciliation")
                        .tag("catalogue", warning.catalogue().label())
                        .tag("direction", warning.direction().name())
                        .register(registry));
        counter.increment(warning.count());
    }
}
