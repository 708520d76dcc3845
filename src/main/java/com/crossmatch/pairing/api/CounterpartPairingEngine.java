package com.crossmatch.pairing.api;

import com.crossmatch.pairing.accumulate.PairingResult;
import com.crossmatch.pairing.accumulate.ReconciliationWarning;
import com.crossmatch.pairing.accumulate.ResultAccumulator;
import com.crossmatch.pairing.batch.Chunk;
import com.crossmatch.pairing.batch.ChunkResult;
import com.crossmatch.pairing.batch.ChunkRunSummary;
import com.crossmatch.pairing.batch.ChunkScheduler;
import com.crossmatch.pairing.batch.IslandAnomaly;
import com.crossmatch.pairing.batch.IslandMembership;
import com.crossmatch.pairing.batch.ProgressCallback;
import com.crossmatch.pairing.core.model.Catalogue;
import com.crossmatch.pairing.core.model.Island;
import com.crossmatch.pairing.grid.GridIndexer;
import com.crossmatch.pairing.hypothesis.HypothesisEnumerator;
import com.crossmatch.pairing.hypothesis.OversizedIslandException;
import com.crossmatch.pairing.hypothesis.OversizedIslandPolicy;
import com.crossmatch.pairing.likelihood.ContaminationLikelihood;
import com.crossmatch.pairing.likelihood.CubePhotometricLikelihood;
import com.crossmatch.pairing.likelihood.NoOpPhotometricLikelihood;
import com.crossmatch.pairing.likelihood.PairwiseLikelihood;
import com.crossmatch.pairing.likelihood.PhotometricLikelihood;
import com.crossmatch.pairing.logging.LogContext;
import com.crossmatch.pairing.metrics.MetricsService;
import com.crossmatch.pairing.metrics.NoOpMetricsService;
import com.crossmatch.pairing.resolution.CounterpartMatch;
import com.crossmatch.pairing.resolution.IslandResolution;
import com.crossmatch.pairing.resolution.IslandResolver;
import com.crossmatch.pairing.tracing.NoOpTracingService;
import com.crossmatch.pairing.tracing.Span;
import com.crossmatch.pairing.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main entry point of the pairing stage.
 *
 * <p>Validates the inputs, splits the islands into chunks, resolves them on a
 * worker pool, accumulates and reconciles the outputs. Configuration faults are
 * raised before any island is processed.</p>
 *
 * <pre>
 * try (CounterpartPairingEngine engine = CounterpartPairingEngine.builder()
 *         .options(PairingOptions.withPhotometry())
 *         .build()) {
 *     PairingResult result = engine.pair(inputs);
 * }
 * </pre>
 */
public class CounterpartPairingEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CounterpartPairingEngine.class);

    private final PairingOptions options;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final ProgressCallback progressCallback;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile ChunkScheduler activeScheduler;

    private CounterpartPairingEngine(Builder builder) {
        this.options = builder.options;
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        this.progressCallback = builder.progressCallback != null ? builder.progressCallback : ProgressCallback.NOOP;
    }

    public static Builder builder() {
        return new Builder();
    }

    public PairingOptions getOptions() {
        return options;
    }

    /**
     * Runs the pairing stage over every island.
     *
     * @throws PairingConfigurationException if the inputs cannot support a run with these options
     * @throws OversizedIslandException      if an island exceeds the bound under {@link OversizedIslandPolicy#FAIL}
     * @throws IllegalStateException         if the engine is closed
     */
    public PairingResult pair(PairingInputs inputs) {
        if (closed.get()) {
            throw new IllegalStateException("Engine is closed");
        }
        String runId = LogContext.generateRunId();
        try (LogContext ctx = LogContext.forRun(runId);
             Span span = tracingService.startSpan(TracingService.RUN_SPAN, Map.of("runId", runId))) {
            try {
                InputValidator.validate(inputs, options);
                PairingResult result = run(runId, inputs, span);
                span.setStatus(Span.SpanStatus.OK);
                return result;
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                log.error("pairing.failed error={}", e.getMessage());
                throw e;
            }
        } finally {
            activeScheduler = null;
        }
    }

    /**
     * Stops dispatching chunks of the run in progress, if any. Chunks already running
     * complete; the run returns what was resolved and reconciliation reports the rest.
     */
    public void cancel() {
        ChunkScheduler scheduler = activeScheduler;
        if (scheduler != null) {
            log.info("pairing.cancel.requested");
            scheduler.cancel();
        }
    }

    private PairingResult run(String runId, PairingInputs inputs, Span span) {
        IslandResolver resolver = resolver(inputs);
        IslandMembership islands = inputs.islands();
        ChunkScheduler scheduler = new ChunkScheduler(options.getChunkCount(), options.getPoolSize());
        activeScheduler = scheduler;
        List<Chunk> chunks = scheduler.plan(islands.size());

        log.info("pairing.started islands={} chunks={} poolSize={} sourcesA={} sourcesB={} options={}",
                islands.size(), chunks.size(), options.getPoolSize(),
                inputs.catalogueA().size(), inputs.catalogueB().size(), options);
        span.setAttribute("islands", islands.size());
        span.setAttribute("chunks", chunks.size());

        ResultAccumulator accumulator = new ResultAccumulator(inputs.catalogueA().size(),
                inputs.catalogueB().size(), inputs.rejectA(), inputs.rejectB());
        int[] completed = {0};
        long start = System.nanoTime();
        ChunkRunSummary summary = scheduler.run(chunks,
                chunk -> processChunk(runId, chunk, islands, resolver),
                result -> {
                    accumulator.accept(result);
                    completed[0]++;
                    progressCallback.onProgress(completed[0], chunks.size(),
                            "Resolved chunk " + result.chunk().index() + " (" + result.resolutions().size() + " islands)");
                });

        PairingResult result = accumulator.finish();
        for (ReconciliationWarning warning : result.getWarnings()) {
            metricsService.incrementReconciliationWarning(warning);
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        metricsService.recordRunDuration(elapsed, summary.cancelled());
        span.setAttribute("counterparts", result.getCounterparts().size());
        span.setAttribute("warnings", result.getWarnings().size());
        if (summary.cancelled()) {
            span.addEvent("cancelled");
            log.warn("pairing.cancelled completedChunks={} totalChunks={}", summary.completed(), summary.totalChunks());
        }
        log.info("pairing.completed counterparts={} fieldA={} fieldB={} degenerate={} anomalies={} warnings={} durationMs={}",
                result.getCounterparts().size(), result.fieldIndices(Catalogue.A).length,
                result.fieldIndices(Catalogue.B).length,
                result.getDegenerateIslandCount(), result.getAnomalies().size(), result.getWarnings().size(),
                elapsed.toMillis());
        return result;
    }

    private IslandResolver resolver(PairingInputs inputs) {
        PhotometricLikelihood photometry = options.isPhotometryEnabled()
                ? new CubePhotometricLikelihood(inputs.photometry())
                : NoOpPhotometricLikelihood.INSTANCE;
        if (!options.isPhotometryEnabled() && inputs.photometry() != null) {
            log.info("pairing.photometry.ignored reason=disabled");
        }
        PairwiseLikelihood likelihood;
        if (options.isPerturbationEnabled()) {
            try {
                likelihood = new PairwiseLikelihood(inputs.priors(), photometry,
                        new GridIndexer(inputs.perturbationA(), inputs.perturbationB()),
                        new ContaminationLikelihood(inputs.frequencies()));
            } catch (IllegalArgumentException e) {
                throw new PairingConfigurationException("Perturbation grids are inconsistent: " + e.getMessage(), e);
            }
        } else {
            likelihood = new PairwiseLikelihood(inputs.priors(), photometry);
        }
        return new IslandResolver(inputs.catalogueA(), inputs.catalogueB(), likelihood,
                new HypothesisEnumerator(options.getMaxIslandSize()));
    }

    private ChunkResult processChunk(String runId, Chunk chunk, IslandMembership islands, IslandResolver resolver) {
        long start = System.nanoTime();
        List<IslandResolution> resolutions = new ArrayList<>(chunk.size());
        List<IslandAnomaly> anomalies = new ArrayList<>();
        try (LogContext ctx = LogContext.forChunk(runId, chunk.index());
             Span span = tracingService.startSpan(TracingService.CHUNK_SPAN,
                     Map.of("runId", runId, "chunk", Integer.toString(chunk.index())))) {
            for (Island island : islands.range(chunk.fromIsland(), chunk.toIsland())) {
                try {
                    IslandResolution resolution = resolver.resolve(island);
                    resolutions.add(resolution);
                    record(resolution);
                } catch (OversizedIslandException e) {
                    metricsService.incrementOversizedIslands(options.getOversizedIslandPolicy());
                    log.error("island.oversized island={} a={} b={} bound={} policy={}", island.index(),
                            island.aCount(), island.bCount(), e.getMaxIslandSize(), options.getOversizedIslandPolicy());
                    if (options.getOversizedIslandPolicy() == OversizedIslandPolicy.FAIL) {
                        span.recordException(e);
                        span.setStatus(Span.SpanStatus.ERROR);
                        throw e;
                    }
                    anomalies.add(new IslandAnomaly(island.index(), island.aCount(), island.bCount(), e.getMessage()));
                }
            }
            span.setAttribute("islands", resolutions.size());
            span.setStatus(Span.SpanStatus.OK);
            metricsService.incrementIslandsResolved(resolutions.size());
            metricsService.recordChunkDuration(Duration.ofNanos(System.nanoTime() - start));
            log.debug("chunk.completed islands={} anomalies={}", resolutions.size(), anomalies.size());
        }
        return new ChunkResult(chunk, resolutions, anomalies);
    }

    private void record(IslandResolution resolution) {
        metricsService.recordHypothesisCount(resolution.hypothesisCount());
        if (resolution.degenerate()) {
            metricsService.incrementDegenerateIslands();
        }
        for (CounterpartMatch match : resolution.matches()) {
            metricsService.recordCounterpartProbability(match.probability());
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            cancel();
            log.debug("pairing.engine.closed");
        }
    }

    public static class Builder {
        private PairingOptions options = PairingOptions.defaults();
        private MetricsService metricsService;
        private TracingService tracingService;
        private ProgressCallback progressCallback;

        public Builder options(PairingOptions options) {
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder progressCallback(ProgressCallback progressCallback) {
            this.progressCallback = progressCallback;
            return this;
        }

        public CounterpartPairingEngine build() {
            if (options == null) {
                throw new IllegalArgumentException("options are required");
            }
            return new CounterpartPairingEngine(this);
        }
    }
}
