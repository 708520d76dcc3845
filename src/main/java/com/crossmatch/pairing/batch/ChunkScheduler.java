package com.crossmatch.pairing.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Farms contiguous island ranges to a fixed pool of worker threads.
 *
 * <p>At most {@code poolSize} chunks are in flight; the next chunk is dispatched
 * only when one completes, so {@link #cancel()} takes effect between chunks.
 * Finished chunks reach the listener on the calling thread, in completion order.
 * Workers share nothing but read-only inputs.</p>
 */
public class ChunkScheduler {
    private static final Logger log = LoggerFactory.getLogger(ChunkScheduler.class);

    private final int chunkCount;
    private final int poolSize;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public ChunkScheduler(int chunkCount, int poolSize) {
        if (chunkCount <= 0) {
            throw new IllegalArgumentException("chunkCount must be positive");
        }
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be positive");
        }
        this.chunkCount = chunkCount;
        this.poolSize = poolSize;
    }

    /**
     * Splits {@code [0, islandCount)} into at most {@code chunkCount} contiguous ranges whose
     * sizes differ by at most one. Never produces empty chunks unless there are no islands.
     */
    public List<Chunk> plan(int islandCount) {
        if (islandCount < 0) {
            throw new IllegalArgumentException("islandCount must be non-negative");
        }
        int chunks = Math.max(1, Math.min(chunkCount, islandCount));
        List<Chunk> plan = new ArrayList<>(chunks);
        int base = islandCount / chunks;
        int remainder = islandCount % chunks;
        int from = 0;
        for (int i = 0; i < chunks; i++) {
            int to = from + base + (i < remainder ? 1 : 0);
            plan.add(new Chunk(i, from, to));
            from = to;
        }
        return plan;
    }

    /**
     * Runs every chunk through {@code worker}.
     *
     * @throws IllegalStateException if the same chunk index is listed twice
     * @throws ChunkExecutionException if a worker throws a checked exception or the caller is interrupted
     */
    public ChunkRunSummary run(List<Chunk> chunks, ChunkWorker worker, ChunkListener listener) {
        Objects.requireNonNull(chunks, "chunks is required");
        Objects.requireNonNull(worker, "worker is required");
        Objects.requireNonNull(listener, "listener is required");

        Deque<Chunk> pending = new ArrayDeque<>(chunks);
        Set<Integer> dispatched = new HashSet<>();
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(poolSize, Math.max(1, chunks.size())),
                new WorkerThreadFactory());
        CompletionService<ChunkResult> completion = new ExecutorCompletionService<>(pool);

        int inFlight = 0;
        int dispatchedCount = 0;
        int completed = 0;
        try {
            while (inFlight < poolSize && !pending.isEmpty() && !cancelled.get()) {
                dispatch(pending.poll(), dispatched, worker, completion);
                inFlight++;
                dispatchedCount++;
            }
            while (inFlight > 0) {
                ChunkResult result = take(completion);
                inFlight--;
                completed++;
                listener.onChunk(result);
                if (!pending.isEmpty() && !cancelled.get()) {
                    dispatch(pending.poll(), dispatched, worker, completion);
                    inFlight++;
                    dispatchedCount++;
                }
            }
        } finally {
            pool.shutdownNow();
            awaitTermination(pool);
        }

        boolean wasCancelled = cancelled.get() && dispatchedCount < chunks.size();
        if (wasCancelled) {
            log.warn("scheduler.cancelled completed={} total={}", completed, chunks.size());
        }
        return new ChunkRunSummary(chunks.size(), dispatchedCount, completed, wasCancelled);
    }

    /**
     * Stops dispatching further chunks. Chunks already running finish and are delivered whole.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public int getChunkCount() {
        return chunkCount;
    }

    public int getPoolSize() {
        return poolSize;
    }

    private void dispatch(Chunk chunk, Set<Integer> dispatched, ChunkWorker worker,
                          CompletionService<ChunkResult> completion) {
        if (!dispatched.add(chunk.index())) {
            throw new IllegalStateException("Chunk " + chunk.index() + " already dispatched");
        }
        log.debug("chunk.dispatched chunk={} islands=[{}, {})", chunk.index(), chunk.fromIsland(), chunk.toIsland());
        completion.submit(() -> worker.process(chunk));
    }

    private ChunkResult take(CompletionService<ChunkResult> completion) {
        try {
            Future<ChunkResult> future = completion.take();
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChunkExecutionException("Interrupted while waiting for chunk results", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            log.error("chunk.failed error={}", cause.toString());
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new ChunkExecutionException("Chunk worker failed", cause);
        }
    }

    private static void awaitTermination(ExecutorService pool) {
        try {
            if (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("scheduler.shutdown.timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();
        private final int pool = POOL_SEQUENCE.incrementAndGet();
        private final AtomicInteger thread = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "pairing-" + pool + "-worker-" + thread.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
