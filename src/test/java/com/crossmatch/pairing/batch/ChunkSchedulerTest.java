package com.crossmatch.pairing.batch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ChunkScheduler Tests")
class ChunkSchedulerTest {

    private static ChunkResult emptyResult(Chunk chunk) {
        return new ChunkResult(chunk, List.of(), List.of());
    }

    @Nested
    @DisplayName("Planning")
    class Planning {

        @ParameterizedTest(name = "{0} islands into {1} chunks -> {2} chunks")
        @CsvSource({
                "100, 20, 20",
                "7, 20, 7",
                "0, 20, 1",
                "21, 4, 4",
                "1, 1, 1"
        })
        @DisplayName("Should cover every island with near-equal contiguous ranges")
        void plan(int islands, int chunkCount, int expectedChunks) {
            List<Chunk> plan = new ChunkScheduler(chunkCount, 2).plan(islands);

            assertEquals(expectedChunks, plan.size());
            int next = 0;
            int min = Integer.MAX_VALUE;
            int max = 0;
            for (int i = 0; i < plan.size(); i++) {
                Chunk chunk = plan.get(i);
                assertEquals(i, chunk.index());
                assertEquals(next, chunk.fromIsland());
                next = chunk.toIsland();
                min = Math.min(min, chunk.size());
                max = Math.max(max, chunk.size());
            }
            assertEquals(islands, next);
            assertTrue(max - min <= 1);
        }

        @Test
        @DisplayName("Chunk count and pool size must be positive")
        void invalidSettings() {
            assertThrows(IllegalArgumentException.class, () -> new ChunkScheduler(0, 1));
            assertThrows(IllegalArgumentException.class, () -> new ChunkScheduler(1, 0));
            assertThrows(IllegalArgumentException.class, () -> new ChunkScheduler(1, 1).plan(-1));
        }
    }

    @Nested
    @DisplayName("Running")
    class Running {

        @Test
        @DisplayName("Should process every chunk on workers and deliver on the calling thread")
        void deliversOnCaller() {
            ChunkScheduler scheduler = new ChunkScheduler(8, 3);
            List<Chunk> plan = scheduler.plan(40);
            Thread caller = Thread.currentThread();
            Set<String> workerThreads = ConcurrentHashMap.newKeySet();
            List<Integer> delivered = new ArrayList<>();

            ChunkRunSummary summary = scheduler.run(plan, chunk -> {
                workerThreads.add(Thread.currentThread().getName());
                return emptyResult(chunk);
            }, result -> {
                assertSame(caller, Thread.currentThread());
                delivered.add(result.chunk().index());
            });

            Collections.sort(delivered);
            assertEquals(List.of(0, 1, 2, 3, 4, 5, 6, 7), delivered);
            assertEquals(new ChunkRunSummary(8, 8, 8, false), summary);
            assertTrue(workerThreads.stream().allMatch(name -> name.startsWith("pairing-")));
            assertTrue(workerThreads.size() <= 3);
        }

        @Test
        @DisplayName("Should never run more chunks at once than the pool size")
        void boundedConcurrency() {
            ChunkScheduler scheduler = new ChunkScheduler(12, 2);
            AtomicInteger running = new AtomicInteger();
            AtomicInteger peak = new AtomicInteger();

            scheduler.run(scheduler.plan(12), chunk -> {
                peak.accumulateAndGet(running.incrementAndGet(), Math::max);
                try {
                    Thread.sleep(5);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                running.decrementAndGet();
                return emptyResult(chunk);
            }, result -> { });

            assertTrue(peak.get() <= 2);
        }

        @Test
        @DisplayName("Duplicate chunk indices are a programming fault")
        void duplicateChunk() {
            ChunkScheduler scheduler = new ChunkScheduler(2, 2);
            List<Chunk> chunks = List.of(new Chunk(0, 0, 1), new Chunk(0, 1, 2));

            assertThrows(IllegalStateException.class,
                    () -> scheduler.run(chunks, ChunkSchedulerTest::emptyResult, result -> { }));
        }

        @Test
        @DisplayName("Unchecked worker failures should propagate unwrapped")
        void workerFailure() {
            ChunkScheduler scheduler = new ChunkScheduler(4, 2);

            IllegalStateException e = assertThrows(IllegalStateException.class,
                    () -> scheduler.run(scheduler.plan(4), chunk -> {
                        if (chunk.index() == 2) {
                            throw new IllegalStateException("boom");
                        }
                        return emptyResult(chunk);
                    }, result -> { }));

            assertEquals("boom", e.getMessage());
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("Cancelling should stop dispatch after the running chunks")
        void cancelBetweenChunks() {
            ChunkScheduler scheduler = new ChunkScheduler(5, 1);
            List<Integer> delivered = new ArrayList<>();

            ChunkRunSummary summary = scheduler.run(scheduler.plan(5), ChunkSchedulerTest::emptyResult, result -> {
                delivered.add(result.chunk().index());
                scheduler.cancel();
            });

            assertEquals(List.of(0), delivered);
            assertTrue(summary.cancelled());
            assertEquals(1, summary.dispatched());
            assertEquals(1, summary.completed());
            assertTrue(scheduler.isCancelled());
        }

        @Test
        @DisplayName("A scheduler cancelled before running dispatches nothing")
        void cancelledUpFront() {
            ChunkScheduler scheduler = new ChunkScheduler(3, 2);
            scheduler.cancel();

            ChunkRunSummary summary = scheduler.run(scheduler.plan(3), ChunkSchedulerTest::emptyResult,
                    result -> fail("no chunk should run"));

            assertEquals(0, summary.completed());
            assertTrue(summary.cancelled());
        }
    }
}
