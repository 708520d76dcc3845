package com.crossmatch.pairing.accumulate;

import com.crossmatch.pairing.batch.Chunk;
import com.crossmatch.pairing.batch.ChunkResult;
import com.crossmatch.pairing.batch.IslandAnomaly;
import com.crossmatch.pairing.core.model.Catalogue;
import com.crossmatch.pairing.resolution.CounterpartMatch;
import com.crossmatch.pairing.resolution.FieldAssignment;
import com.crossmatch.pairing.resolution.IslandResolution;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResultAccumulator Tests")
class ResultAccumulatorTest {

    private static CounterpartMatch match(int a, int b, double p) {
        return new CounterpartMatch(a, b, p, 0.1, 0.0, 2.0, 0.0, 0.0, null, null);
    }

    private static IslandResolution island(int index, List<CounterpartMatch> matches,
                                           List<FieldAssignment> fieldA, List<FieldAssignment> fieldB) {
        return new IslandResolution(index, matches, fieldA, fieldB, 1.0, 1.0, 2, false);
    }

    @Nested
    @DisplayName("Reconciliation")
    class Reconciliation {

        @Test
        @DisplayName("Missing sources should produce a warning per catalogue")
        void missingSources() {
            ReconciliationReport report = ResultAccumulator.reconcile(5, 3,
                    new int[]{0, 1}, new int[]{0, 1}, new int[]{2}, new int[0], null, null);

            assertEquals(List.of(
                    "2 catalogue a sources not in either counterpart, field, or rejected source lists",
                    "1 catalogue b source not in either counterpart, field, or rejected source lists"),
                    report.warnings().stream().map(ReconciliationWarning::message).toList());
            assertEquals(List.of(3, 4), report.missing(Catalogue.A));
            assertEquals(List.of(2), report.missing(Catalogue.B));
            assertFalse(report.isBalanced());
        }

        @Test
        @DisplayName("Surplus indices should produce a duplication warning")
        void surplusIndices() {
            ReconciliationReport report = ResultAccumulator.reconcile(3, 2,
                    new int[]{0, 1}, new int[]{0, 1}, new int[]{2, 1, 0}, new int[]{1}, null, null);

            assertEquals(List.of(
                    "2 additional catalogue a indices recorded, check results for duplications",
                    "1 additional catalogue b index recorded, check results for duplications"),
                    report.warnings().stream().map(ReconciliationWarning::message).toList());
            assertEquals(List.of(0, 1), report.duplicates(Catalogue.A));
            assertEquals(List.of(1), report.duplicates(Catalogue.B));
            assertEquals(ReconciliationWarning.Direction.SURPLUS, report.warnings().get(0).direction());
        }

        @Test
        @DisplayName("Out of range indices count as surplus")
        void outOfRange() {
            ReconciliationReport report = ResultAccumulator.reconcile(2, 1,
                    new int[]{0}, new int[]{0}, new int[]{1, 7}, new int[0], null, null);

            assertEquals(1, report.warnings().size());
            assertEquals(Catalogue.A, report.warnings().get(0).catalogue());
            assertEquals(List.of(7), report.duplicates(Catalogue.A));
        }

        @Test
        @DisplayName("Rejected sources balance the accounting")
        void rejectsBalance() {
            ReconciliationReport report = ResultAccumulator.reconcile(4, 2,
                    new int[]{0}, new int[]{1}, new int[]{3}, new int[0], new int[]{1, 2}, new int[]{0});

            assertTrue(report.isBalanced());
            assertTrue(report.missing(Catalogue.A).isEmpty());
        }

        @Test
        @DisplayName("Warning counts must be positive")
        void positiveCount() {
            assertThrows(IllegalArgumentException.class,
                    () -> new ReconciliationWarning(Catalogue.A, ReconciliationWarning.Direction.MISSING, 0));
        }
    }

    @Nested
    @DisplayName("Accumulation")
    class Accumulation {

        @Test
        @DisplayName("Results should be sorted regardless of chunk completion order")
        void sortedOutputs() {
            ResultAccumulator accumulator = new ResultAccumulator(4, 3, null, null);
            ChunkResult late = new ChunkResult(new Chunk(1, 1, 2), List.of(island(1,
                    List.of(match(2, 0, 0.9)),
                    List.of(new FieldAssignment(Catalogue.A, 3, 0.8)),
                    List.of())), List.of(new IslandAnomaly(5, 1, 1, "flagged")));
            ChunkResult early = new ChunkResult(new Chunk(0, 0, 1), List.of(island(0,
                    List.of(match(0, 2, 0.7)),
                    List.of(new FieldAssignment(Catalogue.A, 1, 0.6)),
                    List.of(new FieldAssignment(Catalogue.B, 1, 0.95)))), List.of());

            accumulator.accept(late);
            accumulator.accept(early);
            PairingResult result = accumulator.finish();

            assertArrayEquals(new int[]{0, 2}, result.counterpartIndices(Catalogue.A));
            assertArrayEquals(new int[]{2, 0}, result.counterpartIndices(Catalogue.B));
            assertArrayEquals(new double[]{0.7, 0.9}, result.counterpartProbabilities());
            assertArrayEquals(new int[]{1, 3}, result.fieldIndices(Catalogue.A));
            assertArrayEquals(new double[]{0.95}, result.fieldProbabilities(Catalogue.B));
            assertEquals(2, result.getIslandCount());
            assertEquals(1, result.getAnomalies().size());
            assertTrue(result.getReconciliation().isBalanced());
        }

        @Test
        @DisplayName("The same chunk must not be accumulated twice")
        void duplicateChunk() {
            ResultAccumulator accumulator = new ResultAccumulator(1, 0, null, null);
            ChunkResult result = new ChunkResult(new Chunk(0, 0, 1), List.of(island(0, List.of(),
                    List.of(new FieldAssignment(Catalogue.A, 0, 1.0)), List.of())), List.of());

            accumulator.accept(result);

            assertThrows(IllegalStateException.class, () -> accumulator.accept(result));
        }

        @Test
        @DisplayName("Degenerate islands are counted")
        void degenerateCount() {
            ResultAccumulator accumulator = new ResultAccumulator(1, 1, null, null);
            accumulator.accept(new IslandResolution(0, List.of(match(0, 0, 1.0)), List.of(), List.of(),
                    1.0, 0.0, 2, true));

            PairingResult result = accumulator.finish();

            assertEquals(1, result.getDegenerateIslandCount());
            assertTrue(result.getWarnings().isEmpty());
        }
    }
}
