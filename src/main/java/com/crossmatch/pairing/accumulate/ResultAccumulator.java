package com.crossmatch.pairing.accumulate;

import com.crossmatch.pairing.batch.ChunkResult;
import com.crossmatch.pairing.batch.IslandAnomaly;
import com.crossmatch.pairing.core.model.Catalogue;
import com.crossmatch.pairing.resolution.CounterpartMatch;
import com.crossmatch.pairing.resolution.FieldAssignment;
import com.crossmatch.pairing.resolution.IslandResolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges per-island records into catalogue-wide outputs and reconciles the accounting.
 *
 * <p>Chunks may arrive in any order; {@link #finish()} sorts by source identity so
 * the result does not depend on completion order. Not thread-safe: feed it from
 * the scheduler's calling thread.</p>
 */
public class ResultAccumulator {
    private static final Logger log = LoggerFactory.getLogger(ResultAccumulator.class);

    private final int sizeA;
    private final int sizeB;
    private final int[] rejectA;
    private final int[] rejectB;

    private final List<CounterpartMatch> counterparts = new ArrayList<>();
    private final List<FieldAssignment> fieldA = new ArrayList<>();
    private final List<FieldAssignment> fieldB = new ArrayList<>();
    private final List<IslandAnomaly> anomalies = new ArrayList<>();
    private final Set<Integer> acceptedChunks = new HashSet<>();
    private int islandCount;
    private int degenerateCount;

    /**
     * @param sizeA   number of sources in catalogue a
     * @param sizeB   number of sources in catalogue b
     * @param rejectA catalogue a indices removed upstream, may be null
     * @param rejectB catalogue b indices removed upstream, may be null
     */
    public ResultAccumulator(int sizeA, int sizeB, int[] rejectA, int[] rejectB) {
        if (sizeA < 0 || sizeB < 0) {
            throw new IllegalArgumentException("Catalogue sizes must be non-negative");
        }
        this.sizeA = sizeA;
        this.sizeB = sizeB;
        this.rejectA = rejectA != null ? rejectA.clone() : new int[0];
        this.rejectB = rejectB != null ? rejectB.clone() : new int[0];
    }

    /**
     * @throws IllegalStateException if a result for the same chunk was already accepted
     */
    public void accept(ChunkResult result) {
        if (!acceptedChunks.add(result.chunk().index())) {
            throw new IllegalStateException("Chunk " + result.chunk().index() + " results already accumulated");
        }
        result.resolutions().forEach(this::accept);
        anomalies.addAll(result.anomalies());
    }

    public void accept(IslandResolution resolution) {
        counterparts.addAll(resolution.matches());
        fieldA.addAll(resolution.fieldA());
        fieldB.addAll(resolution.fieldB());
        islandCount++;
        if (resolution.degenerate()) {
            degenerateCount++;
        }
    }

    public PairingResult finish() {
        List<CounterpartMatch> sortedMatches = new ArrayList<>(counterparts);
        sortedMatches.sort(Comparator.comparingInt(CounterpartMatch::aIndex)
                .thenComparingInt(CounterpartMatch::bIndex));
        List<FieldAssignment> sortedA = new ArrayList<>(fieldA);
        sortedA.sort(Comparator.comparingInt(FieldAssignment::index));
        List<FieldAssignment> sortedB = new ArrayList<>(fieldB);
        sortedB.sort(Comparator.comparingInt(FieldAssignment::index));
        List<IslandAnomaly> sortedAnomalies = new ArrayList<>(anomalies);
        sortedAnomalies.sort(Comparator.comparingInt(IslandAnomaly::islandIndex));

        int[] matchedA = sortedMatches.stream().mapToInt(CounterpartMatch::aIndex).toArray();
        int[] matchedB = sortedMatches.stream().mapToInt(CounterpartMatch::bIndex).toArray();
        int[] fieldIdxA = sortedA.stream().mapToInt(FieldAssignment::index).toArray();
        int[] fieldIdxB = sortedB.stream().mapToInt(FieldAssignment::index).toArray();

        ReconciliationReport report = reconcile(sizeA, sizeB, matchedA, matchedB, fieldIdxA, fieldIdxB,
                rejectA, rejectB);
        PairingResult result = new PairingResult(sortedMatches, sortedA, sortedB, sortedAnomalies, report,
                islandCount, degenerateCount);
        log.info("accumulate.completed result={}", result);
        return result;
    }

    /**
     * Checks that every source of each catalogue is recorded exactly once across its
     * counterpart, field and reject lists. Mismatches are logged at WARN and returned;
     * they never abort.
     */
    public static ReconciliationReport reconcile(int sizeA, int sizeB,
                                                 int[] counterpartA, int[] counterpartB,
                                                 int[] fieldA, int[] fieldB,
                                                 int[] rejectA, int[] rejectB) {
        List<ReconciliationWarning> warnings = new ArrayList<>();
        Tally a = tally(sizeA, counterpartA, fieldA, rejectA);
        Tally b = tally(sizeB, counterpartB, fieldB, rejectB);
        a.warning(Catalogue.A, sizeA, warnings);
        b.warning(Catalogue.B, sizeB, warnings);
        for (ReconciliationWarning warning : warnings) {
            log.warn("reconcile.mismatch catalogue={} direction={} count={} message=\"{}\"",
                    warning.catalogue().label(), warning.direction(), warning.count(), warning.message());
        }
        if (!a.duplicates.isEmpty() || !b.duplicates.isEmpty()) {
            log.warn("reconcile.duplicates a={} b={}", a.duplicates.size(), b.duplicates.size());
        }
        return new ReconciliationReport(warnings, a.missing, b.missing, a.duplicates, b.duplicates);
    }

    private static Tally tally(int size, int[]... lists) {
        int[] seen = new int[size];
        long recorded = 0;
        List<Integer> outOfRange = new ArrayList<>();
        for (int[] list : lists) {
            if (list == null) {
                continue;
            }
            recorded += list.length;
            for (int index : list) {
                if (index < 0 || index >= size) {
                    outOfRange.add(index);
                } else {
                    seen[index]++;
                }
            }
        }
        Tally tally = new Tally(recorded);
        for (int i = 0; i < size; i++) {
            if (seen[i] == 0) {
                tally.missing.add(i);
            } else if (seen[i] > 1) {
                tally.duplicates.add(i);
            }
        }
        tally.duplicates.addAll(outOfRange);
        return tally;
    }

    private static final class Tally {
        final long recorded;
        final List<Integer> missing = new ArrayList<>();
        final List<Integer> duplicates = new ArrayList<>();

        Tally(long recorded) {
            this.recorded = recorded;
        }

        void warning(Catalogue catalogue, int size, List<ReconciliationWarning> out) {
            if (recorded < size) {
                out.add(new ReconciliationWarning(catalogue, ReconciliationWarning.Direction.MISSING,
                        (int) (size - recorded)));
            } else if (recorded > size) {
                out.add(new ReconciliationWarning(catalogue, ReconciliationWarning.Direction.SURPLUS,
                        (int) (recorded - size)));
            }
        }
    }
}
