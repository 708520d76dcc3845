package com.crossmatch.pairing.accumulate;

import com.crossmatch.pairing.batch.IslandAnomaly;
import com.crossmatch.pairing.core.model.Catalogue;
import com.crossmatch.pairing.resolution.CounterpartMatch;
import com.crossmatch.pairing.resolution.FieldAssignment;

import java.util.List;
import java.util.Objects;

/**
 * Catalogue-wide pairing outputs, ordered by source identity.
 * Counterparts are sorted by catalogue a index, field sources by their own index.
 */
public final class PairingResult {

    private final List<CounterpartMatch> counterparts;
    private final List<FieldAssignment> fieldA;
    private final List<FieldAssignment> fieldB;
    private final List<IslandAnomaly> anomalies;
    private final ReconciliationReport reconciliation;
    private final int islandCount;
    private final int degenerateIslandCount;

    public PairingResult(List<CounterpartMatch> counterparts, List<FieldAssignment> fieldA,
                         List<FieldAssignment> fieldB, List<IslandAnomaly> anomalies,
                         ReconciliationReport reconciliation, int islandCount, int degenerateIslandCount) {
        this.counterparts = List.copyOf(counterparts);
        this.fieldA = List.copyOf(fieldA);
        this.fieldB = List.copyOf(fieldB);
        this.anomalies = List.copyOf(anomalies);
        this.reconciliation = Objects.requireNonNull(reconciliation, "reconciliation is required");
        this.islandCount = islandCount;
        this.degenerateIslandCount = degenerateIslandCount;
    }

    public List<CounterpartMatch> getCounterparts() {
        return counterparts;
    }

    public List<FieldAssignment> getField(Catalogue catalogue) {
        return catalogue == Catalogue.A ? fieldA : fieldB;
    }

    public List<IslandAnomaly> getAnomalies() {
        return anomalies;
    }

    public ReconciliationReport getReconciliation() {
        return reconciliation;
    }

    public List<ReconciliationWarning> getWarnings() {
        return reconciliation.warnings();
    }

    public int getIslandCount() {
        return islandCount;
    }

    public int getDegenerateIslandCount() {
        return degenerateIslandCount;
    }

    public int[] counterpartIndices(Catalogue catalogue) {
        return counterparts.stream()
                .mapToInt(m -> catalogue == Catalogue.A ? m.aIndex() : m.bIndex())
                .toArray();
    }

    public double[] counterpartProbabilities() {
        return counterparts.stream().mapToDouble(CounterpartMatch::probability).toArray();
    }

    public double[] separations() {
        return counterparts.stream().mapToDouble(CounterpartMatch::separationArcsec).toArray();
    }

    public double[] etas() {
        return counterparts.stream().mapToDouble(CounterpartMatch::eta).toArray();
    }

    public double[] xis() {
        return counterparts.stream().mapToDouble(CounterpartMatch::xi).toArray();
    }

    public double[] contaminationFlux(Catalogue catalogue) {
        return counterparts.stream()
                .mapToDouble(m -> catalogue == Catalogue.A ? m.contaminationFluxA() : m.contaminationFluxB())
                .toArray();
    }

    public int[] fieldIndices(Catalogue catalogue) {
        return getField(catalogue).stream().mapToInt(FieldAssignment::index).toArray();
    }

    public double[] fieldProbabilities(Catalogue catalogue) {
        return getField(catalogue).stream().mapToDouble(FieldAssignment::probability).toArray();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PairingResult other)) return false;
        return islandCount == other.islandCount
                && degenerateIslandCount == other.degenerateIslandCount
                && counterparts.equals(other.counterparts)
                && fieldA.equals(other.fieldA)
                && fieldB.equals(other.fieldB)
                && anomalies.equals(other.anomalies)
                && reconciliation.equals(other.reconciliation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(counterparts, fieldA, fieldB, anomalies, reconciliation, islandCount,
                degenerateIslandCount);
    }

    @Override
    public String toString() {
        return "PairingResult{counterparts=" + counterparts.size() +
                ", fieldA=" + fieldA.size() +
                ", fieldB=" + fieldB.size() +
                ", anomalies=" + anomalies.size() +
                ", warnings=" + reconciliation.warnings().size() + '}';
    }
}
