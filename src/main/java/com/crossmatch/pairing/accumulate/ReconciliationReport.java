package com.crossmatch.pairing.accumulate;

import com.crossmatch.pairing.core.model.Catalogue;

import java.util.List;
import java.util.Objects;

/**
 * Accounting outcome for both catalogues.
 *
 * @param warnings    count mismatches, catalogue a first
 * @param missingA    catalogue a indices recorded nowhere
 * @param missingB    catalogue b indices recorded nowhere
 * @param duplicatesA catalogue a indices recorded more than once or outside the catalogue
 * @param duplicatesB catalogue b indices recorded more than once or outside the catalogue
 */
public record ReconciliationReport(
        List<ReconciliationWarning> warnings,
        List<Integer> missingA,
        List<Integer> missingB,
        List<Integer> duplicatesA,
        List<Integer> duplicatesB
) {
    public ReconciliationReport {
        warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings is required"));
        missingA = List.copyOf(missingA);
        missingB = List.copyOf(missingB);
        duplicatesA = List.copyOf(duplicatesA);
        duplicatesB = List.copyOf(duplicatesB);
    }

    public boolean isBalanced() {
        return warnings.isEmpty() && duplicatesA.isEmpty() && duplicatesB.isEmpty();
    }

    public List<Integer> missing(Catalogue catalogue) {
        return catalogue == Catalogue.A ? missingA : missingB;
    }

    public List<Integer> duplicates(Catalogue catalogue) {
        return catalogue == Catalogue.A ? duplicatesA : duplicatesB;
    }
}
