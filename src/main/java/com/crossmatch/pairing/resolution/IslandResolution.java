package com.crossmatch.pairing.resolution;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of resolving one island. Written whole, never revisited.
 *
 * @param islandIndex        index of the island in the membership lists
 * @param matches            accepted counterpart pairs
 * @param fieldA             unpaired catalogue a sources
 * @param fieldB             unpaired catalogue b sources
 * @param selectedScore      score of the selected hypothesis
 * @param normalisingIntegral sum of all hypothesis scores (Z)
 * @param hypothesisCount    number of hypotheses enumerated
 * @param degenerate         whether Z was zero or not finite and the fallback selection applied
 */
public record IslandResolution(
        int islandIndex,
        List<CounterpartMatch> matches,
        List<FieldAssignment> fieldA,
        List<FieldAssignment> fieldB,
        double selectedScore,
        double normalisingIntegral,
        long hypothesisCount,
        boolean degenerate
) {
    public IslandResolution {
        matches = List.copyOf(Objects.requireNonNull(matches, "matches is required"));
        fieldA = List.copyOf(Objects.requireNonNull(fieldA, "fieldA is required"));
        fieldB = List.copyOf(Objects.requireNonNull(fieldB, "fieldB is required"));
    }

    /**
     * Resolution of an island holding no sources.
     */
    public static IslandResolution empty(int islandIndex) {
        return new IslandResolution(islandIndex, List.of(), List.of(), List.of(), 1.0, 1.0, 1, false);
    }

    /**
     * Posterior probability of the selected hypothesis.
     */
    public double selectedProbability() {
        return degenerate ? 1.0 : selectedScore / normalisingIntegral;
    }

    public int sourceCount() {
        return 2 * matches.size() + fieldA.size() + fieldB.size();
    }
}
