package com.crossmatch.pairing.hypothesis;

/**
 * Receives each hypothesis during enumeration.
 */
@FunctionalInterface
public interface HypothesisVisitor {

    /**
     * @param pairing b position per a position, {@link Hypothesis#FIELD} for unpaired.
     *                The array is reused between calls and must not be retained.
     * @param bUsed   whether each b position is paired; reused likewise
     */
    void visit(int[] pairing, boolean[] bUsed);
}
