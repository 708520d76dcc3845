package com.crossmatch.pairing.resolution;

import com.crossmatch.pairing.hypothesis.Hypothesis;

/**
 * A hypothesis with its raw score and posterior, for diagnostics.
 */
public record ScoredHypothesis(Hypothesis hypothesis, double score, double posterior) {
}
