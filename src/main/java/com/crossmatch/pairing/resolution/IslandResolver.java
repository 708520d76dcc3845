package com.crossmatch.pairing.resolution;

import com.crossmatch.pairing.core.model.Catalogue;
import com.crossmatch.pairing.core.model.Island;
import com.crossmatch.pairing.core.model.Source;
import com.crossmatch.pairing.core.model.SourceCatalogue;
import com.crossmatch.pairing.hypothesis.Hypothesis;
import com.crossmatch.pairing.hypothesis.HypothesisEnumerator;
import com.crossmatch.pairing.hypothesis.HypothesisVisitor;
import com.crossmatch.pairing.likelihood.FieldLikelihood;
import com.crossmatch.pairing.likelihood.PairLikelihood;
import com.crossmatch.pairing.likelihood.PairwiseLikelihood;
import com.crossmatch.pairing.likelihood.SkySeparation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Bayesian resolution of a single island.
 *
 * <p>Every hypothesis is scored as the product of {@code Nc G c} over its pairs,
 * {@code Nfa fa} over its unpaired a sources and {@code Nfb fb} over its unpaired
 * b sources. The scores sum to the normalising integral Z. The highest-scoring
 * hypothesis is selected, first in enumeration order on ties, and its pairs carry
 * probability {@code score / Z}. An unpaired source's field probability is the
 * summed score of every hypothesis leaving it unpaired, over Z.</p>
 *
 * <p>A factor whose prior density is exactly zero scores exactly zero, so an infinite
 * astrometric likelihood never turns an excluded pair into NaN.</p>
 *
 * <p>When Z is zero or not finite the priors cannot discriminate. The resolver
 * then re-selects using scores with every prior density replaced by 1 and gives
 * the selected hypothesis probability 1. Hypotheses whose priors are all non-zero
 * are preferred; only when there is none does a zero prior stop excluding a factor.</p>
 *
 * <p>Instances are immutable and safe to share between worker threads.</p>
 */
public class IslandResolver {
    private static final Logger log = LoggerFactory.getLogger(IslandResolver.class);

    private final SourceCatalogue catalogueA;
    private final SourceCatalogue catalogueB;
    private final PairwiseLikelihood likelihood;
    private final HypothesisEnumerator enumerator;

    public IslandResolver(SourceCatalogue catalogueA, SourceCatalogue catalogueB,
                          PairwiseLikelihood likelihood, HypothesisEnumerator enumerator) {
        this.catalogueA = Objects.requireNonNull(catalogueA, "catalogueA is required");
        this.catalogueB = Objects.requireNonNull(catalogueB, "catalogueB is required");
        this.likelihood = Objects.requireNonNull(likelihood, "likelihood is required");
        this.enumerator = Objects.requireNonNull(enumerator, "enumerator is required");
        if (catalogueA.catalogue() != Catalogue.A || catalogueB.catalogue() != Catalogue.B) {
            throw new IllegalArgumentException("Catalogues must be supplied as a then b");
        }
    }

    /**
     * @throws com.crossmatch.pairing.hypothesis.OversizedIslandException if the island is too large to enumerate
     */
    public IslandResolution resolve(Island island) {
        enumerator.checkBound(island);
        if (island.isEmpty()) {
            return IslandResolution.empty(island.index());
        }

        IslandTerms terms = terms(island);
        Selection selection = new Selection(terms);
        long count = enumerator.forEach(terms.m, terms.n, selection);

        boolean degenerate = !(selection.z > 0.0) || Double.isInfinite(selection.z);
        int[] chosen = degenerate ? selection.fallbackPairing() : selection.bestPairing;
        double probability = degenerate ? 1.0 : selection.bestScore / selection.z;

        List<CounterpartMatch> matches = new ArrayList<>();
        List<FieldAssignment> fieldA = new ArrayList<>();
        List<FieldAssignment> fieldB = new ArrayList<>();
        boolean[] bPaired = new boolean[terms.n];

        for (int a = 0; a < terms.m; a++) {
            int b = chosen[a];
            if (b == Hypothesis.FIELD) {
                double p = degenerate ? 1.0 : selection.fieldSumA[a] / selection.z;
                fieldA.add(new FieldAssignment(Catalogue.A, terms.a[a].index(), p));
                continue;
            }
            bPaired[b] = true;
            matches.add(match(terms, a, b, probability));
        }
        for (int b = 0; b < terms.n; b++) {
            if (!bPaired[b]) {
                double p = degenerate ? 1.0 : selection.fieldSumB[b] / selection.z;
                fieldB.add(new FieldAssignment(Catalogue.B, terms.b[b].index(), p));
            }
        }

        if (degenerate) {
            log.debug("island.degenerate island={} z={} hypotheses={}", island.index(), selection.z, count);
        }
        return new IslandResolution(island.index(), matches, fieldA, fieldB,
                degenerate ? selection.fallbackScore() : selection.bestScore, selection.z, count, degenerate);
    }

    /**
     * Every hypothesis of the island with its score and posterior, in enumeration order.
     * Under a degenerate integral the fallback hypothesis has posterior 1 and all others 0.
     */
    public List<ScoredHypothesis> scoreHypotheses(Island island) {
        enumerator.checkBound(island);
        IslandTerms terms = terms(island);
        List<Hypothesis> hypotheses = new ArrayList<>();
        List<Double> scores = new ArrayList<>();
        Selection selection = new Selection(terms);
        enumerator.forEach(terms.m, terms.n, (pairing, bUsed) -> {
            selection.visit(pairing, bUsed);
            hypotheses.add(new Hypothesis(pairing, terms.n));
            scores.add(terms.score(pairing, bUsed, false));
        });

        boolean degenerate = !(selection.z > 0.0) || Double.isInfinite(selection.z);
        Hypothesis fallback = new Hypothesis(selection.fallbackPairing(), terms.n);
        List<ScoredHypothesis> out = new ArrayList<>(hypotheses.size());
        for (int i = 0; i < hypotheses.size(); i++) {
            Hypothesis h = hypotheses.get(i);
            double posterior;
            if (degenerate) {
                posterior = h.equals(fallback) ? 1.0 : 0.0;
            } else {
                posterior = scores.get(i) / selection.z;
            }
            out.add(new ScoredHypothesis(h, scores.get(i), posterior));
        }
        return out;
    }

    private CounterpartMatch match(IslandTerms terms, int a, int b, double probability) {
        PairLikelihood pair = terms.pairs[a][b];
        FieldLikelihood fa = terms.fieldA[a];
        FieldLikelihood fb = terms.fieldB[b];
        double eta = Math.log10(pair.photometric() / (fa.photometric() * fb.photometric()));
        double xi = Math.log10(pair.counterpartPrior() * pair.astrometric() / (fa.prior() * fb.prior()));
        return new CounterpartMatch(terms.a[a].index(), terms.b[b].index(), probability,
                pair.separation() * SkySeparation.ARCSEC_PER_DEGREE, eta, xi,
                pair.contaminationFluxA(), pair.contaminationFluxB(),
                pair.contaminationProbA(), pair.contaminationProbB());
    }

    private IslandTerms terms(Island island) {
        int m = island.aCount();
        int n = island.bCount();
        Source[] a = new Source[m];
        Source[] b = new Source[n];
        FieldLikelihood[] fieldA = new FieldLikelihood[m];
        FieldLikelihood[] fieldB = new FieldLikelihood[n];
        for (int i = 0; i < m; i++) {
            a[i] = catalogueA.get(island.aIndex(i));
            fieldA[i] = likelihood.field(a[i]);
        }
        for (int j = 0; j < n; j++) {
            b[j] = catalogueB.get(island.bIndex(j));
            fieldB[j] = likelihood.field(b[j]);
        }
        PairLikelihood[][] pairs = new PairLikelihood[m][n];
        for (int i = 0; i < m; i++) {
            for (int j = 0; j < n; j++) {
                pairs[i][j] = likelihood.pair(a[i], b[j]);
            }
        }
        return new IslandTerms(a, b, pairs, fieldA, fieldB);
    }

    /**
     * Per-island factors, computed once and reused across every hypothesis.
     */
    private static final class IslandTerms {
        final int m;
        final int n;
        final Source[] a;
        final Source[] b;
        final PairLikelihood[][] pairs;
        final FieldLikelihood[] fieldA;
        final FieldLikelihood[] fieldB;
        final double[][] pairFactor;
        final double[][] pairLikelihoodOnly;
        final double[] fieldFactorA;
        final double[] fieldFactorB;
        final double[] fieldPhotometricA;
        final double[] fieldPhotometricB;
        final boolean[][] pairPermitted;
        final boolean[] fieldPermittedA;
        final boolean[] fieldPermittedB;

        IslandTerms(Source[] a, Source[] b, PairLikelihood[][] pairs,
                    FieldLikelihood[] fieldA, FieldLikelihood[] fieldB) {
            this.m = a.length;
            this.n = b.length;
            this.a = a;
            this.b = b;
            this.pairs = pairs;
            this.fieldA = fieldA;
            this.fieldB = fieldB;
            this.pairFactor = new double[m][n];
            this.pairLikelihoodOnly = new double[m][n];
            this.pairPermitted = new boolean[m][n];
            for (int i = 0; i < m; i++) {
                for (int j = 0; j < n; j++) {
                    pairFactor[i][j] = pairs[i][j].factor();
                    pairLikelihoodOnly[i][j] = pairs[i][j].likelihoodOnly();
                    pairPermitted[i][j] = pairs[i][j].permitted();
                }
            }
            this.fieldPermittedA = new boolean[m];
            this.fieldPermittedB = new boolean[n];
            for (int i = 0; i < m; i++) {
                fieldPermittedA[i] = fieldA[i].permitted();
            }
            for (int j = 0; j < n; j++) {
                fieldPermittedB[j] = fieldB[j].permitted();
            }
            this.fieldFactorA = Arrays.stream(fieldA).mapToDouble(FieldLikelihood::factor).toArray();
            this.fieldFactorB = Arrays.stream(fieldB).mapToDouble(FieldLikelihood::factor).toArray();
            this.fieldPhotometricA = Arrays.stream(fieldA).mapToDouble(FieldLikelihood::photometric).toArray();
            this.fieldPhotometricB = Arrays.stream(fieldB).mapToDouble(FieldLikelihood::photometric).toArray();
        }

        double score(int[] pairing, boolean[] bUsed, boolean withoutPriors) {
            double s = 1.0;
            for (int i = 0; i < m; i++) {
                int j = pairing[i];
                if (j == Hypothesis.FIELD) {
                    s *= withoutPriors ? fieldPhotometricA[i] : fieldFactorA[i];
                } else {
                    s *= withoutPriors ? pairLikelihoodOnly[i][j] : pairFactor[i][j];
                }
            }
            for (int j = 0; j < n; j++) {
                if (!bUsed[j]) {
                    s *= withoutPriors ? fieldPhotometricB[j] : fieldFactorB[j];
                }
            }
            return s;
        }

        /** Whether no factor of the hypothesis has a zero prior density. */
        boolean permitted(int[] pairing, boolean[] bUsed) {
            for (int i = 0; i < m; i++) {
                int j = pairing[i];
                if (j == Hypothesis.FIELD ? !fieldPermittedA[i] : !pairPermitted[i][j]) {
                    return false;
                }
            }
            for (int j = 0; j < n; j++) {
                if (!bUsed[j] && !fieldPermittedB[j]) {
                    return false;
                }
            }
            return true;
        }
    }

    /**
     * Running sums and selections over the enumeration.
     */
    private static final class Selection implements HypothesisVisitor {
        final IslandTerms terms;
        final double[] fieldSumA;
        final double[] fieldSumB;
        final int[] bestPairing;
        final int[] permittedPairing;
        final int[] anyPairing;
        double z;
        double bestScore = Double.NEGATIVE_INFINITY;
        double permittedScore = Double.NEGATIVE_INFINITY;
        double anyScore = Double.NEGATIVE_INFINITY;
        boolean anyPermitted;

        Selection(IslandTerms terms) {
            this.terms = terms;
            this.fieldSumA = new double[terms.m];
            this.fieldSumB = new double[terms.n];
            this.bestPairing = new int[terms.m];
            this.permittedPairing = new int[terms.m];
            this.anyPairing = new int[terms.m];
            Arrays.fill(bestPairing, Hypothesis.FIELD);
            Arrays.fill(permittedPairing, Hypothesis.FIELD);
            Arrays.fill(anyPairing, Hypothesis.FIELD);
        }

        @Override
        public void visit(int[] pairing, boolean[] bUsed) {
            double s = terms.score(pairing, bUsed, false);
            z += s;
            if (s > bestScore) {
                bestScore = s;
                System.arraycopy(pairing, 0, bestPairing, 0, pairing.length);
            }
            for (int i = 0; i < pairing.length; i++) {
                if (pairing[i] == Hypothesis.FIELD) {
                    fieldSumA[i] += s;
                }
            }
            for (int j = 0; j < bUsed.length; j++) {
                if (!bUsed[j]) {
                    fieldSumB[j] += s;
                }
            }
            double raw = terms.score(pairing, bUsed, true);
            if (raw > anyScore) {
                anyScore = raw;
                System.arraycopy(pairing, 0, anyPairing, 0, pairing.length);
            }
            if (terms.permitted(pairing, bUsed)) {
                anyPermitted = true;
                if (raw > permittedScore) {
                    permittedScore = raw;
                    System.arraycopy(pairing, 0, permittedPairing, 0, pairing.length);
                }
            }
        }

        int[] fallbackPairing() {
            return anyPermitted ? permittedPairing : anyPairing;
        }

        double fallbackScore() {
            return anyPermitted ? permittedScore : anyScore;
        }
    }
}
