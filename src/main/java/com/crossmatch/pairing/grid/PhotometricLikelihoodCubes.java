package com.crossmatch.pairing.grid;

import com.crossmatch.pairing.core.model.Catalogue;
import com.crossmatch.pairing.core.model.Source;

import java.util.Objects;

/**
 * Magnitude-binned photometric likelihoods for true pairs and field sources.
 *
 * <p>The counterpart cube is keyed by the catalogue a source's reference. Each curve
 * is a flattened {@code [bFilter][bBin][aBin]} table, with one block per catalogue b
 * filter, selected by the b source's best filter. A curve holding a single
 * {@code [bBin][aBin]} block serves every b filter. Field cubes are keyed by the
 * field source's own reference.</p>
 */
public record PhotometricLikelihoodCubes(
        CurveCube counterpart,
        CurveCube fieldA,
        CurveCube fieldB,
        MagnitudeBins binsA,
        MagnitudeBins binsB
) {
    public PhotometricLikelihoodCubes {
        Objects.requireNonNull(counterpart, "counterpart is required");
        Objects.requireNonNull(fieldA, "fieldA is required");
        Objects.requireNonNull(fieldB, "fieldB is required");
        Objects.requireNonNull(binsA, "binsA is required");
        Objects.requireNonNull(binsB, "binsB is required");
        int pairLength = binsA.binCount() * binsB.binCount();
        if (counterpart.curveLength() != pairLength
                && counterpart.curveLength() != binsB.filterCount() * pairLength) {
            throw new IllegalArgumentException("Counterpart curves hold " + counterpart.curveLength()
                    + " values, expected " + binsB.binCount() + "x" + binsA.binCount() + " or "
                    + binsB.filterCount() + "x" + binsB.binCount() + "x" + binsA.binCount());
        }
        if (fieldA.curveLength() != binsA.binCount()) {
            throw new IllegalArgumentException("Catalogue a field curves hold " + fieldA.curveLength()
                    + " values, expected " + binsA.binCount());
        }
        if (fieldB.curveLength() != binsB.binCount()) {
            throw new IllegalArgumentException("Catalogue b field curves hold " + fieldB.curveLength()
                    + " values, expected " + binsB.binCount());
        }
    }

    public double counterpartLikelihood(Source a, Source b) {
        int aBin = bin(a);
        int bBin = bin(b);
        int filterBlock = isFilterResolved() ? b.bestFilter() : 0;
        return counterpart.value(a.modelReference(),
                (filterBlock * binsB.binCount() + bBin) * binsA.binCount() + aBin);
    }

    public double fieldLikelihood(Source source) {
        CurveCube cube = source.catalogue() == Catalogue.A ? fieldA : fieldB;
        return cube.value(source.modelReference(), bin(source));
    }

    /**
     * Whether every lookup for this source stays within the cubes and bin tables.
     */
    public boolean covers(Source source) {
        MagnitudeBins bins = bins(source.catalogue());
        boolean field = (source.catalogue() == Catalogue.A ? fieldA : fieldB).contains(source.modelReference());
        boolean binned = bins.covers(source.bestFilter(), source.modelReference().pointingIndex());
        return source.catalogue() == Catalogue.A
                ? field && binned && counterpart.contains(source.modelReference())
                : field && binned;
    }

    /**
     * Whether the counterpart table differs between catalogue b filters.
     */
    public boolean isFilterResolved() {
        return counterpart.curveLength() != binsA.binCount() * binsB.binCount();
    }

    public MagnitudeBins bins(Catalogue catalogue) {
        return catalogue == Catalogue.A ? binsA : binsB;
    }

    private int bin(Source source) {
        return bins(source.catalogue()).binIndex(source.bestMagnitude(), source.bestFilter(),
                source.modelReference().pointingIndex());
    }
}
