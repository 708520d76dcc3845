package com.crossmatch.pairing.grid;

import com.crossmatch.pairing.core.model.Catalogue;
import com.crossmatch.pairing.core.model.Source;

import java.util.Objects;

/**
 * Counterpart and field prior densities, sources per square degree.
 * Densities may be exactly zero but never negative.
 *
 * <p>A pair takes its counterpart density from the catalogue a source's model
 * reference, at the position of the catalogue b source's best filter along the
 * counterpart curve. A counterpart cube of curve length 1 serves every b filter.
 * Field densities come from each source's own reference.</p>
 */
public final class PriorDensityGrids {

    private final CurveCube counterpart;
    private final CurveCube fieldA;
    private final CurveCube fieldB;

    public PriorDensityGrids(CurveCube counterpart, CurveCube fieldA, CurveCube fieldB) {
        this.counterpart = requireDensities(counterpart, "counterpart", false);
        this.fieldA = requireDensities(fieldA, "fieldA", true);
        this.fieldB = requireDensities(fieldB, "fieldB", true);
    }

    /**
     * Single-cell priors, for catalogues whose sources all reference (0, 0, 0).
     */
    public static PriorDensityGrids uniform(double counterpart, double fieldA, double fieldB) {
        return new PriorDensityGrids(CurveCube.scalar(counterpart), CurveCube.scalar(fieldA),
                CurveCube.scalar(fieldB));
    }

    public double counterpartDensity(Source aSource, Source bSource) {
        if (aSource.catalogue() != Catalogue.A || bSource.catalogue() != Catalogue.B) {
            throw new IllegalArgumentException("Counterpart density needs a catalogue a and a catalogue b source, got "
                    + aSource + " and " + bSource);
        }
        return counterpart.value(aSource.modelReference(), filterPosition(bSource));
    }

    /**
     * Number of catalogue b filters the counterpart densities distinguish; 1 when they are shared.
     */
    public int counterpartFilterCount() {
        return counterpart.curveLength();
    }

    public double fieldDensity(Source source) {
        return field(source.catalogue()).scalar(source.modelReference());
    }

    /**
     * Whether every density this source needs lies within the grids.
     */
    public boolean covers(Source source) {
        boolean field = field(source.catalogue()).contains(source.modelReference());
        return source.catalogue() == Catalogue.A
                ? field && counterpart.contains(source.modelReference())
                : field && (counterpart.curveLength() == 1 || source.bestFilter() < counterpart.curveLength());
    }

    public CurveCube counterpart() {
        return counterpart;
    }

    public CurveCube field(Catalogue catalogue) {
        return catalogue == Catalogue.A ? fieldA : fieldB;
    }

    private int filterPosition(Source bSource) {
        return counterpart.curveLength() == 1 ? 0 : bSource.bestFilter();
    }

    private static CurveCube requireDensities(CurveCube cube, String name, boolean scalar) {
        Objects.requireNonNull(cube, name + " is required");
        if (scalar && cube.curveLength() != 1) {
            throw new IllegalArgumentException(name + " prior cube must hold scalars");
        }
        double min = cube.minimum();
        if (!(min >= 0.0)) {
            throw new IllegalArgumentException(name + " prior densities must be non-negative, minimum is " + min);
        }
        return cube;
    }
}
