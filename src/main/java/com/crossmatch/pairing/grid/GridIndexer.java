package com.crossmatch.pairing.grid;

import com.crossmatch.pairing.core.model.Catalogue;
import com.crossmatch.pairing.core.model.Source;

import java.util.Objects;

/**
 * Looks up a source's curves in its own catalogue's perturbation grids.
 * Stateless beyond the shared read-only grids.
 */
public class GridIndexer {

    private final PerturbationGrids gridsA;
    private final PerturbationGrids gridsB;

    public GridIndexer(PerturbationGrids gridsA, PerturbationGrids gridsB) {
        this.gridsA = Objects.requireNonNull(gridsA, "gridsA is required");
        this.gridsB = Objects.requireNonNull(gridsB, "gridsB is required");
        if (gridsA.fluxLevelCount() != gridsB.fluxLevelCount()) {
            throw new IllegalArgumentException("Catalogues disagree on flux-cut level count: "
                    + gridsA.fluxLevelCount() + " vs " + gridsB.fluxLevelCount());
        }
        if (gridsA.kernelLength() != gridsB.kernelLength()) {
            throw new IllegalArgumentException("Catalogues disagree on fourier kernel length: "
                    + gridsA.kernelLength() + " vs " + gridsB.kernelLength());
        }
    }

    /**
     * @throws IndexOutOfBoundsException if the source's model reference lies outside its grids
     */
    public double[] lookup(Source source, GridFamily family) {
        return grids(source.catalogue()).cube(family).curve(source.modelReference());
    }

    public double[] contaminationFractions(Source source) {
        return lookup(source, GridFamily.CONTAMINATION_FRACTION);
    }

    public double contaminationFlux(Source source) {
        return grids(source.catalogue()).contaminationFlux().scalar(source.modelReference());
    }

    public double[] fourierKernel(Source source) {
        return lookup(source, GridFamily.FOURIER_KERNEL);
    }

    public boolean covers(Source source) {
        return grids(source.catalogue()).contains(source.modelReference());
    }

    public int fluxLevelCount() {
        return gridsA.fluxLevelCount();
    }

    public int kernelLength() {
        return gridsA.kernelLength();
    }

    public PerturbationGrids grids(Catalogue catalogue) {
        return catalogue == Catalogue.A ? gridsA : gridsB;
    }
}
