package com.crossmatch.pairing.grid;

import com.crossmatch.pairing.core.model.ModelReference;

import java.util.Objects;

/**
 * One catalogue's perturbation grids, all sharing the same (density, filter, pointing) shape.
 *
 * @param contaminationFractions curve per flux-cut level
 * @param contaminationFlux      scalar average contaminating flux
 * @param fourierKernels         kernel sampled on the frequency grid
 */
public record PerturbationGrids(
        CurveCube contaminationFractions,
        CurveCube contaminationFlux,
        CurveCube fourierKernels
) {
    public PerturbationGrids {
        Objects.requireNonNull(contaminationFractions, "contaminationFractions is required");
        Objects.requireNonNull(contaminationFlux, "contaminationFlux is required");
        Objects.requireNonNull(fourierKernels, "fourierKernels is required");
        if (contaminationFlux.curveLength() != 1) {
            throw new IllegalArgumentException("contaminationFlux must hold scalars, curve length is "
                    + contaminationFlux.curveLength());
        }
        requireSameShape(contaminationFractions, contaminationFlux, "contaminationFlux");
        requireSameShape(contaminationFractions, fourierKernels, "fourierKernels");
    }

    /**
     * Number of flux-cut levels each contamination-fraction curve holds.
     */
    public int fluxLevelCount() {
        return contaminationFractions.curveLength();
    }

    public int kernelLength() {
        return fourierKernels.curveLength();
    }

    public CurveCube cube(GridFamily family) {
        return switch (family) {
            case CONTAMINATION_FRACTION -> contaminationFractions;
            case CONTAMINATION_FLUX -> contaminationFlux;
            case FOURIER_KERNEL -> fourierKernels;
        };
    }

    public boolean contains(ModelReference ref) {
        return contaminationFractions.contains(ref);
    }

    private static void requireSameShape(CurveCube expected, CurveCube actual, String name) {
        if (expected.densityCount() != actual.densityCount()
                || expected.filterCount() != actual.filterCount()
                || expected.pointingCount() != actual.pointingCount()) {
            throw new IllegalArgumentException(name + " shape " + actual
                    + " does not match contaminationFractions shape " + expected);
        }
    }
}
