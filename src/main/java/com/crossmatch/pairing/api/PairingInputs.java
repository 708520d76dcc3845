package com.crossmatch.pairing.api;

import com.crossmatch.pairing.batch.IslandMembership;
import com.crossmatch.pairing.core.model.SourceCatalogue;
import com.crossmatch.pairing.grid.PerturbationGrids;
import com.crossmatch.pairing.grid.PhotometricLikelihoodCubes;
import com.crossmatch.pairing.grid.PriorDensityGrids;
import com.crossmatch.pairing.likelihood.FrequencyGrid;

/**
 * Everything a pairing run reads, shared read-only by every worker.
 *
 * @param catalogueA   catalogue a sources
 * @param catalogueB   catalogue b sources
 * @param islands      island membership from the grouping stage
 * @param priors       counterpart and field prior densities
 * @param photometry   photometric likelihood cubes, null unless photometry is enabled
 * @param perturbationA catalogue a perturbation grids, null unless perturbation is enabled
 * @param perturbationB catalogue b perturbation grids, null unless perturbation is enabled
 * @param frequencies  frequency grid of the fourier kernels, null unless perturbation is enabled
 * @param rejectA      catalogue a indices removed upstream
 * @param rejectB      catalogue b indices removed upstream
 */
public record PairingInputs(
        SourceCatalogue catalogueA,
        SourceCatalogue catalogueB,
        IslandMembership islands,
        PriorDensityGrids priors,
        PhotometricLikelihoodCubes photometry,
        PerturbationGrids perturbationA,
        PerturbationGrids perturbationB,
        FrequencyGrid frequencies,
        int[] rejectA,
        int[] rejectB
) {
    public PairingInputs {
        rejectA = rejectA != null ? rejectA.clone() : new int[0];
        rejectB = rejectB != null ? rejectB.clone() : new int[0];
    }

    @Override
    public int[] rejectA() {
        return rejectA.clone();
    }

    @Override
    public int[] rejectB() {
        return rejectB.clone();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private SourceCatalogue catalogueA;
        private SourceCatalogue catalogueB;
        private IslandMembership islands;
        private PriorDensityGrids priors;
        private PhotometricLikelihoodCubes photometry;
        private PerturbationGrids perturbationA;
        private PerturbationGrids perturbationB;
        private FrequencyGrid frequencies;
        private int[] rejectA;
        private int[] rejectB;

        public Builder catalogues(SourceCatalogue catalogueA, SourceCatalogue catalogueB) {
            this.catalogueA = catalogueA;
            this.catalogueB = catalogueB;
            return this;
        }

        public Builder islands(IslandMembership islands) {
            this.islands = islands;
            return this;
        }

        public Builder priors(PriorDensityGrids priors) {
            this.priors = priors;
            return this;
        }

        public Builder photometry(PhotometricLikelihoodCubes photometry) {
            this.photometry = photometry;
            return this;
        }

        public Builder perturbation(PerturbationGrids perturbationA, PerturbationGrids perturbationB,
                                    FrequencyGrid frequencies) {
            this.perturbationA = perturbationA;
            this.perturbationB = perturbationB;
            this.frequencies = frequencies;
            return this;
        }

        public Builder rejected(int[] rejectA, int[] rejectB) {
            this.rejectA = rejectA;
            this.rejectB = rejectB;
            return this;
        }

        public PairingInputs build() {
            return new PairingInputs(catalogueA, catalogueB, islands, priors, photometry,
                    perturbationA, perturbationB, frequencies, rejectA, rejectB);
        }
    }
}
