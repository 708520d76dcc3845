package com.crossmatch.pairing.api;

import com.crossmatch.pairing.hypothesis.HypothesisEnumerator;
import com.crossmatch.pairing.hypothesis.OversizedIslandPolicy;

import java.util.Objects;

/**
 * Options for a pairing run: which likelihood terms are modelled, the
 * enumeration bound and how work is spread over threads.
 */
public class PairingOptions {

    private static final int DEFAULT_CHUNK_COUNT = 20;

    private final boolean photometryEnabled;
    private final boolean perturbationEnabled;
    private final int maxIslandSize;
    private final OversizedIslandPolicy oversizedIslandPolicy;
    private final int chunkCount;
    private final int poolSize;

    private PairingOptions(Builder builder) {
        this.photometryEnabled = builder.photometryEnabled;
        this.perturbationEnabled = builder.perturbationEnabled;
        this.maxIslandSize = builder.maxIslandSize;
        this.oversizedIslandPolicy = builder.oversizedIslandPolicy;
        this.chunkCount = builder.chunkCount;
        this.poolSize = builder.poolSize;
    }

    /**
     * When false the photometric likelihoods are all 1 and only astrometry and priors decide.
     */
    public boolean isPhotometryEnabled() {
        return photometryEnabled;
    }

    /**
     * When true the astrometric term comes from the sources' perturbation kernels.
     */
    public boolean isPerturbationEnabled() {
        return perturbationEnabled;
    }

    public int getMaxIslandSize() {
        return maxIslandSize;
    }

    public OversizedIslandPolicy getOversizedIslandPolicy() {
        return oversizedIslandPolicy;
    }

    public int getChunkCount() {
        return chunkCount;
    }

    public int getPoolSize() {
        return poolSize;
    }

    /**
     * Astrometry only, default bound, failing on oversized islands.
     */
    public static PairingOptions defaults() {
        return builder().build();
    }

    /**
     * Defaults with photometric likelihoods enabled.
     */
    public static PairingOptions withPhotometry() {
        return builder().photometryEnabled(true).build();
    }

    /**
     * Photometry and perturbation modelling both enabled.
     */
    public static PairingOptions full() {
        return builder().photometryEnabled(true).perturbationEnabled(true).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .photometryEnabled(photometryEnabled)
                .perturbationEnabled(perturbationEnabled)
                .maxIslandSize(maxIslandSize)
                .oversizedIslandPolicy(oversizedIslandPolicy)
                .chunkCount(chunkCount)
                .poolSize(poolSize);
    }

    public static class Builder {
        private boolean photometryEnabled = false;
        private boolean perturbationEnabled = false;
        private int maxIslandSize = HypothesisEnumerator.DEFAULT_MAX_ISLAND_SIZE;
        private OversizedIslandPolicy oversizedIslandPolicy = OversizedIslandPolicy.FAIL;
        private int chunkCount = DEFAULT_CHUNK_COUNT;
        private int poolSize = Runtime.getRuntime().availableProcessors();

        public Builder photometryEnabled(boolean photometryEnabled) {
            this.photometryEnabled = photometryEnabled;
            return this;
        }

        public Builder perturbationEnabled(boolean perturbationEnabled) {
            this.perturbationEnabled = perturbationEnabled;
            return this;
        }

        public Builder maxIslandSize(int maxIslandSize) {
            if (maxIslandSize <= 0) {
                throw new IllegalArgumentException("maxIslandSize must be positive");
            }
            this.maxIslandSize = maxIslandSize;
            return this;
        }

        public Builder oversizedIslandPolicy(OversizedIslandPolicy oversizedIslandPolicy) {
            this.oversizedIslandPolicy = Objects.requireNonNull(oversizedIslandPolicy,
                    "oversizedIslandPolicy is required");
            return this;
        }

        public Builder chunkCount(int chunkCount) {
            if (chunkCount <= 0) {
                throw new IllegalArgumentException("chunkCount must be positive");
            }
            this.chunkCount = chunkCount;
            return this;
        }

        public Builder poolSize(int poolSize) {
            if (poolSize <= 0) {
                throw new IllegalArgumentException("poolSize must be positive");
            }
            this.poolSize = poolSize;
            return this;
        }

        public PairingOptions build() {
            return new PairingOptions(this);
        }
    }

    @Override
    public String toString() {
        return "PairingOptions{" +
                "photometryEnabled=" + photometryEnabled +
                ", perturbationEnabled=" + perturbationEnabled +
                ", maxIslandSize=" + maxIslandSize +
                ", oversizedIslandPolicy=" + oversizedIslandPolicy +
                ", chunkCount=" + chunkCount +
                ", poolSize=" + poolSize +
                '}';
    }
}
