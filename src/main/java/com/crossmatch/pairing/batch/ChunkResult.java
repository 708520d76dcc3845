package com.crossmatch.pairing.batch;

import com.crossmatch.pairing.resolution.IslandResolution;

import java.util.List;
import java.util.Objects;

/**
 * All island records of one chunk, delivered as a whole.
 */
public record ChunkResult(Chunk chunk, List<IslandResolution> resolutions, List<IslandAnomaly> anomalies) {
    public ChunkResult {
        Objects.requireNonNull(chunk, "chunk is required");
        resolutions = List.copyOf(Objects.requireNonNull(resolutions, "resolutions is required"));
        anomalies = anomalies != null ? List.copyOf(anomalies) : List.of();
    }
}
