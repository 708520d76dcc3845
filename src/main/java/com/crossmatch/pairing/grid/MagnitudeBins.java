package com.crossmatch.pairing.grid;

import java.util.Arrays;
import java.util.Objects;

/**
 * One catalogue's magnitude bin edges per (filter, pointing).
 * Every filter and pointing has the same number of bins so photometric curves have a fixed length.
 */
public final class MagnitudeBins {

    private final double[][][] edges;
    private final int binCount;

    /**
     * @param edges ascending bin edges indexed {@code [filter][pointing][edge]}
     */
    public MagnitudeBins(double[][][] edges) {
        Objects.requireNonNull(edges, "edges is required");
        if (edges.length == 0 || edges[0].length == 0) {
            throw new IllegalArgumentException("edges must cover at least one filter and pointing");
        }
        this.edges = new double[edges.length][][];
        int bins = -1;
        for (int f = 0; f < edges.length; f++) {
            if (edges[f].length != edges[0].length) {
                throw new IllegalArgumentException("Filter " + f + " has " + edges[f].length
                        + " pointings, expected " + edges[0].length);
            }
            this.edges[f] = new double[edges[f].length][];
            for (int p = 0; p < edges[f].length; p++) {
                double[] e = edges[f][p];
                if (e == null || e.length < 2) {
                    throw new IllegalArgumentException("Filter " + f + " pointing " + p + " needs at least two edges");
                }
                for (int i = 1; i < e.length; i++) {
                    if (!(e[i] > e[i - 1])) {
                        throw new IllegalArgumentException("Edges for filter " + f + " pointing " + p
                                + " must be strictly ascending: " + Arrays.toString(e));
                    }
                }
                if (bins >= 0 && e.length - 1 != bins) {
                    throw new IllegalArgumentException("Filter " + f + " pointing " + p + " has "
                            + (e.length - 1) + " bins, expected " + bins);
                }
                bins = e.length - 1;
                this.edges[f][p] = e.clone();
            }
        }
        this.binCount = bins;
    }

    /**
     * The same edges for every filter and pointing.
     */
    public static MagnitudeBins uniform(int filterCount, int pointingCount, double... edges) {
        double[][][] all = new double[filterCount][pointingCount][];
        for (double[][] filter : all) {
            Arrays.fill(filter, edges);
        }
        return new MagnitudeBins(all);
    }

    public int binCount() {
        return binCount;
    }

    public int filterCount() {
        return edges.length;
    }

    public int pointingCount() {
        return edges[0].length;
    }

    /**
     * Bin whose lower edge {@code magnitude} reaches; magnitudes outside the edges clamp to the end bins.
     *
     * @throws IllegalArgumentException if the magnitude is NaN
     */
    public int binIndex(double magnitude, int filter, int pointing) {
        if (Double.isNaN(magnitude)) {
            throw new IllegalArgumentException("Cannot bin a NaN magnitude");
        }
        double[] e = edges[filter][pointing];
        int idx = Arrays.binarySearch(e, magnitude);
        int bin = idx >= 0 ? idx : -idx - 2;
        return Math.max(0, Math.min(binCount - 1, bin));
    }

    public boolean covers(int filter, int pointing) {
        return filter < edges.length && pointing < edges[0].length;
    }
}
