package com.crossmatch.pairing.likelihood;

import java.util.Objects;

/**
 * Spatial-frequency sampling shared by both catalogues' fourier kernels, in inverse arcseconds.
 * Each sample is a bin midpoint with its width.
 */
public final class FrequencyGrid {

    private final double[] rho;
    private final double[] drho;

    private FrequencyGrid(double[] rho, double[] drho) {
        this.rho = rho;
        this.drho = drho;
    }

    /**
     * Grid from ascending bin edges: midpoints and widths of consecutive edges.
     */
    public static FrequencyGrid fromEdges(double... edges) {
        Objects.requireNonNull(edges, "edges is required");
        if (edges.length < 2) {
            throw new IllegalArgumentException("A frequency grid needs at least two edges");
        }
        double[] rho = new double[edges.length - 1];
        double[] drho = new double[edges.length - 1];
        for (int i = 0; i < rho.length; i++) {
            if (!(edges[i + 1] > edges[i]) || edges[i] < 0.0) {
                throw new IllegalArgumentException("Frequency edges must be non-negative and strictly ascending");
            }
            rho[i] = 0.5 * (edges[i] + edges[i + 1]);
            drho[i] = edges[i + 1] - edges[i];
        }
        return new FrequencyGrid(rho, drho);
    }

    /**
     * {@code edgeCount} evenly spaced edges from 0 to {@code maxRho}.
     */
    public static FrequencyGrid linear(double maxRho, int edgeCount) {
        if (edgeCount < 2 || !(maxRho > 0.0)) {
            throw new IllegalArgumentException("linear grid needs maxRho > 0 and at least two edges");
        }
        double[] edges = new double[edgeCount];
        for (int i = 0; i < edgeCount; i++) {
            edges[i] = maxRho * i / (edgeCount - 1);
        }
        return fromEdges(edges);
    }

    public int size() {
        return rho.length;
    }

    public double rho(int i) {
        return rho[i];
    }

    public double drho(int i) {
        return drho[i];
    }
}
