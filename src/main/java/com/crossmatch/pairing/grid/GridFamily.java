package com.crossmatch.pairing.grid;

/**
 * The per-source curve families produced by the perturbation simulation stage.
 */
public enum GridFamily {
    /** Fraction of sources contaminated above each flux-cut level. */
    CONTAMINATION_FRACTION,
    /** Average contaminating flux (scalar curve). */
    CONTAMINATION_FLUX,
    /** Fourier-domain perturbation kernel sampled on the shared frequency grid. */
    FOURIER_KERNEL
}
