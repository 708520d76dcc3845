package com.crossmatch.pairing.core.model;

/**
 * The two catalogues being cross-matched.
 */
public enum Catalogue {
    A("a"),
    B("b");

    private final String label;

    Catalogue(String label) {
        this.label = label;
    }

    /**
     * Lower-case label used in log and warning messages ("catalogue a").
     */
    public String label() {
        return label;
    }

    public Catalogue other() {
        return this == A ? B : A;
    }
}
