package com.crossmatch.pairing.core.model;

/**
 * Final classification of a catalogue source after pairing.
 */
public enum Membership {
    /**
     * Paired with exactly one source in the other catalogue.
     */
    COUNTERPART,

    /**
     * Judged to have no counterpart in the other catalogue.
     */
    FIELD,

    /**
     * Removed before pairing (e.g. failed upstream validation).
     */
    REJECTED
}
