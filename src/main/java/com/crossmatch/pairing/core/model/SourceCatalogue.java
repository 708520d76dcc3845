package com.crossmatch.pairing.core.model;

/**
 * Read-only, index-addressable view of one catalogue's sources.
 * Implementations must be safe for concurrent reads.
 */
public interface SourceCatalogue {

    Catalogue catalogue();

    /**
     * Number of sources in the catalogue, rejected ones included.
     */
    int size();

    /**
     * Returns the source with the given catalogue-wide index.
     *
     * @throws IndexOutOfBoundsException if the index is outside the catalogue
     */
    Source get(int index);
}
