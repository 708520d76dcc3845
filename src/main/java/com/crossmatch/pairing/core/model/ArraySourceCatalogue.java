package com.crossmatch.pairing.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Heap-resident catalogue holding its sources in a list.
 */
public class ArraySourceCatalogue implements SourceCatalogue {

    private final Catalogue catalogue;
    private final List<Source> sources;

    private ArraySourceCatalogue(Catalogue catalogue, List<Source> sources) {
        this.catalogue = catalogue;
        this.sources = List.copyOf(sources);
    }

    /**
     * Wraps already-built sources. Each source must carry this catalogue and its list position as index.
     */
    public static ArraySourceCatalogue of(Catalogue catalogue, List<Source> sources) {
        Objects.requireNonNull(catalogue, "catalogue is required");
        Objects.requireNonNull(sources, "sources is required");
        for (int i = 0; i < sources.size(); i++) {
            Source source = sources.get(i);
            if (source.catalogue() != catalogue || source.index() != i) {
                throw new IllegalArgumentException("Source at position " + i + " is " + source
                        + ", expected catalogue " + catalogue.label() + " index " + i);
            }
        }
        return new ArraySourceCatalogue(catalogue, sources);
    }

    public static Builder builder(Catalogue catalogue) {
        return new Builder(catalogue);
    }

    @Override
    public Catalogue catalogue() {
        return catalogue;
    }

    @Override
    public int size() {
        return sources.size();
    }

    @Override
    public Source get(int index) {
        Objects.checkIndex(index, sources.size());
        return sources.get(index);
    }

    public static class Builder {
        private final Catalogue catalogue;
        private final List<Source> sources = new ArrayList<>();

        private Builder(Catalogue catalogue) {
            this.catalogue = Objects.requireNonNull(catalogue, "catalogue is required");
        }

        /**
         * Appends a source; its index is its insertion position.
         */
        public Builder add(double longitude, double latitude, double uncertainty,
                           double[] magnitudes, int bestFilter, ModelReference modelReference) {
            sources.add(new Source(catalogue, sources.size(), longitude, latitude, uncertainty,
                    magnitudes, bestFilter, modelReference));
            return this;
        }

        public ArraySourceCatalogue build() {
            return new ArraySourceCatalogue(catalogue, sources);
        }
    }
}
