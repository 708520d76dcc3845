package com.crossmatch.pairing.export;

/**
 * Record counts written by an export.
 */
public record ExportResult(long counterparts, long fieldA, long fieldB) {

    public long total() {
        return counterparts + fieldA + fieldB;
    }

    @Override
    public String toString() {
        return "ExportResult{counterparts=" + counterparts +
                ", fieldA=" + fieldA +
                ", fieldB=" + fieldB + '}';
    }
}
