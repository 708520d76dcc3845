package com.crossmatch.pairing.likelihood;

/**
 * Great-circle separations between sky positions.
 */
public final class SkySeparation {

    public static final double ARCSEC_PER_DEGREE = 3600.0;

    private SkySeparation() {
    }

    /**
     * Haversine separation between two positions, all values in degrees.
     */
    public static double haversineDegrees(double lon1, double lat1, double lon2, double lat2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double sinDLat = Math.sin((phi2 - phi1) / 2.0);
        double sinDLon = Math.sin(Math.toRadians(lon2 - lon1) / 2.0);
        double h = sinDLat * sinDLat + Math.cos(phi1) * Math.cos(phi2) * sinDLon * sinDLon;
        return Math.toDegrees(2.0 * Math.asin(Math.min(1.0, Math.sqrt(h))));
    }
}
