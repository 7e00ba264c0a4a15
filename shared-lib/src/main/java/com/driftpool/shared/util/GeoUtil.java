package com.driftpool.shared.util;

/**
 * Great-circle helpers on the WGS84 sphere approximation.
 */
public final class GeoUtil {

    public static final double EARTH_RADIUS_KM = 6371.0;
    public static final double KM_PER_MILE     = 1.609344;

    private GeoUtil() {}

    public static double distanceKm(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }

    public static double distanceMiles(double lat1, double lng1, double lat2, double lng2) {
        return distanceKm(lat1, lng1, lat2, lng2) / KM_PER_MILE;
    }

    public static boolean isValidCoordinate(Double lat, Double lng) {
        return lat != null && lng != null
                && !lat.isNaN() && !lng.isNaN()
                && lat >= -90.0 && lat <= 90.0
                && lng >= -180.0 && lng <= 180.0;
    }
}
