package org.eagowl.fleetoptimizer.util;

import org.eagowl.fleetoptimizer.model.Coordinate;

public class GeoUtils {
    public static final double EARTH_RADIUS_KM = 6371;

    private GeoUtils() {
    }

    /**
     * Great-circle distance in kilometers between two points given in degrees, using the
     * haversine formula. Coordinates are not range checked.
     */
    public static double haversineDistance(double lat1, double lon1, double lat2, double lon2) {
        double lat1Rad = Math.toRadians(lat1);
        double lat2Rad = Math.toRadians(lat2);
        double deltaLat = lat2Rad - lat1Rad;
        double deltaLon = Math.toRadians(lon2) - Math.toRadians(lon1);

        double a = Math.pow(Math.sin(deltaLat / 2), 2)
            + Math.cos(lat1Rad) * Math.cos(lat2Rad) * Math.pow(Math.sin(deltaLon / 2), 2);

        return EARTH_RADIUS_KM * 2 * Math.asin(Math.sqrt(a));
    }

    public static double haversineDistance(Coordinate from, Coordinate to) {
        return haversineDistance(from.getLatitude(), from.getLongitude(), to.getLatitude(), to.getLongitude());
    }
}
