package org.kingstonaccess.service.geo;

import org.kingstonaccess.service.model.GeoPoint;

/**
 * Great-circle distance between two WGS84 coordinates. This is the ranking key
 * for every "nearby" query, so all callers go through here.
 */
public final class Haversine {

    // Mean radius of the Earth in metres.
    public static final double EARTH_RADIUS_M = 6371000.0;

    private Haversine() {
    }

    /**
     * @return the distance between the two points in metres
     */
    public static double distanceMeters(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_M * c;
    }

    public static double distanceMeters(GeoPoint a, GeoPoint b) {
        return distanceMeters(a.lat(), a.lon(), b.lat(), b.lon());
    }
}
