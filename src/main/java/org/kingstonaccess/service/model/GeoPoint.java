package org.kingstonaccess.service.model;

/**
 * WGS84 coordinate in degrees.
 */
public record GeoPoint(double lat, double lon) {

    public static boolean isValid(double lat, double lon) {
        return Double.isFinite(lat) && Double.isFinite(lon)
                && lat >= -90.0 && lat <= 90.0
                && lon >= -180.0 && lon <= 180.0;
    }

    public boolean isValid() {
        return isValid(lat, lon);
    }
}
