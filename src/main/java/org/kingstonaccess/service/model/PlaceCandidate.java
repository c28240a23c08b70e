package org.kingstonaccess.service.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One geocoding hit, shaped for display.
 */
public record PlaceCandidate(
        String id,
        String label,
        String subtitle,
        double lat,
        double lng
) {

    @JsonIgnore
    public GeoPoint location() {
        return new GeoPoint(lat, lng);
    }
}
