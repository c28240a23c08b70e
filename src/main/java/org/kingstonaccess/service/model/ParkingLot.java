package org.kingstonaccess.service.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lot-centric record: centroid of the lot area plus its accessible-space count
 * and total capacity, either of which may be unknown.
 */
public record ParkingLot(
        String id,
        String label,
        double lat,
        double lng,
        @JsonProperty("handicap_spaces") Integer accessibleSpaces,
        Integer capacity
) implements Locatable {

    @Override
    @JsonIgnore
    public GeoPoint location() {
        return new GeoPoint(lat, lng);
    }
}
