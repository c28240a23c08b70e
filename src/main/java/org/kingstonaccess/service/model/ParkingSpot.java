package org.kingstonaccess.service.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A normalized parking record loaded from the static dataset.
 * Attributes other than id and coordinates are optional free text.
 */
public record ParkingSpot(
        String id,
        double lat,
        double lon,
        @JsonProperty("spot_type") String spotType,
        String rules,
        String address,
        String description
) implements Locatable {

    @Override
    @JsonIgnore
    public GeoPoint location() {
        return new GeoPoint(lat, lon);
    }
}
