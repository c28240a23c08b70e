package org.kingstonaccess.service.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record NearbySpot(
        String id,
        double lat,
        double lon,
        @JsonProperty("spot_type") String spotType,
        String rules,
        String address,
        String description,
        @JsonProperty("distance_m") double distanceM
) {

    public static NearbySpot from(Ranked<ParkingSpot> ranked) {
        ParkingSpot spot = ranked.item();
        return new NearbySpot(spot.id(), spot.lat(), spot.lon(), spot.spotType(),
                spot.rules(), spot.address(), spot.description(), ranked.distanceM());
    }
}
