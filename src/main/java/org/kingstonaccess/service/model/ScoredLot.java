package org.kingstonaccess.service.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ScoredLot(
        String id,
        String label,
        double lat,
        double lng,
        @JsonProperty("distance_m") double distanceM,
        double probability
) {
}
