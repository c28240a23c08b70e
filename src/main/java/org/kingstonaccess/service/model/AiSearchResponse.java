package org.kingstonaccess.service.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AiSearchResponse(
        SearchIntent intent,
        @JsonProperty("selected_place") PlaceCandidate selectedPlace,
        List<PlaceCandidate> places,
        List<ScoredLot> spots
) {
}
