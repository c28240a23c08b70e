package org.kingstonaccess.service.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record NearbySpotsRequest(
        Double lat,
        Double lon,
        Integer k,
        @JsonProperty("radius_m") Double radiusM
) {
}
