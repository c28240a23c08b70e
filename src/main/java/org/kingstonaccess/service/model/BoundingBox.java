package org.kingstonaccess.service.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record BoundingBox(
        @JsonProperty("min_lat") double minLat,
        @JsonProperty("max_lat") double maxLat,
        @JsonProperty("min_lng") double minLng,
        @JsonProperty("max_lng") double maxLng
) {

    /**
     * Viewport in the order the geocoder expects: left,top,right,bottom.
     */
    public String toViewbox() {
        return minLng + "," + maxLat + "," + maxLng + "," + minLat;
    }
}
