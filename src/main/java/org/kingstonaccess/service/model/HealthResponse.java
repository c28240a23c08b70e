package org.kingstonaccess.service.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HealthResponse(
        String status,
        @JsonProperty("loaded_count") int loadedCount,
        @JsonProperty("lots_loaded") int lotsLoaded,
        String source
) {
}
