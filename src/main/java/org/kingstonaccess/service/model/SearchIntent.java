package org.kingstonaccess.service.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.kingstonaccess.service.service.SearchLimits;

/**
 * Structured form of a free-text search. Numeric fields are clamped on construction.
 */
public record SearchIntent(
        String query,
        @JsonProperty("radius_m") int radiusM,
        int limit,
        @JsonProperty("place_limit") int placeLimit,
        String notes,
        @JsonIgnore String rawModelText
) {

    public static final int DEFAULT_RADIUS_M = SearchLimits.DEFAULT_RADIUS_M;
    public static final int DEFAULT_LIMIT = 30;
    public static final int DEFAULT_PLACE_LIMIT = 10;

    public SearchIntent {
        radiusM = SearchLimits.clampRadius(radiusM);
        limit = SearchLimits.clampLimit(limit);
        placeLimit = SearchLimits.clampPlaceLimit(placeLimit);
        notes = notes == null ? "" : notes;
    }

    /**
     * Default parameters for the raw text, used whenever the language model gives nothing usable.
     */
    public static SearchIntent fallback(String text, String notes) {
        return new SearchIntent(text == null ? "" : text.trim(), DEFAULT_RADIUS_M, DEFAULT_LIMIT,
                DEFAULT_PLACE_LIMIT, notes, null);
    }
}
