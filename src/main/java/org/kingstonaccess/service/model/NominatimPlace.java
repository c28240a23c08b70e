package org.kingstonaccess.service.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One element of a Nominatim {@code jsonv2} search response. Coordinates arrive as strings.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class NominatimPlace {

    @JsonProperty("place_id")
    private String placeId;

    @JsonProperty("osm_id")
    private String osmId;

    private String name;

    @JsonProperty("display_name")
    private String displayName;

    private String lat;
    private String lon;

    private Address address;
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Address {
        @JsonProperty("house_number")
        private String houseNumber;
        private String road;
        private String pedestrian;
        private String footway;
        private String city;
        private String town;
        private String village;
        private String postcode;
    }
}
