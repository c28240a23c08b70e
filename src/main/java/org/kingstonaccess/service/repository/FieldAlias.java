package org.kingstonaccess.service.repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Candidate source-column names for each logical attribute, in priority order.
 * The first name whose value is present and not blank wins.
 */
public enum FieldAlias {

    LATITUDE("lat", "latitude", "LAT", "Y"),
    LONGITUDE("lon", "lng", "longitude", "LON", "X"),
    SPOT_ID("id", "ID", "objectid", "OBJECTID", "spot_id"),
    SPOT_TYPE("type", "TYPE", "spot_type", "SpaceType", "category"),
    RULES("rules", "RULES", "regulation", "Regulations", "payment"),
    ADDRESS("address", "ADDRESS", "street", "Street", "location"),
    DESCRIPTION("description", "DESCRIPTION", "desc", "notes"),
    LOT_ID("LOT_ID", "OBJECTID"),
    LOT_LABEL("LOT_NAME", "MAP_LABEL", "OBJECTID"),
    ACCESSIBLE_SPACES("HANDICAP_SPACE", "handicap_spaces", "accessible_spaces"),
    CAPACITY("CAPACITY", "capacity");

    private final List<String> names;

    FieldAlias(String... names) {
        this.names = List.of(names);
    }

    public List<String> names() {
        return names;
    }

    public Optional<Object> lookup(Map<String, ?> row) {
        for (String name : names) {
            Object value = row.get(name);
            if (value == null) {
                continue;
            }
            if (value instanceof String text && text.isBlank()) {
                continue;
            }
            return Optional.of(value);
        }
        return Optional.empty();
    }

    public Optional<String> text(Map<String, ?> row) {
        return lookup(row).map(value -> String.valueOf(value).trim());
    }

    public Optional<Double> number(Map<String, ?> row) {
        return lookup(row).flatMap(FieldAlias::parseDouble);
    }

    public Optional<Integer> integer(Map<String, ?> row) {
        return lookup(row).flatMap(FieldAlias::parseInt);
    }

    /**
     * Accepts numbers and numeric strings. Booleans, blanks and anything unparsable are absent.
     */
    static Optional<Double> parseDouble(Object value) {
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isFinite(d) ? Optional.of(d) : Optional.empty();
        }
        if (value instanceof String text) {
            String s = text.trim();
            if (s.isEmpty()) {
                return Optional.empty();
            }
            try {
                double d = Double.parseDouble(s);
                return Double.isFinite(d) ? Optional.of(d) : Optional.empty();
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Like {@link #parseDouble(Object)} but truncates toward zero, so {@code "12.0"} reads as 12.
     */
    static Optional<Integer> parseInt(Object value) {
        return parseDouble(value).map(Double::intValue);
    }
}
