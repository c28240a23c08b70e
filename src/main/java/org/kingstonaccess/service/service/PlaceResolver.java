package org.kingstonaccess.service.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.kingstonaccess.service.client.NominatimClient;
import org.kingstonaccess.service.config.RegionProperties;
import org.kingstonaccess.service.model.BoundingBox;
import org.kingstonaccess.service.model.NominatimPlace;
import org.kingstonaccess.service.model.PlaceCandidate;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Turns free text into place candidates through the geocoder.
 *
 * <p>Generic grocery requests ("market", "groceries", ...) are expanded into a fixed list of
 * category and regional chain queries. Hits from all queries are merged in first-seen
 * order, deduplicated, and the merge stops as soon as the place limit is reached.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlaceResolver {

    static final Set<String> GENERIC_GROCERY_TERMS = Set.of(
            "market",
            "super market",
            "supermarket",
            "grocery",
            "groceries",
            "grocery store",
            "food store"
    );

    static final List<String> GROCERY_SUBSTRINGS = List.of("supermarket", "grocery", "super market");

    static final List<String> GROCERY_EXPANSIONS = List.of(
            "supermarket",
            "grocery store",
            "Metro Kingston",
            "Food Basics Kingston",
            "No Frills Kingston",
            "FreshCo Kingston",
            "Loblaws Kingston",
            "Walmart Kingston",
            "Costco Kingston"
    );

    private final NominatimClient nominatimClient;
    private final RegionProperties regionProperties;

    /**
     * Single geocoding call for the autocomplete surface. Blank text short-circuits to an
     * empty list without calling the geocoder.
     */
    public List<PlaceCandidate> autocomplete(String text, int limit, BoundingBox bbox) {
        String query = text == null ? "" : text.trim();
        if (query.isEmpty()) {
            return List.of();
        }
        return search(query, SearchLimits.clampAutocompleteLimit(limit), bbox);
    }

    /**
     * Expands the query, runs each expansion in order and merges the hits.
     */
    public List<PlaceCandidate> resolve(String query, int placeLimit, BoundingBox bbox) {
        int limit = SearchLimits.clampPlaceLimit(placeLimit);
        List<String> queries = expandQueries(query);

        Map<String, PlaceCandidate> merged = new LinkedHashMap<>();
        for (String q : queries) {
            for (PlaceCandidate candidate : search(q, limit, bbox)) {
                merged.putIfAbsent(dedupKey(candidate), candidate);
                if (merged.size() >= limit) {
                    break;
                }
            }
            if (merged.size() >= limit) {
                log.debug("Place limit {} reached after query '{}'", limit, q);
                break;
            }
        }
        log.info("Resolved {} places for '{}' using {} queries", merged.size(), query, queries.size());
        return List.copyOf(merged.values());
    }

    public static List<String> expandQueries(String query) {
        String base = query == null ? "" : query.trim();
        if (base.isEmpty()) {
            return List.of();
        }

        String norm = collapseWhitespace(base).toLowerCase(Locale.ROOT);
        boolean generic = GENERIC_GROCERY_TERMS.contains(norm)
                || GROCERY_SUBSTRINGS.stream().anyMatch(norm::contains);
        if (!generic) {
            return List.of(base);
        }

        Map<String, String> unique = new LinkedHashMap<>();
        Stream.concat(Stream.of(base), GROCERY_EXPANSIONS.stream())
                .map(PlaceResolver::collapseWhitespace)
                .filter(s -> !s.isEmpty())
                .forEach(s -> unique.putIfAbsent(s.toLowerCase(Locale.ROOT), s));
        return List.copyOf(unique.values());
    }

    /**
     * The candidate id when it has one, otherwise lat, lon and lowercased label.
     */
    public static String dedupKey(PlaceCandidate candidate) {
        if (StringUtils.hasText(candidate.id())) {
            return candidate.id().trim();
        }
        return compositeKey(candidate.lat(), candidate.lng(), candidate.label());
    }

    static String compositeKey(double lat, double lng, String label) {
        String normalizedLabel = label == null ? "" : label.trim().toLowerCase(Locale.ROOT);
        return lat + ":" + lng + ":" + normalizedLabel;
    }

    private List<PlaceCandidate> search(String query, int limit, BoundingBox bbox) {
        List<PlaceCandidate> candidates = new ArrayList<>();
        for (NominatimPlace place : nominatimClient.search(query, limit, bbox)) {
            toCandidate(place, query).ifPresent(candidates::add);
        }
        return candidates;
    }

    Optional<PlaceCandidate> toCandidate(NominatimPlace place, String query) {
        Optional<Double> lat = parseCoordinate(place.getLat());
        Optional<Double> lng = parseCoordinate(place.getLon());
        if (lat.isEmpty() || lng.isEmpty()) {
            return Optional.empty();
        }

        String name = trimToEmpty(place.getName());
        String display = trimToEmpty(place.getDisplayName());
        String label;
        if (!name.isEmpty()) {
            label = name;
        } else if (!display.isEmpty()) {
            label = display.split(",")[0].trim();
        } else {
            label = query;
        }

        String id;
        if (StringUtils.hasText(place.getPlaceId())) {
            id = place.getPlaceId().trim();
        } else if (StringUtils.hasText(place.getOsmId())) {
            id = place.getOsmId().trim();
        } else {
            id = compositeKey(lat.get(), lng.get(), label);
        }

        return Optional.of(new PlaceCandidate(id, label, subtitle(place), lat.get(), lng.get()));
    }

    /**
     * Short address line: street and postcode when known, else the first two segments of
     * the display name, else the locality.
     */
    String subtitle(NominatimPlace place) {
        NominatimPlace.Address address = place.getAddress() != null
                ? place.getAddress()
                : new NominatimPlace.Address();

        String house = trimToEmpty(address.getHouseNumber());
        String road = firstNonBlank(address.getRoad(), address.getPedestrian(), address.getFootway());
        String city = firstNonBlank(address.getCity(), address.getTown(), address.getVillage());
        String postcode = trimToEmpty(address.getPostcode());

        String street = Stream.of(house, road).filter(s -> !s.isEmpty()).collect(Collectors.joining(" "));
        String parts = Stream.of(street, postcode).filter(s -> !s.isEmpty()).collect(Collectors.joining(", "));
        if (!parts.isEmpty()) {
            return parts;
        }

        String display = trimToEmpty(place.getDisplayName());
        if (!display.isEmpty()) {
            return Stream.of(display.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .limit(2)
                    .collect(Collectors.joining(", "));
        }

        return city.isEmpty() ? regionProperties.getName() : city;
    }

    private static Optional<Double> parseCoordinate(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            double d = Double.parseDouble(value.trim());
            return Double.isFinite(d) ? Optional.of(d) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (StringUtils.hasText(value)) {
                return value.trim();
            }
        }
        return "";
    }

    private static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }

    private static String collapseWhitespace(String value) {
        return value == null ? "" : value.trim().replaceAll("\\s+", " ");
    }
}
