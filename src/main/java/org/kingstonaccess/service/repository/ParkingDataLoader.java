package org.kingstonaccess.service.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.kingstonaccess.service.exception.DatasetLoadException;
import org.kingstonaccess.service.geo.GeometryReducer;
import org.kingstonaccess.service.model.GeoPoint;
import org.kingstonaccess.service.model.ParkingLot;
import org.kingstonaccess.service.model.ParkingSpot;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the static parking dataset and normalizes it into spots and lots.
 *
 * <p>Supported inputs, chosen by file extension:
 * <ul>
 *   <li>{@code .geojson} / {@code .json} FeatureCollection: feature properties plus the
 *       geometry reduced to one point</li>
 *   <li>{@code .json} list of flat objects</li>
 *   <li>{@code .csv} with a header row; values past the last header column are ignored</li>
 * </ul>
 * Records without a usable coordinate are dropped without comment.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ParkingDataLoader {

    private static final char BOM = '\uFEFF';

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public ParkingDataset load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new DatasetLoadException("Parking dataset not found: " + location);
        }

        List<Map<String, Object>> rows = readRows(resource, location);

        List<ParkingSpot> spots = new ArrayList<>();
        List<ParkingLot> lots = new ArrayList<>();
        for (int idx = 0; idx < rows.size(); idx++) {
            Map<String, Object> row = rows.get(idx);
            toSpot(row, idx).ifPresent(spots::add);
            toLot(row, idx).ifPresent(lots::add);
        }
        log.debug("Normalized {} rows from {}: spots={}, lots={}", rows.size(), location, spots.size(), lots.size());

        return new ParkingDataset(new SpotIndex<>(spots), new LotIndex(lots), location, Instant.now());
    }

    static Optional<ParkingSpot> toSpot(Map<String, Object> row, int idx) {
        Optional<GeoPoint> point = location(row);
        if (point.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ParkingSpot(
                FieldAlias.SPOT_ID.text(row).orElse(String.valueOf(idx)),
                point.get().lat(),
                point.get().lon(),
                FieldAlias.SPOT_TYPE.text(row).orElse(null),
                FieldAlias.RULES.text(row).orElse(null),
                FieldAlias.ADDRESS.text(row).orElse(null),
                FieldAlias.DESCRIPTION.text(row).orElse(null)
        ));
    }

    static Optional<ParkingLot> toLot(Map<String, Object> row, int idx) {
        Optional<GeoPoint> point = location(row);
        if (point.isEmpty()) {
            return Optional.empty();
        }
        String fallbackId = String.valueOf(idx);
        return Optional.of(new ParkingLot(
                FieldAlias.LOT_ID.text(row).orElse(fallbackId),
                FieldAlias.LOT_LABEL.text(row).orElse(fallbackId),
                point.get().lat(),
                point.get().lon(),
                FieldAlias.ACCESSIBLE_SPACES.integer(row).orElse(null),
                FieldAlias.CAPACITY.integer(row).orElse(null)
        ));
    }

    private static Optional<GeoPoint> location(Map<String, Object> row) {
        Optional<Double> lat = FieldAlias.LATITUDE.number(row);
        Optional<Double> lon = FieldAlias.LONGITUDE.number(row);
        if (lat.isEmpty() || lon.isEmpty() || !GeoPoint.isValid(lat.get(), lon.get())) {
            return Optional.empty();
        }
        return Optional.of(new GeoPoint(lat.get(), lon.get()));
    }

    private List<Map<String, Object>> readRows(Resource resource, String location) {
        String filename = resource.getFilename() == null ? location : resource.getFilename();
        String lower = filename.toLowerCase(Locale.ROOT);
        try {
            if (lower.endsWith(".csv")) {
                return readCsv(resource);
            }
            if (lower.endsWith(".json") || lower.endsWith(".geojson")) {
                return readJson(resource, location);
            }
        } catch (IOException | RuntimeJsonMappingException e) {
            throw new DatasetLoadException("Could not read parking dataset " + location + ": " + e.getMessage(), e);
        }
        throw new DatasetLoadException("Unsupported file extension for " + location + " (expected .csv/.json/.geojson)");
    }

    private List<Map<String, Object>> readJson(Resource resource, String location) throws IOException {
        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = objectMapper.readTree(in);
        }
        if (root != null && root.isObject() && root.has("features")) {
            return featureRows(root.path("features"));
        }
        if (root != null && root.isArray()) {
            List<Map<String, Object>> rows = new ArrayList<>();
            for (JsonNode element : root) {
                rows.add(element.isObject() ? toMap(element) : new LinkedHashMap<>());
            }
            return rows;
        }
        throw new DatasetLoadException("Unsupported JSON structure in " + location);
    }

    private List<Map<String, Object>> featureRows(JsonNode features) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (JsonNode feature : features) {
            if (!feature.isObject()) {
                rows.add(new LinkedHashMap<>());
                continue;
            }
            JsonNode properties = feature.path("properties");
            Map<String, Object> row = properties.isObject() ? toMap(properties) : new LinkedHashMap<>();
            GeometryReducer.reduce(feature.path("geometry")).ifPresent(point -> {
                fillIfMissing(row, "lat", point.lat());
                fillIfMissing(row, "lon", point.lon());
            });
            rows.add(row);
        }
        return rows;
    }

    private static void fillIfMissing(Map<String, Object> row, String key, double value) {
        Object existing = row.get(key);
        if (existing == null || (existing instanceof String text && text.isBlank())) {
            row.put(key, value);
        }
    }

    private List<Map<String, Object>> readCsv(Resource resource) throws IOException {
        String text;
        try (InputStream in = resource.getInputStream()) {
            text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            text = text.substring(1);
        }

        CsvMapper csvMapper = CsvMapper.builder()
                .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
                .build();
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<Map<String, Object>> rows = new ArrayList<>();
        try (MappingIterator<Map<String, String>> it = csvMapper.readerForMapOf(String.class)
                .with(schema)
                .readValues(text)) {
            while (it.hasNext()) {
                rows.add(new LinkedHashMap<>(it.next()));
            }
        }
        return rows;
    }

    private Map<String, Object> toMap(JsonNode node) {
        Map<String, Object> map = new LinkedHashMap<>();
        ((ObjectNode) node).fields().forEachRemaining(entry ->
                map.put(entry.getKey(), objectMapper.convertValue(entry.getValue(), Object.class)));
        return map;
    }
}
