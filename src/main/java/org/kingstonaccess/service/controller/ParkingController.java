package org.kingstonaccess.service.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.kingstonaccess.service.exception.DatasetUnavailableException;
import org.kingstonaccess.service.exception.InvalidRequestException;
import org.kingstonaccess.service.model.AvailabilityPrediction;
import org.kingstonaccess.service.model.GeoPoint;
import org.kingstonaccess.service.model.HealthResponse;
import org.kingstonaccess.service.model.NearbySpot;
import org.kingstonaccess.service.model.NearbySpotsRequest;
import org.kingstonaccess.service.model.ParkingSpot;
import org.kingstonaccess.service.model.ScoredLot;
import org.kingstonaccess.service.model.SearchIntent;
import org.kingstonaccess.service.repository.LotIndex;
import org.kingstonaccess.service.repository.ParkingDataRepository;
import org.kingstonaccess.service.repository.ParkingDataset;
import org.kingstonaccess.service.repository.SpotIndex;
import org.kingstonaccess.service.service.AvailabilityModel;
import org.kingstonaccess.service.service.SearchLimits;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Coordinate-based endpoints over the loaded dataset.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ParkingController {

    static final int DEFAULT_SPOT_COUNT = 5;

    private final ParkingDataRepository repository;
    private final AvailabilityModel availabilityModel;
    private final Clock clock;

    @GetMapping("/health")
    public HealthResponse health() {
        ParkingDataset dataset = repository.current();
        return new HealthResponse("ok", dataset.spots().size(), dataset.lots().size(), dataset.source());
    }

    @GetMapping("/nearby")
    public List<ScoredLot> nearbyLots(@RequestParam Double lat,
                                      @RequestParam Double lng,
                                      @RequestParam(name = "radius_m", required = false) String radiusM,
                                      @RequestParam(name = "radius_meters", required = false) String radiusMeters,
                                      @RequestParam(required = false) String limit) {
        GeoPoint center = point(lat, lng);
        LotIndex lots = repository.current().lots();
        if (lots.isEmpty()) {
            throw new DatasetUnavailableException("No parking lots loaded");
        }

        double radius = parseRadius(radiusM != null ? radiusM : radiusMeters);
        int count = parseLimit(limit);
        List<ScoredLot> result = lots.nearbyWithScores(center, radius, count);
        log.debug("Nearby lots at {} radius={} limit={}: {}", center, radius, count, result.size());
        return result;
    }

    @PostMapping("/spots/nearby")
    public List<NearbySpot> nearbySpots(@RequestBody NearbySpotsRequest request) {
        GeoPoint center = point(request.lat(), request.lon());
        SpotIndex<ParkingSpot> spots = repository.current().spots();
        if (spots.isEmpty()) {
            throw new DatasetUnavailableException("No parking spots loaded");
        }

        int k = SearchLimits.clampLimit(request.k() == null ? DEFAULT_SPOT_COUNT : request.k());
        Double radius = request.radiusM() == null ? null : SearchLimits.clampRadius(request.radiusM());
        return spots.nearby(center, radius, k).stream()
                .map(NearbySpot::from)
                .toList();
    }

    /**
     * @param when ISO-8601 timestamp; offset timestamps are converted to the region's zone,
     *             local ones are taken as region time; absent means now
     */
    @GetMapping("/predict/probability")
    public AvailabilityPrediction predict(@RequestParam Double lat,
                                          @RequestParam Double lon,
                                          @RequestParam(required = false) String when) {
        return availabilityModel.predict(point(lat, lon), localTime(when));
    }

    LocalDateTime localTime(String when) {
        if (when == null || when.isBlank()) {
            return LocalDateTime.now(clock);
        }
        String value = when.trim();
        try {
            return OffsetDateTime.parse(value).atZoneSameInstant(clock.getZone()).toLocalDateTime();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(value);
            } catch (DateTimeParseException inner) {
                throw new InvalidRequestException("when must be an ISO-8601 timestamp: " + value);
            }
        }
    }

    // unparsable radius or limit falls back to the default instead of failing the request
    static double parseRadius(String value) {
        if (value == null || value.isBlank()) {
            return SearchIntent.DEFAULT_RADIUS_M;
        }
        try {
            double radius = Double.parseDouble(value.trim());
            return Double.isFinite(radius) ? radius : SearchIntent.DEFAULT_RADIUS_M;
        } catch (NumberFormatException e) {
            log.debug("Ignoring radius '{}': {}", value, e.getMessage());
            return SearchIntent.DEFAULT_RADIUS_M;
        }
    }

    static int parseLimit(String value) {
        if (value == null || value.isBlank()) {
            return SearchIntent.DEFAULT_LIMIT;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring limit '{}': {}", value, e.getMessage());
            return SearchIntent.DEFAULT_LIMIT;
        }
    }

    private static GeoPoint point(Double lat, Double lon) {
        if (lat == null || lon == null) {
            throw new InvalidRequestException("lat and lon are required");
        }
        if (!GeoPoint.isValid(lat, lon)) {
            throw new InvalidRequestException("coordinates out of range: " + lat + "," + lon);
        }
        return new GeoPoint(lat, lon);
    }
}
