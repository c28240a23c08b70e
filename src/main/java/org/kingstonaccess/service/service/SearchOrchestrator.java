package org.kingstonaccess.service.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.kingstonaccess.service.config.RegionProperties;
import org.kingstonaccess.service.exception.IntentResolutionException;
import org.kingstonaccess.service.model.AiSearchResponse;
import org.kingstonaccess.service.model.BoundingBox;
import org.kingstonaccess.service.model.PlaceCandidate;
import org.kingstonaccess.service.model.ScoredLot;
import org.kingstonaccess.service.model.SearchIntent;
import org.kingstonaccess.service.repository.ParkingDataRepository;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * End-to-end natural-language search: intent, then places, then lots around the first place.
 *
 * <p>Language-model failures never reach the caller; they become the default intent with a
 * note saying why. Geocoding failures do propagate.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SearchOrchestrator {

    private final IntentResolver intentResolver;
    private final PlaceResolver placeResolver;
    private final ParkingDataRepository repository;
    private final RegionProperties regionProperties;

    public AiSearchResponse search(String text, BoundingBox bbox) {
        BoundingBox bounds = bbox != null ? bbox : regionProperties.defaultBounds();
        SearchIntent intent = resolveIntent(text, bounds);

        List<PlaceCandidate> places = placeResolver.resolve(intent.query(), intent.placeLimit(), bounds);
        if (places.isEmpty()) {
            log.info("No places found for '{}'", intent.query());
            return new AiSearchResponse(intent, null, List.of(), List.of());
        }

        PlaceCandidate anchor = places.get(0);
        List<ScoredLot> spots = repository.current().lots()
                .nearbyWithScores(anchor.location(), intent.radiusM(), intent.limit());
        log.info("Search '{}' anchored at '{}': {} places, {} lots", text, anchor.label(), places.size(), spots.size());
        return new AiSearchResponse(intent, anchor, places, spots);
    }

    private SearchIntent resolveIntent(String text, BoundingBox bounds) {
        try {
            return intentResolver.resolve(text, bounds);
        } catch (IntentResolutionException e) {
            log.warn("Intent resolution failed, using default intent: {}", e.getMessage());
            return SearchIntent.fallback(text,
                    "fallback: language model unavailable (" + ErrorText.shorten(e.getMessage()) + ")");
        }
    }
}
