package org.kingstonaccess.service.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.kingstonaccess.service.config.RegionProperties;
import org.kingstonaccess.service.exception.InvalidRequestException;
import org.kingstonaccess.service.model.AiSearchRequest;
import org.kingstonaccess.service.model.AiSearchResponse;
import org.kingstonaccess.service.model.BoundingBox;
import org.kingstonaccess.service.model.PlaceCandidate;
import org.kingstonaccess.service.service.PlaceResolver;
import org.kingstonaccess.service.service.SearchOrchestrator;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Text-based endpoints: place autocomplete and natural-language parking search.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class SearchController {

    private final PlaceResolver placeResolver;
    private final SearchOrchestrator searchOrchestrator;
    private final RegionProperties regionProperties;

    /**
     * The viewport is applied only when all four corners are given.
     */
    @GetMapping("/autocomplete")
    public List<PlaceCandidate> autocomplete(@RequestParam(required = false) String q,
                                             @RequestParam(name = "query", required = false) String query,
                                             @RequestParam(defaultValue = "20") int limit,
                                             @RequestParam(name = "min_lat", required = false) Double minLat,
                                             @RequestParam(name = "min_lng", required = false) Double minLng,
                                             @RequestParam(name = "max_lat", required = false) Double maxLat,
                                             @RequestParam(name = "max_lng", required = false) Double maxLng) {
        String text = q != null ? q : query;
        BoundingBox bbox = minLat != null && minLng != null && maxLat != null && maxLng != null
                ? new BoundingBox(minLat, maxLat, minLng, maxLng)
                : null;
        return placeResolver.autocomplete(text, limit, bbox);
    }

    @GetMapping("/ai/search")
    public AiSearchResponse aiSearch(@RequestParam(required = false) String q,
                                     @RequestParam(required = false) String text,
                                     @RequestParam(name = "min_lat", required = false) Double minLat,
                                     @RequestParam(name = "min_lng", required = false) Double minLng,
                                     @RequestParam(name = "max_lat", required = false) Double maxLat,
                                     @RequestParam(name = "max_lng", required = false) Double maxLng) {
        return search(new AiSearchRequest(q, text), minLat, minLng, maxLat, maxLng);
    }

    /**
     * Same as the GET form; text comes from the JSON body, falling back to query parameters.
     */
    @PostMapping("/ai/search")
    public AiSearchResponse aiSearchPost(@RequestBody(required = false) AiSearchRequest body,
                                         @RequestParam(required = false) String q,
                                         @RequestParam(required = false) String text,
                                         @RequestParam(name = "min_lat", required = false) Double minLat,
                                         @RequestParam(name = "min_lng", required = false) Double minLng,
                                         @RequestParam(name = "max_lat", required = false) Double maxLat,
                                         @RequestParam(name = "max_lng", required = false) Double maxLng) {
        AiSearchRequest request = body != null && !body.effectiveText().isEmpty()
                ? body
                : new AiSearchRequest(q, text);
        return search(request, minLat, minLng, maxLat, maxLng);
    }

    private AiSearchResponse search(AiSearchRequest request,
                                    Double minLat, Double minLng, Double maxLat, Double maxLng) {
        String text = request.effectiveText();
        if (text.isEmpty()) {
            throw new InvalidRequestException("Provide q or text");
        }

        BoundingBox defaults = regionProperties.defaultBounds();
        BoundingBox bbox = new BoundingBox(
                minLat != null ? minLat : defaults.minLat(),
                maxLat != null ? maxLat : defaults.maxLat(),
                minLng != null ? minLng : defaults.minLng(),
                maxLng != null ? maxLng : defaults.maxLng());
        log.info("AI search text='{}'", text);
        return searchOrchestrator.search(text, bbox);
    }
}
