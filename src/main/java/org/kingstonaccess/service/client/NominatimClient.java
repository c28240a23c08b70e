package org.kingstonaccess.service.client;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.kingstonaccess.service.exception.IrrecoverableApiException;
import org.kingstonaccess.service.exception.RecoverableApiException;
import org.kingstonaccess.service.model.BoundingBox;
import org.kingstonaccess.service.model.NominatimPlace;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Free-text place search against a Nominatim instance.
 */
@Slf4j
@Component
public class NominatimClient {

    private static final ParameterizedTypeReference<List<NominatimPlace>> PLACE_LIST =
            new ParameterizedTypeReference<>() {
            };

    private final RestClient restClient;

    public NominatimClient(@Qualifier("nominatimRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    /**
     * @param query free text, already trimmed and non-blank
     * @param limit maximum number of hits to ask for
     * @param bbox  optional viewport; when present results are bounded to it
     */
    @CircuitBreaker(name = "nominatim")
    @Retry(name = "nominatim")
    public List<NominatimPlace> search(String query, int limit, BoundingBox bbox) {
        log.info("Geocoding query='{}' limit={} bounded={}", query, limit, bbox != null);
        try {
            List<NominatimPlace> places = restClient.get()
                    .uri(builder -> searchUri(builder, query, limit, bbox))
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, (request, response) -> {
                        String msg = "Invalid geocoding request: " + response.getStatusCode();
                        throw new IrrecoverableApiException(msg);
                    })
                    .onStatus(HttpStatusCode::is5xxServerError, (request, response) -> {
                        String msg = "Geocoding service unavailable: "
                                + response.getStatusCode();
                        throw new RecoverableApiException(msg);
                    })
                    .body(PLACE_LIST);
            return places == null ? List.of() : places;
        } catch (IrrecoverableApiException | RecoverableApiException e) {
            throw e;
        } catch (Exception e) {
            log.error("Network error calling geocoding API", e);
            throw new RecoverableApiException("Network error calling geocoding API: " + e.getMessage(), e);
        }
    }

    private static URI searchUri(UriBuilder builder, String query, int limit, BoundingBox bbox) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("q", query);
        vars.put("limit", limit);
        builder.path("/search")
                .queryParam("format", "jsonv2")
                .queryParam("q", "{q}")
                .queryParam("limit", "{limit}")
                .queryParam("addressdetails", 1);
        if (bbox != null) {
            vars.put("viewbox", bbox.toViewbox());
            builder.queryParam("viewbox", "{viewbox}")
                    .queryParam("bounded", 1);
        }
        return builder.build(vars);
    }
}
