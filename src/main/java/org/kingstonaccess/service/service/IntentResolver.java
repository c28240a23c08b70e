package org.kingstonaccess.service.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.kingstonaccess.service.client.BackboardClient;
import org.kingstonaccess.service.config.BackboardProperties;
import org.kingstonaccess.service.config.RegionProperties;
import org.kingstonaccess.service.exception.ApiException;
import org.kingstonaccess.service.exception.IntentResolutionException;
import org.kingstonaccess.service.model.BoundingBox;
import org.kingstonaccess.service.model.SearchIntent;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Asks the language model to turn free text into a {@link SearchIntent}.
 *
 * <p>Without an API key the default intent is returned straight away. With one, the
 * resolver creates a thread on a lazily created assistant, sends a structured prompt and
 * reads the first JSON object out of the reply. Only the send step is retried, with a
 * linear backoff; when setup fails or retries run out an {@link IntentResolutionException}
 * is thrown for the caller to turn into a fallback.
 */
@Slf4j
@Service
public class IntentResolver {

    static final String NOTE_NO_KEY = "fallback: language model API key not set";
    static final String NOTE_NO_JSON = "fallback: language model returned no JSON object";

    static final String ASSISTANT_NAME = "KingstonAccess AI Search";
    static final String ASSISTANT_DESCRIPTION =
            "Parse natural language parking/search requests into strict JSON for an accessibility parking locator.";

    static final List<String> PROMPT_RULES = List.of(
            "Return ONLY a single JSON object. No markdown, no code fences.",
            "If the user names a place, set query to that place name.",
            "If the user implies a radius, output radius_m (meters). Default 1500.",
            "Output limit for number of parking spots to return. Default 30.",
            "Output place_limit for number of place candidates to return. Default 10.",
            "Keep requests within the region bounds unless user explicitly asks otherwise."
    );

    private final BackboardClient client;
    private final BackboardProperties properties;
    private final RegionProperties regionProperties;
    private final ObjectMapper objectMapper;
    private final JsonObjectExtractor extractor;
    private final Retry sendRetry;

    private final Object assistantLock = new Object();
    private volatile String assistantId;

    public IntentResolver(BackboardClient client,
                          BackboardProperties properties,
                          RegionProperties regionProperties,
                          ObjectMapper objectMapper) {
        this.client = client;
        this.properties = properties;
        this.regionProperties = regionProperties;
        this.objectMapper = objectMapper;
        this.extractor = new JsonObjectExtractor(objectMapper);
        this.sendRetry = Retry.of("backboard-send", sendRetryConfig(properties));
        this.sendRetry.getEventPublisher().onRetry(event ->
                log.warn("Retrying language model send (attempt {}) after: {}",
                        event.getNumberOfRetryAttempts(), ErrorText.shorten(String.valueOf(event.getLastThrowable()))));
    }

    static RetryConfig sendRetryConfig(BackboardProperties properties) {
        long backoffMillis = Math.max(0L, properties.getRetryBackoff().toMillis());
        return RetryConfig.custom()
                .maxAttempts(Math.max(1, properties.getRetries() + 1))
                .intervalFunction(attempt -> backoffMillis * attempt)
                .retryExceptions(ApiException.class)
                .build();
    }

    public SearchIntent resolve(String text, BoundingBox bounds) {
        String raw = text == null ? "" : text.trim();
        if (!properties.hasApiKey()) {
            log.info("No language model API key configured, using default intent");
            return SearchIntent.fallback(raw, NOTE_NO_KEY);
        }

        String threadId = openThread();
        String modelText = send(threadId, buildPrompt(raw, bounds));

        Optional<ObjectNode> parsed = extractor.extractFirstObject(modelText);
        if (parsed.isEmpty()) {
            log.warn("Language model reply had no JSON object: {}", ErrorText.shorten(modelText));
            return new SearchIntent(raw, SearchIntent.DEFAULT_RADIUS_M, SearchIntent.DEFAULT_LIMIT,
                    SearchIntent.DEFAULT_PLACE_LIMIT, NOTE_NO_JSON, modelText);
        }
        SearchIntent intent = fromModel(parsed.get(), raw, modelText);
        log.info("Resolved intent query='{}' radius={} limit={} placeLimit={}",
                intent.query(), intent.radiusM(), intent.limit(), intent.placeLimit());
        return intent;
    }

    /**
     * Reads each field independently; anything missing or unusable takes its default.
     */
    static SearchIntent fromModel(JsonNode node, String rawText, String modelText) {
        String query = textField(node, "query").orElse(rawText);
        int radius = intField(node, "radius_m").orElse(SearchIntent.DEFAULT_RADIUS_M);
        int limit = intField(node, "limit").orElse(SearchIntent.DEFAULT_LIMIT);
        int placeLimit = intField(node, "place_limit").orElse(SearchIntent.DEFAULT_PLACE_LIMIT);
        String notes = textField(node, "notes").orElse("");
        return new SearchIntent(query, radius, limit, placeLimit, notes, modelText);
    }

    String ensureAssistant() {
        String id = assistantId;
        if (id != null) {
            return id;
        }
        synchronized (assistantLock) {
            if (assistantId == null) {
                assistantId = client.createAssistant(ASSISTANT_NAME, ASSISTANT_DESCRIPTION);
                log.info("Created language model assistant {}", assistantId);
            }
            return assistantId;
        }
    }

    private String openThread() {
        try {
            return client.createThread(ensureAssistant());
        } catch (ApiException e) {
            throw new IntentResolutionException(
                    "language model session setup failed: " + ErrorText.shorten(e.getMessage()), e);
        }
    }

    private String send(String threadId, String prompt) {
        try {
            return sendRetry.executeSupplier(() -> client.sendMessage(threadId, prompt));
        } catch (ApiException e) {
            throw new IntentResolutionException(
                    "language model send message failed: " + ErrorText.shorten(e.getMessage()), e);
        }
    }

    String buildPrompt(String text, BoundingBox bounds) {
        ObjectNode prompt = objectMapper.createObjectNode();
        prompt.put("task", "Parse a user's natural language place/parking request into strict JSON for a map app in "
                + regionProperties.getName() + ".");
        PROMPT_RULES.forEach(prompt.putArray("rules")::add);

        ObjectNode box = prompt.putObject("bounds");
        box.put("min_lat", bounds.minLat());
        box.put("max_lat", bounds.maxLat());
        box.put("min_lng", bounds.minLng());
        box.put("max_lng", bounds.maxLng());

        prompt.put("user_text", text);

        ObjectNode schema = prompt.putObject("output_schema");
        schema.put("query", "string");
        schema.put("radius_m", "int");
        schema.put("limit", "int");
        schema.put("place_limit", "int");
        schema.put("notes", "string");

        try {
            return objectMapper.writeValueAsString(prompt);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize intent prompt", e);
        }
    }

    private static Optional<String> textField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            return Optional.empty();
        }
        String text = value.asText().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    /**
     * Numbers and numeric strings, truncated to int. Booleans, non-numeric text and zero are absent.
     */
    private static Optional<Integer> intField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null) {
            return Optional.empty();
        }
        Integer parsed = null;
        if (value.isNumber()) {
            parsed = (int) value.asDouble();
        } else if (value.isTextual()) {
            try {
                parsed = (int) Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return parsed == null || parsed == 0 ? Optional.empty() : Optional.of(parsed);
    }
}
