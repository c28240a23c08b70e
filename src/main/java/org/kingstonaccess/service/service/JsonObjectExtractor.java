package org.kingstonaccess.service.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Pulls one JSON object out of free-form model output.
 *
 * <p>First the whole trimmed text is parsed. If that is not an object, the first balanced
 * top-level {@code {...}} span is located by counting braces (ignoring braces inside string
 * literals) and parsed on its own.
 */
@Slf4j
public final class JsonObjectExtractor {

    private final ObjectMapper objectMapper;

    public JsonObjectExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<ObjectNode> extractFirstObject(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        Optional<ObjectNode> whole = parseObject(trimmed);
        if (whole.isPresent()) {
            return whole;
        }
        return firstBalancedObject(trimmed).flatMap(this::parseObject);
    }

    static Optional<String> firstBalancedObject(String text) {
        int start = text.indexOf('{');
        if (start < 0) {
            return Optional.empty();
        }
        int end = matchingBrace(text, start);
        if (end < 0) {
            return Optional.empty();
        }
        return Optional.of(text.substring(start, end + 1));
    }

    private static int matchingBrace(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private Optional<ObjectNode> parseObject(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            if (node != null && node.isObject()) {
                return Optional.of((ObjectNode) node);
            }
        } catch (JsonProcessingException e) {
            log.debug("Not a JSON object: {}", e.getOriginalMessage());
        }
        return Optional.empty();
    }
}
