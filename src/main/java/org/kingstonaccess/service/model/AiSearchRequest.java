package org.kingstonaccess.service.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AiSearchRequest(String q, String text) {

    public String effectiveText() {
        String value = q != null && !q.isBlank() ? q : text;
        return value == null ? "" : value.trim();
    }
}
