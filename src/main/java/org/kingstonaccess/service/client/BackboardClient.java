package org.kingstonaccess.service.client;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.kingstonaccess.service.config.BackboardProperties;
import org.kingstonaccess.service.exception.ApiException;
import org.kingstonaccess.service.exception.IrrecoverableApiException;
import org.kingstonaccess.service.exception.RecoverableApiException;
import org.kingstonaccess.service.model.BackboardMessageResponse;
import org.kingstonaccess.service.service.ErrorText;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin client for the assistant/thread/message API of the language-model service.
 * Each call maps to one HTTP request; retries and fallback live in the caller.
 */
@Slf4j
@Component
public class BackboardClient {

    static final String API_KEY_HEADER = "X-API-Key";

    private final RestClient messageClient;
    private final RestClient sessionClient;
    private final BackboardProperties properties;

    public BackboardClient(@Qualifier("backboardRestClient") RestClient messageClient,
                           @Qualifier("backboardSessionRestClient") RestClient sessionClient,
                           BackboardProperties properties) {
        this.messageClient = messageClient;
        this.sessionClient = sessionClient;
        this.properties = properties;
    }

    /**
     * Creates an assistant bound to the configured provider and model.
     *
     * @return the new assistant id
     */
    public String createAssistant(String name, String description) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", name);
        payload.put("description", description);
        payload.put("llm_provider", properties.getLlmProvider());
        payload.put("llm_model_name", properties.getModelName());
        payload.put("tools", List.of());

        JsonNode body = postSession("/assistants", payload, "create assistant");
        return requireText(body, "assistant_id");
    }

    /**
     * @return the new thread id
     */
    public String createThread(String assistantId) {
        JsonNode body = postSession("/assistants/" + assistantId + "/threads", Map.of(), "create thread");
        return requireText(body, "thread_id");
    }

    /**
     * Sends one message with memory off and returns the model's reply text (trimmed, possibly empty).
     */
    public String sendMessage(String threadId, String content) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("content", content);
        form.add("stream", "false");
        form.add("memory", "off");
        form.add("send_to_llm", "true");
        form.add("llm_provider", properties.getLlmProvider());
        form.add("model_name", properties.getModelName());

        ResponseEntity<BackboardMessageResponse> response;
        try {
            response = messageClient.post()
                    .uri("/threads/{threadId}/messages", threadId)
                    .header(API_KEY_HEADER, properties.getApiKey())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (request, resp) -> {
                        String text = new String(resp.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        String msg = "send message failed: " + resp.getStatusCode().value() + " "
                                + ErrorText.shorten(text);
                        if (resp.getStatusCode().is4xxClientError()) {
                            throw new IrrecoverableApiException(msg);
                        }
                        throw new RecoverableApiException(msg);
                    })
                    .toEntity(BackboardMessageResponse.class);
        } catch (ApiException e) {
            throw e;
        } catch (Exception e) {
            log.error("Network error calling language model send message", e);
            throw new RecoverableApiException("send message failed: " + e.getMessage(), e);
        }

        if (response.getStatusCode().value() != HttpStatus.OK.value()) {
            throw new RecoverableApiException("send message failed: " + response.getStatusCode().value());
        }
        BackboardMessageResponse body = response.getBody();
        if (body == null || body.getContent() == null) {
            return "";
        }
        return body.getContent().trim();
    }

    private JsonNode postSession(String path, Object payload, String operation) {
        ResponseEntity<JsonNode> response;
        try {
            response = sessionClient.post()
                    .uri(path)
                    .header(API_KEY_HEADER, properties.getApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, (request, resp) -> {
                        throw new IrrecoverableApiException(operation + " failed: " + resp.getStatusCode().value());
                    })
                    .onStatus(HttpStatusCode::is5xxServerError, (request, resp) -> {
                        throw new RecoverableApiException(operation + " failed: " + resp.getStatusCode().value());
                    })
                    .toEntity(JsonNode.class);
        } catch (ApiException e) {
            throw e;
        } catch (Exception e) {
            log.error("Network error calling language model {}", operation, e);
            throw new RecoverableApiException(operation + " failed: " + e.getMessage(), e);
        }

        int status = response.getStatusCode().value();
        if (status != HttpStatus.OK.value() && status != HttpStatus.CREATED.value()) {
            throw new IrrecoverableApiException(operation + " failed: " + status);
        }
        return response.getBody();
    }

    private static String requireText(JsonNode body, String field) {
        String value = body == null ? "" : body.path(field).asText("").trim();
        if (value.isEmpty()) {
            throw new IrrecoverableApiException(field + " missing in response");
        }
        return value;
    }
}
