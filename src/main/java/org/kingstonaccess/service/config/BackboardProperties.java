package org.kingstonaccess.service.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * Connection settings for the language-model service used to parse search text.
 * An empty {@code api-key} disables the service and every search uses the fallback intent.
 */
@Data
@ConfigurationProperties(prefix = "app.backboard")
public class BackboardProperties {

    private String baseUrl = "https://app.backboard.io/api";

    private String apiKey = "";

    private String llmProvider = "openrouter";

    private String modelName = "google/gemini-3-flash-preview";

    /** Read timeout for the message-send call. */
    private Duration timeout = Duration.ofSeconds(60);

    /** Read timeout for assistant and thread creation. */
    private Duration sessionTimeout = Duration.ofSeconds(30);

    /** Extra attempts for the message-send call; 0 means a single attempt. */
    private int retries = 1;

    /** Wait before retry N is {@code retryBackoff * N}. */
    private Duration retryBackoff = Duration.ofSeconds(1);

    public boolean hasApiKey() {
        return StringUtils.hasText(apiKey);
    }
}
