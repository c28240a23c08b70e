package org.kingstonaccess.service.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * One {@link RestClient} per downstream service, each with its own base URL and timeouts.
 */
@Configuration
public class RestClientConfig {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

    @Bean
    public RestClient nominatimRestClient(RestClient.Builder builder,
                                          @Value("${app.nominatim.base-url}") String baseUrl,
                                          @Value("${app.nominatim.user-agent}") String userAgent,
                                          @Value("${app.nominatim.timeout:10s}") Duration timeout) {
        return builder.clone()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
                .requestFactory(requestFactory(timeout))
                .build();
    }

    @Bean
    public RestClient backboardRestClient(RestClient.Builder builder, BackboardProperties properties) {
        return builder.clone()
                .baseUrl(properties.getBaseUrl())
                .requestFactory(requestFactory(properties.getTimeout()))
                .build();
    }

    @Bean
    public RestClient backboardSessionRestClient(RestClient.Builder builder, BackboardProperties properties) {
        return builder.clone()
                .baseUrl(properties.getBaseUrl())
                .requestFactory(requestFactory(properties.getSessionTimeout()))
                .build();
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) CONNECT_TIMEOUT.toMillis());
        factory.setReadTimeout((int) readTimeout.toMillis());
        return factory;
    }
}
