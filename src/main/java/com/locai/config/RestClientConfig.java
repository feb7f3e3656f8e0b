package com.locai.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.BufferingClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Outbound HTTP towards the model endpoint. Local servers accept no key, so a placeholder
 * bearer token is stripped before the request leaves.
 */
@Configuration
public class RestClientConfig {

    static final String HTTP_LOGGER = "com.locai.http.logging";
    private static final int MAX_BODY_LOG = 2000;

    @Bean
    public RestClientCustomizer modelEndpointRestClientCustomizer() {
        return restClientBuilder -> {
            restClientBuilder.requestInterceptor(new ModelEndpointInterceptor());
            restClientBuilder.requestFactory(new BufferingClientHttpRequestFactory(new SimpleClientHttpRequestFactory()));
        };
    }

    static class ModelEndpointInterceptor implements ClientHttpRequestInterceptor {
        private static final Logger httpLogger = LoggerFactory.getLogger(HTTP_LOGGER);

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution)
                throws IOException {
            stripPlaceholderKey(request.getHeaders());
            if (httpLogger.isDebugEnabled()) {
                httpLogger.debug("--> {} {} ({} bytes) {}", request.getMethod(), request.getURI(), body.length,
                        snippet(body));
            }
            long started = System.nanoTime();
            ClientHttpResponse response = execution.execute(request, body);
            if (httpLogger.isDebugEnabled()) {
                long tookMs = (System.nanoTime() - started) / 1_000_000L;
                byte[] responseBody = StreamUtils.copyToByteArray(response.getBody());
                httpLogger.debug("<-- {} {} in {} ms {}", response.getStatusCode(), request.getURI(), tookMs,
                        snippet(responseBody));
            }
            return response;
        }

        static void stripPlaceholderKey(HttpHeaders headers) {
            String auth = headers.getFirst(HttpHeaders.AUTHORIZATION);
            if (auth == null) {
                return;
            }
            String trimmed = auth.trim();
            if (trimmed.equalsIgnoreCase("Bearer none") || trimmed.equalsIgnoreCase("Bearer EMPTY")
                    || trimmed.equalsIgnoreCase("Bearer")) {
                headers.remove(HttpHeaders.AUTHORIZATION);
            }
        }

        private static String snippet(byte[] body) {
            if (body.length == 0) {
                return "";
            }
            String text = new String(body, StandardCharsets.UTF_8);
            return text.length() <= MAX_BODY_LOG ? text : text.substring(0, MAX_BODY_LOG) + "...";
        }
    }
}
