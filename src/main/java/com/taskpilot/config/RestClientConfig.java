package com.taskpilot.config;

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
 * Logs every outgoing RestClient call (npm registry, non-streaming model calls) on the
 * {@code com.taskpilot.http.logging} logger. Credentials are masked.
 */
@Configuration
public class RestClientConfig {

    static final String HTTP_LOGGER = "com.taskpilot.http.logging";
    private static final int MAX_BODY_LOG = 2000;

    @Bean
    public RestClientCustomizer restClientCustomizer() {
        return restClientBuilder -> {
            restClientBuilder.requestInterceptor(new LoggingRequestInterceptor());
            // buffered so the interceptor can read the body and the caller still gets it
            restClientBuilder.requestFactory(new BufferingClientHttpRequestFactory(new SimpleClientHttpRequestFactory()));
        };
    }

    static class LoggingRequestInterceptor implements ClientHttpRequestInterceptor {
        private static final Logger httpLogger = LoggerFactory.getLogger(HTTP_LOGGER);

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution)
                throws IOException {
            long started = System.currentTimeMillis();
            if (httpLogger.isDebugEnabled()) {
                httpLogger.debug("--> {} {} headers={}", request.getMethod(), request.getURI(), masked(request.getHeaders()));
                if (body.length > 0) {
                    httpLogger.debug("--> body: {}", abbreviate(new String(body, StandardCharsets.UTF_8)));
                }
            }
            ClientHttpResponse response = execution.execute(request, body);
            httpLogger.info("{} {} -> {} ({} ms)", request.getMethod(), request.getURI(),
                    response.getStatusCode().value(), System.currentTimeMillis() - started);
            if (httpLogger.isDebugEnabled()) {
                byte[] responseBody = StreamUtils.copyToByteArray(response.getBody());
                if (responseBody.length > 0) {
                    httpLogger.debug("<-- body: {}", abbreviate(new String(responseBody, StandardCharsets.UTF_8)));
                }
            }
            return response;
        }

        static HttpHeaders masked(HttpHeaders headers) {
            HttpHeaders copy = new HttpHeaders();
            copy.putAll(headers);
            if (copy.containsKey(HttpHeaders.AUTHORIZATION)) {
                copy.set(HttpHeaders.AUTHORIZATION, "***");
            }
            return copy;
        }

        private static String abbreviate(String value) {
            return value.length() <= MAX_BODY_LOG ? value : value.substring(0, MAX_BODY_LOG) + "...";
        }
    }
}
