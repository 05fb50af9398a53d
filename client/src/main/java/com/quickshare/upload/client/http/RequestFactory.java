package com.quickshare.upload.client.http;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds requests against the upload service: resolves paths against the base
 * URL and applies the configured default headers and timeout.
 */
class RequestFactory {

    private final String baseUrl;
    private final Map<String, String> defaultHeaders;
    private final Duration requestTimeout;

    RequestFactory(String baseUrl, Map<String, String> defaultHeaders, Duration requestTimeout) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Upload service base URL is not configured");
        }
        String trimmed = baseUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        this.baseUrl = trimmed;
        this.defaultHeaders = defaultHeaders == null ? Map.of() : new LinkedHashMap<>(defaultHeaders);
        this.requestTimeout = requestTimeout;
    }

    String getBaseUrl() {
        return baseUrl;
    }

    /**
     * @param path        path below the base URL, starting with a slash
     * @param contentType content type of the body, or null for requests without one
     */
    HttpRequest.Builder newRequest(String path, String contentType) {
        HttpRequest.Builder builder = HttpRequest.newBuilder().uri(URI.create(baseUrl + path));
        defaultHeaders.forEach((name, value) -> {
            // the endpoint decides the body type
            if (!"Content-Type".equalsIgnoreCase(name)) {
                builder.header(name, value);
            }
        });
        if (contentType != null) {
            builder.header("Content-Type", contentType);
        }
        if (requestTimeout != null) {
            builder.timeout(requestTimeout);
        }
        return builder;
    }

    static String pathSegment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
