package com.quickshare.upload.client.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Fetches the file extensions the service accepts from
 * {@code GET /supported-extensions}.
 *
 * <p>
 * The first answer is cached; concurrent callers share one in-flight request.
 * When the service cannot be reached or answers with an unusable list,
 * {@link #FALLBACK_EXTENSIONS} is cached instead, so lookups never fail.
 */
public class SupportedExtensionsClient {

    private static final Logger log = LoggerFactory.getLogger(SupportedExtensionsClient.class);

    public static final List<String> FALLBACK_EXTENSIONS = List.of("pdf", "docx");

    private final RequestFactory requests;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private final Object lock = new Object();
    private List<String> cached;
    private CompletableFuture<List<String>> pending;

    public SupportedExtensionsClient(String baseUrl, HttpClient httpClient, Map<String, String> defaultHeaders,
                                     Duration requestTimeout) {
        this.requests = new RequestFactory(baseUrl, defaultHeaders, requestTimeout);
        this.httpClient = httpClient != null ? httpClient : HttpClient.newHttpClient();
    }

    /**
     * @return future of the accepted extensions, without leading dots; never
     *         completes exceptionally
     */
    public CompletableFuture<List<String>> supportedExtensions() {
        synchronized (lock) {
            if (cached != null) {
                return CompletableFuture.completedFuture(cached);
            }
            if (pending != null) {
                return pending.copy();
            }
            CompletableFuture<List<String>> call;
            try {
                call = fetch();
            } catch (RuntimeException e) {
                call = CompletableFuture.failedFuture(e);
            }
            CompletableFuture<List<String>> request = call.handle((extensions, error) -> {
                List<String> result = extensions;
                if (error != null) {
                    log.warn("Failed to load supported extensions, using {}: {}", FALLBACK_EXTENSIONS, error.getMessage());
                    result = FALLBACK_EXTENSIONS;
                } else if (extensions.isEmpty()) {
                    log.warn("Service returned no supported extensions, using {}", FALLBACK_EXTENSIONS);
                    result = FALLBACK_EXTENSIONS;
                }
                synchronized (lock) {
                    cached = result;
                    pending = null;
                }
                return result;
            });
            // a synchronously completed request has already filled the cache
            pending = request.isDone() ? null : request;
            return request.copy();
        }
    }

    /**
     * @return the cached extensions, or the fallback list if none were loaded yet
     */
    public List<String> cachedOrFallback() {
        synchronized (lock) {
            return cached != null ? cached : FALLBACK_EXTENSIONS;
        }
    }

    /**
     * Drops the cached list; the next lookup asks the service again.
     */
    public void invalidate() {
        synchronized (lock) {
            cached = null;
        }
    }

    private CompletableFuture<List<String>> fetch() {
        HttpRequest request = requests.newRequest("/supported-extensions", null).GET().build();
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> {
                    if (response.statusCode() != 200) {
                        throw new IllegalStateException("HTTP " + response.statusCode());
                    }
                    try {
                        return parse(response.body());
                    } catch (IOException e) {
                        throw new IllegalStateException("Malformed response: " + e.getMessage(), e);
                    }
                });
    }

    List<String> parse(String body) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(body == null ? "" : body);
        JsonNode extensions = root == null ? null : root.path("extensions");
        if (extensions == null || !extensions.isArray()) {
            return List.of();
        }
        Set<String> result = new LinkedHashSet<>();
        for (JsonNode node : extensions) {
            if (!node.isTextual()) {
                continue;
            }
            String extension = node.asText().trim();
            if (extension.startsWith(".")) {
                extension = extension.substring(1);
            }
            if (!extension.isEmpty()) {
                result.add(extension);
            }
        }
        return List.copyOf(result);
    }
}
