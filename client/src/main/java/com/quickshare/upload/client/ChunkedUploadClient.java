package com.quickshare.upload.client;

import com.quickshare.upload.client.http.HttpUploadApi;
import com.quickshare.upload.client.http.SupportedExtensionsClient;
import com.quickshare.upload.client.source.UploadSource;
import com.quickshare.upload.model.UploadOutcome;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Client of the QuickShare upload service.
 *
 * <p>
 * Wires the HTTP adapter into {@link UploadOrchestrator}s and exposes the
 * service's supported-extensions lookup.
 *
 * <p>
 * Usage:
 * <pre>
 * ChunkedUploadClient client = new ChunkedUploadClient.Builder()
 *     .apiBaseUrl("http://localhost:8000/v1")
 *     .header("Authorization", "Bearer ...")
 *     .build();
 *
 * UploadOutcome outcome = client.upload(filePath, UploadListener.NONE).join();
 * </pre>
 */
public class ChunkedUploadClient {

    private final HttpUploadApi api;
    private final SupportedExtensionsClient extensions;
    private final int chunkSize;
    private final Executor executor;

    private ChunkedUploadClient(Builder builder) {
        HttpClient httpClient = builder.httpClient != null ? builder.httpClient
                : HttpClient.newBuilder().connectTimeout(builder.connectTimeout).build();
        this.api = new HttpUploadApi(builder.apiBaseUrl, httpClient, builder.headers, builder.requestTimeout);
        this.extensions = new SupportedExtensionsClient(builder.apiBaseUrl, httpClient, builder.headers,
                builder.requestTimeout);
        this.chunkSize = builder.chunkSize;
        this.executor = builder.executor;
    }

    public String getApiBaseUrl() {
        return api.getBaseUrl();
    }

    /**
     * Creates an orchestrator bound to this client's service. Each orchestrator
     * runs at most one upload at a time; use several for parallel uploads.
     *
     * @param listener receives state changes and progress of every attempt
     */
    public UploadOrchestrator newOrchestrator(UploadListener listener) {
        return new UploadOrchestrator.Builder()
                .api(api)
                .chunkSize(chunkSize)
                .executor(executor)
                .listener(listener)
                .build();
    }

    /**
     * Uploads a file with a dedicated orchestrator.
     *
     * @param filePath Path to the file to be uploaded. Must exist.
     * @param listener receives state changes and progress
     * @return future of the session id and download URL
     * @throws IllegalArgumentException if filePath is null or not a regular file
     * @throws com.quickshare.upload.client.exception.UploadValidationException if the file is empty or its name is invalid
     */
    public CompletableFuture<UploadOutcome> upload(Path filePath, UploadListener listener) {
        if (filePath == null || !Files.isRegularFile(filePath)) {
            throw new IllegalArgumentException("filePath is required and must exist: " + filePath);
        }
        UploadSource source;
        try {
            source = UploadSource.of(filePath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + filePath, e);
        }
        return newOrchestrator(listener).start(source);
    }

    /**
     * @return future of the extensions the service accepts; falls back to
     *         {@link SupportedExtensionsClient#FALLBACK_EXTENSIONS} when the
     *         service cannot tell
     */
    public CompletableFuture<List<String>> supportedExtensions() {
        return extensions.supportedExtensions();
    }

    /**
     * Builder for {@link ChunkedUploadClient}.
     */
    public static class Builder {
        private String apiBaseUrl;
        private int chunkSize = UploadOrchestrator.DEFAULT_CHUNK_SIZE;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout;
        private HttpClient httpClient;
        private Executor executor = ForkJoinPool.commonPool();

        /**
         * Sets the service base URL.
         *
         * @param apiBaseUrl base URL all endpoints are relative to (e.g. http://localhost:8000/v1)
         * @return this builder instance
         */
        public Builder apiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = apiBaseUrl;
            return this;
        }

        /**
         * @param chunkSize bytes per chunk (default: 5 MiB)
         * @return this builder instance
         */
        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        /**
         * Adds a header sent with every request, e.g. an authorization token.
         *
         * @return this builder instance
         */
        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        /**
         * Connect timeout of the default HttpClient; ignored with a custom client.
         *
         * @return this builder instance
         */
        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        /**
         * @param requestTimeout per-request timeout; null (default) waits indefinitely
         * @return this builder instance
         */
        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        /**
         * Sets a custom HttpClient instance.
         *
         * @param httpClient Custom HttpClient for making HTTP requests
         * @return this builder instance
         */
        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        /**
         * @param executor executor running upload continuations (default: common pool)
         * @return this builder instance
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        /**
         * Builds the client.
         *
         * @return configured client
         * @throws IllegalStateException if the base URL is missing or a setting is invalid
         */
        public ChunkedUploadClient build() {
            if (apiBaseUrl == null || apiBaseUrl.isBlank()) {
                throw new IllegalStateException("Upload service base URL is not configured");
            }
            if (chunkSize <= 0) {
                throw new IllegalStateException("chunkSize must be positive");
            }
            if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
                throw new IllegalStateException("connectTimeout must be positive");
            }
            if (requestTimeout != null && (requestTimeout.isNegative() || requestTimeout.isZero())) {
                throw new IllegalStateException("requestTimeout must be positive");
            }
            if (executor == null) {
                throw new IllegalStateException("executor is required");
            }
            return new ChunkedUploadClient(this);
        }
    }
}
