package com.quickshare.upload.client.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quickshare.upload.client.CancellationToken;
import com.quickshare.upload.client.exception.UploadCancelledException;
import com.quickshare.upload.client.exception.UploadException;
import com.quickshare.upload.client.exception.UploadNetworkException;
import com.quickshare.upload.client.exception.UploadServerException;
import com.quickshare.upload.client.exception.UploadStage;
import com.quickshare.upload.client.exception.UploadValidationException;
import com.quickshare.upload.client.port.ChunkTransport;
import com.quickshare.upload.client.port.CompletionFinalizer;
import com.quickshare.upload.client.port.SessionInitiator;
import com.quickshare.upload.model.CompleteResponse;
import com.quickshare.upload.model.ErrorResponse;
import com.quickshare.upload.model.InitiateRequest;
import com.quickshare.upload.model.InitiateResponse;
import com.quickshare.upload.model.util.PayloadValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.LongConsumer;

/**
 * HTTP adapter of the upload service.
 *
 * <p>
 * Endpoints, relative to the base URL:
 * <ul>
 * <li>{@code POST /upload/initiate} with a JSON {@link InitiateRequest}, answering
 * {@code {"upload_id": ...}}</li>
 * <li>{@code PUT /upload/{id}/chunk/{index}} with the raw chunk bytes</li>
 * <li>{@code POST /upload/{id}/complete}, answering {@code {"download_url": ...}}</li>
 * </ul>
 * Non-success responses carry {@code {"error": ...}}; its message ends up in
 * {@link UploadServerException#getError()}.
 *
 * <p>
 * All calls are asynchronous. Each outbound request is tied to the caller's
 * {@link CancellationToken}: firing the token cancels the in-flight exchange and
 * the returned future fails with {@link UploadCancelledException}.
 */
public class HttpUploadApi implements SessionInitiator, ChunkTransport, CompletionFinalizer {

    private static final Logger log = LoggerFactory.getLogger(HttpUploadApi.class);

    /** Size of the body slices chunk progress is reported at. */
    static final int PROGRESS_SLICE_SIZE = 64 * 1024;

    private final RequestFactory requests;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final PayloadValidator validator;

    /**
     * @param baseUrl        service base URL, e.g. {@code http://localhost:8000/v1}
     * @param httpClient     client to send requests with; null for a default one
     * @param defaultHeaders headers added to every request, e.g. authorization
     * @param requestTimeout per-request timeout, or null for none
     */
    public HttpUploadApi(String baseUrl, HttpClient httpClient, Map<String, String> defaultHeaders,
                         Duration requestTimeout) {
        this.requests = new RequestFactory(baseUrl, defaultHeaders, requestTimeout);
        this.httpClient = httpClient != null ? httpClient : HttpClient.newHttpClient();
        this.objectMapper = new ObjectMapper();
        this.validator = PayloadValidator.getDefault();
    }

    public String getBaseUrl() {
        return requests.getBaseUrl();
    }

    @Override
    public CompletableFuture<String> initiate(InitiateRequest request, CancellationToken token) {
        List<String> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            return CompletableFuture.failedFuture(new UploadValidationException(violations));
        }
        String body;
        try {
            body = objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    new UploadException(UploadStage.INITIATE, "Failed to initiate upload: " + e.getOriginalMessage(), e));
        }
        HttpRequest httpRequest = requests.newRequest("/upload/initiate", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        log.debug("Initiating upload of {} ({} bytes, {} chunks)", request.getFileName(), request.getTotalSize(),
                request.getTotalChunks());
        return exchange(httpRequest, UploadStage.INITIATE, null, null, token)
                .thenApply(response -> read(response, InitiateResponse.class, UploadStage.INITIATE, null).getUploadId());
    }

    @Override
    public CompletableFuture<Void> send(String sessionId, int chunkIndex, byte[] bytes, CancellationToken token,
                                        LongConsumer progress) {
        String path = "/upload/" + RequestFactory.pathSegment(sessionId) + "/chunk/" + chunkIndex;
        HttpRequest httpRequest = requests.newRequest(path, "application/octet-stream")
                .PUT(chunkBody(bytes, progress))
                .build();
        return exchange(httpRequest, UploadStage.CHUNK, sessionId, chunkIndex, token)
                .thenApply(response -> null);
    }

    @Override
    public CompletableFuture<String> complete(String sessionId, CancellationToken token) {
        String path = "/upload/" + RequestFactory.pathSegment(sessionId) + "/complete";
        HttpRequest httpRequest = requests.newRequest(path, null)
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();
        return exchange(httpRequest, UploadStage.FINALIZE, sessionId, null, token)
                .thenApply(response -> read(response, CompleteResponse.class, UploadStage.FINALIZE, sessionId)
                        .getDownloadUrl());
    }

    /**
     * Sends the request and maps the outcome: cancellation wins over any result,
     * transport errors become {@link UploadNetworkException} and non-2xx statuses
     * become {@link UploadServerException}.
     */
    private CompletableFuture<HttpResponse<String>> exchange(HttpRequest request, UploadStage stage, String sessionId,
                                                             Integer chunkIndex, CancellationToken token) {
        if (token.isCancellationRequested()) {
            return CompletableFuture.failedFuture(new UploadCancelledException(stage, sessionId, chunkIndex, List.of()));
        }
        CompletableFuture<HttpResponse<String>> call = httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        CancellationToken.Registration registration = token.register(() -> call.cancel(true));
        CompletableFuture<HttpResponse<String>> result = new CompletableFuture<>();
        call.whenComplete((response, error) -> {
            registration.close();
            if (token.isCancellationRequested()) {
                result.completeExceptionally(new UploadCancelledException(stage, sessionId, chunkIndex, List.of()));
            } else if (error != null) {
                result.completeExceptionally(new UploadNetworkException(stage, sessionId, chunkIndex, unwrap(error)));
            } else if (response.statusCode() < 200 || response.statusCode() >= 300) {
                String message = errorMessage(response);
                log.debug("{} {} answered HTTP {}: {}", request.method(), request.uri(), response.statusCode(), message);
                result.completeExceptionally(
                        new UploadServerException(stage, sessionId, chunkIndex, response.statusCode(), message));
            } else {
                result.complete(response);
            }
        });
        return result;
    }

    private <T> T read(HttpResponse<String> response, Class<T> type, UploadStage stage, String sessionId) {
        T payload;
        try {
            payload = objectMapper.readValue(response.body(), type);
        } catch (JsonProcessingException e) {
            throw new UploadServerException(stage, sessionId, null, response.statusCode(),
                    "Malformed response: " + e.getOriginalMessage());
        }
        List<String> violations = validator.validate(payload);
        if (!violations.isEmpty()) {
            throw new UploadServerException(stage, sessionId, null, response.statusCode(),
                    "Invalid response: " + String.join("; ", violations));
        }
        return payload;
    }

    private String errorMessage(HttpResponse<String> response) {
        String body = response.body();
        if (body == null || body.isBlank()) {
            return "HTTP " + response.statusCode();
        }
        try {
            ErrorResponse envelope = objectMapper.readValue(body, ErrorResponse.class);
            if (envelope.getError() != null && !envelope.getError().isBlank()) {
                return envelope.getError();
            }
        } catch (JsonProcessingException e) {
            log.trace("Error body is not an error envelope: {}", e.getOriginalMessage());
        }
        return body;
    }

    private static HttpRequest.BodyPublisher chunkBody(byte[] bytes, LongConsumer progress) {
        if (bytes.length == 0) {
            return HttpRequest.BodyPublishers.noBody();
        }
        return HttpRequest.BodyPublishers.fromPublisher(
                HttpRequest.BodyPublishers.ofByteArrays(new ProgressSlices(bytes, progress)), bytes.length);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Hands the chunk to the HTTP client in slices and reports the cumulative
     * number of bytes handed out. The client may iterate more than once, e.g. on
     * a redirect, in which case progress restarts and repeats values.
     */
    static final class ProgressSlices implements Iterable<byte[]> {
        private final byte[] bytes;
        private final LongConsumer progress;

        ProgressSlices(byte[] bytes, LongConsumer progress) {
            this.bytes = bytes;
            this.progress = progress;
        }

        @Override
        public Iterator<byte[]> iterator() {
            return new Iterator<>() {
                private int offset;

                @Override
                public boolean hasNext() {
                    return offset < bytes.length;
                }

                @Override
                public byte[] next() {
                    if (!hasNext()) {
                        throw new NoSuchElementException();
                    }
                    int end = Math.min(offset + PROGRESS_SLICE_SIZE, bytes.length);
                    byte[] slice = Arrays.copyOfRange(bytes, offset, end);
                    offset = end;
                    if (progress != null) {
                        progress.accept(offset);
                    }
                    return slice;
                }
            };
        }
    }
}
