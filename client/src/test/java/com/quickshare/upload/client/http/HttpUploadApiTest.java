package com.quickshare.upload.client.http;

import com.quickshare.upload.client.CancellationSource;
import com.quickshare.upload.client.CancellationToken;
import com.quickshare.upload.client.exception.UploadCancelledException;
import com.quickshare.upload.client.exception.UploadNetworkException;
import com.quickshare.upload.client.exception.UploadServerException;
import com.quickshare.upload.client.exception.UploadStage;
import com.quickshare.upload.client.exception.UploadValidationException;
import com.quickshare.upload.model.InitiateRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@SuppressWarnings("unchecked")
@ExtendWith(MockitoExtension.class)
class HttpUploadApiTest {

    private static final String BASE_URL = "http://localhost:8000/v1";

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> httpResponse;

    private HttpUploadApi api;

    @BeforeEach
    void setUp() {
        api = new HttpUploadApi(BASE_URL + "/", httpClient,
                Map.of("Authorization", "Bearer token", "Content-Type", "text/plain"), Duration.ofSeconds(30));
        lenient().doReturn(CompletableFuture.completedFuture(httpResponse))
                .when(httpClient).sendAsync(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));
    }

    private void respond(int status, String body) {
        lenient().when(httpResponse.statusCode()).thenReturn(status);
        lenient().when(httpResponse.body()).thenReturn(body);
    }

    private HttpRequest sentRequest() {
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).sendAsync(captor.capture(), any(HttpResponse.BodyHandler.class));
        return captor.getValue();
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        CompletionException e = assertThrows(CompletionException.class, future::join);
        return e.getCause();
    }

    @Test
    void testInitiate_Success() {
        respond(200, "{\"upload_id\":\"abc-123\"}");

        String sessionId = api.initiate(new InitiateRequest("report.pdf", 12_000_000, 3), CancellationToken.none()).join();

        assertEquals("abc-123", sessionId);
        HttpRequest request = sentRequest();
        assertEquals("POST", request.method());
        assertEquals(URI.create(BASE_URL + "/upload/initiate"), request.uri());
        assertEquals(List.of("application/json"), request.headers().allValues("Content-Type"));
        assertEquals(Optional.of("Bearer token"), request.headers().firstValue("Authorization"));
        assertEquals(Optional.of(Duration.ofSeconds(30)), request.timeout());
        String expectedBody = "{\"file_name\":\"report.pdf\",\"total_size\":12000000,\"total_chunks\":3}";
        assertEquals(expectedBody.length(), request.bodyPublisher().orElseThrow().contentLength());
    }

    @Test
    void testInitiate_InvalidRequestIsNotSent() {
        Throwable failure = failureOf(api.initiate(new InitiateRequest("", 0, 0), CancellationToken.none()));

        UploadValidationException error = assertInstanceOf(UploadValidationException.class, failure);
        assertEquals(3, error.getViolations().size(), error.getViolations().toString());
        verify(httpClient, never()).sendAsync(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));
    }

    @Test
    void testInitiate_ErrorEnvelope() {
        respond(400, "{\"error\":\"Invalid file type\"}");

        Throwable failure = failureOf(api.initiate(new InitiateRequest("a.exe", 10, 1), CancellationToken.none()));

        UploadServerException error = assertInstanceOf(UploadServerException.class, failure);
        assertEquals(UploadStage.INITIATE, error.getStage());
        assertEquals(400, error.getStatusCode());
        assertEquals("Invalid file type", error.getError());
        assertEquals("Failed to initiate upload: Invalid file type (HTTP 400)", error.getMessage());
    }

    @Test
    void testInitiate_ErrorWithoutEnvelope() {
        respond(502, "Bad Gateway");

        Throwable failure = failureOf(api.initiate(new InitiateRequest("a.pdf", 10, 1), CancellationToken.none()));

        UploadServerException error = assertInstanceOf(UploadServerException.class, failure);
        assertEquals(502, error.getStatusCode());
        assertEquals("Bad Gateway", error.getError());
    }

    @Test
    void testInitiate_ErrorWithEmptyBody() {
        respond(500, "");

        Throwable failure = failureOf(api.initiate(new InitiateRequest("a.pdf", 10, 1), CancellationToken.none()));

        assertEquals("HTTP 500", assertInstanceOf(UploadServerException.class, failure).getError());
    }

    @Test
    void testInitiate_MalformedSuccessBody() {
        respond(200, "{\"id\":\"abc\"}");

        Throwable failure = failureOf(api.initiate(new InitiateRequest("a.pdf", 10, 1), CancellationToken.none()));

        UploadServerException error = assertInstanceOf(UploadServerException.class, failure);
        assertEquals(200, error.getStatusCode());
        assertTrue(error.getError().startsWith("Invalid response"), error.getError());
    }

    @Test
    void testSend_PutsRawBytes() {
        respond(200, "{}");
        byte[] bytes = new byte[1000];

        api.send("abc 123", 2, bytes, CancellationToken.none(), null).join();

        HttpRequest request = sentRequest();
        assertEquals("PUT", request.method());
        assertEquals(URI.create(BASE_URL + "/upload/abc%20123/chunk/2"), request.uri());
        assertEquals(List.of("application/octet-stream"), request.headers().allValues("Content-Type"));
        assertEquals(1000, request.bodyPublisher().orElseThrow().contentLength());
    }

    @Test
    void testSend_NetworkError() {
        doReturn(CompletableFuture.failedFuture(new ConnectException("Connection refused")))
                .when(httpClient).sendAsync(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));

        Throwable failure = failureOf(api.send("abc", 2, new byte[10], CancellationToken.none(), null));

        UploadNetworkException error = assertInstanceOf(UploadNetworkException.class, failure);
        assertEquals(UploadStage.CHUNK, error.getStage());
        assertEquals(2, error.getChunkIndex());
        assertEquals("abc", error.getSessionId());
        assertInstanceOf(ConnectException.class, error.getCause());
        assertEquals("Failed to upload chunk 2: network error (Connection refused)", error.getMessage());
    }

    @Test
    void testSend_CancelAbortsInFlightRequest() {
        CompletableFuture<HttpResponse<String>> inFlight = new CompletableFuture<>();
        doReturn(inFlight).when(httpClient).sendAsync(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));
        CancellationSource cancellation = new CancellationSource();

        CompletableFuture<Void> sent = api.send("abc", 1, new byte[10], cancellation.token(), null);
        assertFalse(sent.isDone());
        cancellation.cancel();

        assertTrue(inFlight.isCancelled());
        UploadCancelledException error = assertInstanceOf(UploadCancelledException.class, failureOf(sent));
        assertEquals(1, error.getChunkIndex());
    }

    @Test
    void testSend_AlreadyCancelledTokenSendsNothing() {
        CancellationSource cancellation = new CancellationSource();
        cancellation.cancel();

        Throwable failure = failureOf(api.send("abc", 1, new byte[10], cancellation.token(), null));

        assertInstanceOf(UploadCancelledException.class, failure);
        verify(httpClient, never()).sendAsync(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));
    }

    @Test
    void testComplete_Success() {
        respond(200, "{\"download_url\":\"https://files.example.com/d/abc\",\"size\":10}");

        String locator = api.complete("abc", CancellationToken.none()).join();

        assertEquals("https://files.example.com/d/abc", locator);
        HttpRequest request = sentRequest();
        assertEquals("POST", request.method());
        assertEquals(URI.create(BASE_URL + "/upload/abc/complete"), request.uri());
        assertTrue(request.headers().firstValue("Content-Type").isEmpty());
    }

    @Test
    void testComplete_MissingChunksError() {
        respond(409, "{\"error\":\"Missing chunks: 3\"}");

        Throwable failure = failureOf(api.complete("abc", CancellationToken.none()));

        UploadServerException error = assertInstanceOf(UploadServerException.class, failure);
        assertEquals(UploadStage.FINALIZE, error.getStage());
        assertEquals("abc", error.getSessionId());
        assertEquals("Missing chunks: 3", error.getError());
    }

    @Test
    void testComplete_InvalidDownloadUrl() {
        respond(200, "{\"download_url\":\"not a url\"}");

        Throwable failure = failureOf(api.complete("abc", CancellationToken.none()));

        assertInstanceOf(UploadServerException.class, failure);
    }

    @Test
    void testProgressSlices_ReportCumulativeBytes() {
        byte[] bytes = new byte[HttpUploadApi.PROGRESS_SLICE_SIZE * 2 + 100];
        for (int i = 0; i < bytes.length; i++) {
            bytes[i] = (byte) i;
        }
        List<Long> reported = new ArrayList<>();
        ByteArrayOutputStream joined = new ByteArrayOutputStream();

        for (byte[] slice : new HttpUploadApi.ProgressSlices(bytes, reported::add)) {
            joined.writeBytes(slice);
        }

        assertArrayEquals(bytes, joined.toByteArray());
        assertEquals(List.of((long) HttpUploadApi.PROGRESS_SLICE_SIZE, (long) HttpUploadApi.PROGRESS_SLICE_SIZE * 2,
                (long) bytes.length), reported);
    }

    @Test
    void testBaseUrl_TrailingSlashTrimmed() {
        assertEquals(BASE_URL, api.getBaseUrl());
        assertThrows(IllegalArgumentException.class, () -> new HttpUploadApi(" ", httpClient, null, null));
    }
}
