package com.quickshare.upload.client.http;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@SuppressWarnings("unchecked")
@ExtendWith(MockitoExtension.class)
class SupportedExtensionsClientTest {

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> httpResponse;

    private SupportedExtensionsClient client;

    @BeforeEach
    void setUp() {
        client = new SupportedExtensionsClient("http://localhost:8000/v1", httpClient, null, null);
    }

    private void respond(int status, String body) {
        doReturn(CompletableFuture.completedFuture(httpResponse))
                .when(httpClient).sendAsync(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));
        lenient().when(httpResponse.statusCode()).thenReturn(status);
        lenient().when(httpResponse.body()).thenReturn(body);
    }

    @Test
    void testLookup_ParsesAndCaches() {
        respond(200, "{\"extensions\":[\"pdf\",\".png\",\"pdf\",\" \",42,\"zip\"]}");

        assertEquals(List.of("pdf", "png", "zip"), client.supportedExtensions().join());
        assertEquals(List.of("pdf", "png", "zip"), client.supportedExtensions().join());
        assertEquals(List.of("pdf", "png", "zip"), client.cachedOrFallback());

        verify(httpClient, times(1)).sendAsync(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));
    }

    @Test
    void testLookup_ConcurrentCallersShareRequest() {
        CompletableFuture<HttpResponse<String>> inFlight = new CompletableFuture<>();
        doReturn(inFlight).when(httpClient).sendAsync(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));
        when(httpResponse.statusCode()).thenReturn(200);
        when(httpResponse.body()).thenReturn("{\"extensions\":[\"txt\"]}");

        CompletableFuture<List<String>> first = client.supportedExtensions();
        CompletableFuture<List<String>> second = client.supportedExtensions();
        inFlight.complete(httpResponse);

        assertEquals(List.of("txt"), first.join());
        assertEquals(List.of("txt"), second.join());
        verify(httpClient, times(1)).sendAsync(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));
    }

    @Test
    void testLookup_FallsBackOnNetworkError() {
        doReturn(CompletableFuture.failedFuture(new ConnectException("Connection refused")))
                .when(httpClient).sendAsync(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));

        assertEquals(SupportedExtensionsClient.FALLBACK_EXTENSIONS, client.supportedExtensions().join());
        assertEquals(SupportedExtensionsClient.FALLBACK_EXTENSIONS, client.cachedOrFallback());
    }

    @Test
    void testLookup_FallsBackOnErrorStatus() {
        respond(503, "unavailable");

        assertEquals(SupportedExtensionsClient.FALLBACK_EXTENSIONS, client.supportedExtensions().join());
    }

    @Test
    void testLookup_FallsBackOnEmptyOrMalformedList() {
        respond(200, "{\"extensions\":[]}");
        assertEquals(SupportedExtensionsClient.FALLBACK_EXTENSIONS, client.supportedExtensions().join());

        client.invalidate();
        respond(200, "{\"extensions\":\"pdf\"}");
        assertEquals(SupportedExtensionsClient.FALLBACK_EXTENSIONS, client.supportedExtensions().join());

        client.invalidate();
        respond(200, "not json");
        assertEquals(SupportedExtensionsClient.FALLBACK_EXTENSIONS, client.supportedExtensions().join());
    }

    @Test
    void testInvalidate_RefetchesList() {
        respond(200, "{\"extensions\":[\"pdf\"]}");
        client.supportedExtensions().join();

        client.invalidate();
        respond(200, "{\"extensions\":[\"docx\"]}");

        assertEquals(List.of("docx"), client.supportedExtensions().join());
    }

    @Test
    void testCachedOrFallback_BeforeFirstLookup() {
        assertEquals(SupportedExtensionsClient.FALLBACK_EXTENSIONS, client.cachedOrFallback());
        verifyNoInteractions(httpClient);
    }
}
