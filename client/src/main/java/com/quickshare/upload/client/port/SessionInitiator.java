package com.quickshare.upload.client.port;

import com.quickshare.upload.client.CancellationToken;
import com.quickshare.upload.model.InitiateRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Opens an upload session on the server.
 */
public interface SessionInitiator {

    /**
     * Opens a session for the described file.
     *
     * <p>
     * The returned future completes exceptionally with
     * <ul>
     * <li>{@code UploadValidationException} for an empty or oversized file name, or a
     * non-positive size or chunk count</li>
     * <li>{@code UploadNetworkException} on transport failure</li>
     * <li>{@code UploadServerException} on a non-success response</li>
     * <li>{@code UploadCancelledException} if {@code token} fires first</li>
     * </ul>
     *
     * @param request file metadata
     * @param token   cancellation signal of the current attempt
     * @return future of the non-blank session id
     */
    CompletableFuture<String> initiate(InitiateRequest request, CancellationToken token);
}
