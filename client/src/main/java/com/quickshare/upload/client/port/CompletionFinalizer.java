package com.quickshare.upload.client.port;

import com.quickshare.upload.client.CancellationToken;

import java.util.concurrent.CompletableFuture;

/**
 * Closes a session whose chunks have all been persisted.
 */
public interface CompletionFinalizer {

    /**
     * Completes the session and returns where the assembled file can be downloaded.
     * Fails with {@code UploadNetworkException} or {@code UploadServerException},
     * e.g. when the server disagrees that every chunk is present.
     *
     * @param sessionId session to close
     * @param token     cancellation signal of the current attempt
     * @return future of the download locator
     */
    CompletableFuture<String> complete(String sessionId, CancellationToken token);
}
