package com.quickshare.upload.client;

/**
 * Owner side of a {@link CancellationToken}. One source exists per upload
 * attempt; firing it is idempotent.
 */
public final class CancellationSource {

    private final CancellationToken token = new CancellationToken();

    public CancellationToken token() {
        return token;
    }

    /**
     * Requests cancellation and runs every callback currently registered on the
     * token.
     */
    public void cancel() {
        token.cancel();
    }

    public boolean isCancellationRequested() {
        return token.isCancellationRequested();
    }
}
