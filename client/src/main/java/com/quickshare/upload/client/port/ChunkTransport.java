package com.quickshare.upload.client.port;

import com.quickshare.upload.client.CancellationToken;

import java.util.concurrent.CompletableFuture;
import java.util.function.LongConsumer;

/**
 * Transfers the bytes of one chunk.
 *
 * <p>
 * The orchestrator keeps exactly one chunk in flight per session, so
 * implementations never see overlapping calls for the same session.
 */
public interface ChunkTransport {

    /**
     * Sends one chunk.
     *
     * <p>
     * The future completes normally only once the server has acknowledged that the
     * chunk is persisted. When {@code token} fires mid-transfer the implementation
     * must stop, release what it holds and complete exceptionally.
     *
     * @param sessionId  session the chunk belongs to
     * @param chunkIndex one-based chunk index
     * @param bytes      chunk content; must not be modified by the transport
     * @param token      cancellation signal of the current attempt
     * @param progress   optional sink for cumulative bytes sent so far; may be called
     *                   from any thread and with repeated values
     * @return future completing on acknowledgement
     */
    CompletableFuture<Void> send(String sessionId, int chunkIndex, byte[] bytes, CancellationToken token,
                                 LongConsumer progress);
}
