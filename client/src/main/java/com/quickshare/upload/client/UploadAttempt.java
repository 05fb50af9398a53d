package com.quickshare.upload.client;

import com.quickshare.upload.client.source.ChunkReader;
import com.quickshare.upload.client.source.UploadSource;
import com.quickshare.upload.model.Chunk;
import com.quickshare.upload.model.ChunkStatus;
import com.quickshare.upload.model.InitiateRequest;
import com.quickshare.upload.model.ProgressSnapshot;
import com.quickshare.upload.model.UploadOutcome;
import com.quickshare.upload.model.UploadSession;
import com.quickshare.upload.model.UploadState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Mutable state of one upload attempt, exclusively owned by the orchestrator that
 * created it. Every field except the result slot and the event queue is guarded
 * by the orchestrator's lock.
 */
final class UploadAttempt {

    private static final Logger log = LoggerFactory.getLogger(UploadAttempt.class);

    private final UploadSession session;
    private final List<Chunk> chunks;
    private final InitiateRequest request;
    private final UploadSource source;
    private final UploadListener listener;
    private final CancellationSource cancellation = new CancellationSource();

    /** Single-assignment result slot: the first terminal transition completes it. */
    private final CompletableFuture<UploadOutcome> result = new CompletableFuture<>();

    private final Queue<Consumer<UploadListener>> events = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean();

    private ChunkReader reader;
    private ProgressSnapshot lastSnapshot;

    UploadAttempt(UploadSession session, List<Chunk> chunks, InitiateRequest request, UploadSource source,
                  UploadListener listener) {
        this.session = session;
        this.chunks = chunks;
        this.request = request;
        this.source = source;
        this.listener = listener;
    }

    UploadSession session() {
        return session;
    }

    UploadState state() {
        return session.getState();
    }

    List<Chunk> chunks() {
        return chunks;
    }

    InitiateRequest request() {
        return request;
    }

    UploadListener listener() {
        return listener;
    }

    CancellationToken token() {
        return cancellation.token();
    }

    boolean isCancellationRequested() {
        return cancellation.isCancellationRequested();
    }

    CompletableFuture<UploadOutcome> result() {
        return result;
    }

    ProgressSnapshot lastSnapshot() {
        return lastSnapshot;
    }

    void lastSnapshot(ProgressSnapshot snapshot) {
        this.lastSnapshot = snapshot;
    }

    ChunkReader reader() {
        return reader;
    }

    void openReader() throws IOException {
        reader = source.open();
    }

    void enqueueEvent(Consumer<UploadListener> event) {
        events.add(event);
    }

    /**
     * Hands queued listener events to {@code deliver} in order. One thread drains
     * at a time; events queued while another thread drains are delivered by that
     * thread, including events queued from within a listener.
     */
    void drainEvents(Consumer<Consumer<UploadListener>> deliver) {
        while (!events.isEmpty() && draining.compareAndSet(false, true)) {
            try {
                Consumer<UploadListener> event;
                while ((event = events.poll()) != null) {
                    deliver.accept(event);
                }
            } finally {
                draining.set(false);
            }
        }
    }

    /**
     * @return the chunk currently handed to the transport, or null
     */
    Chunk inFlightChunk() {
        return chunks.stream().filter(c -> c.getStatus() == ChunkStatus.IN_FLIGHT).findFirst().orElse(null);
    }

    List<Integer> succeededChunkIndices() {
        return chunks.stream()
                .filter(c -> c.getStatus() == ChunkStatus.SUCCEEDED)
                .map(Chunk::getIndex)
                .collect(Collectors.toList());
    }

    void closeReader() {
        ChunkReader current = reader;
        reader = null;
        if (current == null) {
            return;
        }
        try {
            current.close();
        } catch (IOException e) {
            log.warn("Failed to close reader of upload source {}: {}", source.getName(), e.getMessage());
        }
    }

    /**
     * Releases everything the attempt holds: fires the cancellation signal so no
     * collaborator call outlives the attempt, then closes the chunk reader.
     */
    void release() {
        cancellation.cancel();
        closeReader();
    }
}
