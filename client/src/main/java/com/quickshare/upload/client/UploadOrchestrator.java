package com.quickshare.upload.client;

import com.quickshare.upload.client.exception.ChunkTransportException;
import com.quickshare.upload.client.exception.ConcurrentUploadException;
import com.quickshare.upload.client.exception.UploadCancelledException;
import com.quickshare.upload.client.exception.UploadException;
import com.quickshare.upload.client.exception.UploadServerException;
import com.quickshare.upload.client.exception.UploadStage;
import com.quickshare.upload.client.exception.UploadValidationException;
import com.quickshare.upload.client.port.ChunkTransport;
import com.quickshare.upload.client.port.CompletionFinalizer;
import com.quickshare.upload.client.port.SessionInitiator;
import com.quickshare.upload.client.source.UploadSource;
import com.quickshare.upload.model.Chunk;
import com.quickshare.upload.model.InitiateRequest;
import com.quickshare.upload.model.ProgressSnapshot;
import com.quickshare.upload.model.UploadOutcome;
import com.quickshare.upload.model.UploadSession;
import com.quickshare.upload.model.UploadState;
import com.quickshare.upload.model.util.ChunkSplitter;
import com.quickshare.upload.model.util.PayloadValidator;
import com.quickshare.upload.model.util.ProgressAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Drives a chunked upload through its lifecycle:
 * <pre>
 * IDLE -&gt; INITIATING -&gt; UPLOADING -&gt; FINALIZING -&gt; COMPLETED
 *              |              |             |
 *              +--------------+-------------+--&gt; FAILED | CANCELLED
 * </pre>
 *
 * <p>
 * At most one attempt is active per orchestrator. Chunks are sent strictly one at
 * a time in index order and the session is finalized only after every chunk was
 * acknowledged. State transitions and the decision to finalize are taken under a
 * single lock, so a cancellation either happens before finalize is invoked (and
 * finalize never is) or after it (and the finalize call is aborted through the
 * cancellation token). The first terminal transition wins; later results are
 * discarded.
 *
 * <p>
 * Listener events are recorded under the lock and delivered after it is released,
 * one at a time and in the order they happened.
 *
 * <p>
 * Instances are created through {@link Builder}; all methods are thread-safe.
 */
public class UploadOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(UploadOrchestrator.class);

    /** Default chunk size: 5 MiB. */
    public static final int DEFAULT_CHUNK_SIZE = 5 * 1024 * 1024;

    private final SessionInitiator sessionInitiator;
    private final ChunkTransport chunkTransport;
    private final CompletionFinalizer completionFinalizer;
    private final int chunkSize;
    private final Executor executor;
    private final UploadListener listener;
    private final PayloadValidator validator;

    private final Object lock = new Object();
    private UploadAttempt attempt;
    private ProgressSnapshot progress;
    private UploadException lastError;

    private UploadOrchestrator(Builder builder) {
        this.sessionInitiator = builder.sessionInitiator;
        this.chunkTransport = builder.chunkTransport;
        this.completionFinalizer = builder.completionFinalizer;
        this.chunkSize = builder.chunkSize;
        this.executor = builder.executor;
        this.listener = builder.listener;
        this.validator = builder.validator;
    }

    /**
     * Starts uploading {@code source} under its own name.
     *
     * @see #start(UploadSource, String, UploadListener)
     */
    public CompletableFuture<UploadOutcome> start(UploadSource source) {
        return start(source, null, UploadListener.NONE);
    }

    /**
     * Starts uploading {@code source} under {@code fileName}.
     *
     * @see #start(UploadSource, String, UploadListener)
     */
    public CompletableFuture<UploadOutcome> start(UploadSource source, String fileName) {
        return start(source, fileName, UploadListener.NONE);
    }

    /**
     * Starts a new upload attempt.
     *
     * <p>
     * The returned future completes with the session id and download locator, or
     * exceptionally with an {@link UploadException} describing the failed stage.
     * Completing or cancelling the returned future does not affect the upload; use
     * {@link #cancel()} to abort it.
     *
     * @param source    content to upload
     * @param fileName  name announced to the server; null to use the source's name
     * @param listener  receives the events of this attempt in addition to the
     *                  orchestrator-wide listener
     * @return future of the attempt's outcome
     * @throws ConcurrentUploadException if another attempt is still active
     * @throws UploadValidationException if the upload metadata is invalid; no state
     *                                   is changed and nothing is sent
     */
    public CompletableFuture<UploadOutcome> start(UploadSource source, String fileName, UploadListener listener) {
        Objects.requireNonNull(source, "source");
        String name = fileName != null ? fileName : source.getName();
        UploadAttempt next;
        synchronized (lock) {
            if (attempt != null && attempt.state().isActive()) {
                throw new ConcurrentUploadException(attempt.state());
            }
            next = prepare(source, name, listener != null ? listener : UploadListener.NONE);
            attempt = next;
            progress = null;
            lastError = null;
            transition(next, UploadState.INITIATING);
        }
        dispatch(next);
        log.info("Starting upload of {} ({} bytes in {} chunks of {} bytes)", name, next.session().getTotalSize(),
                next.session().getTotalChunks(), chunkSize);
        try {
            executor.execute(() -> initiate(next));
        } catch (RejectedExecutionException e) {
            settle(next, UploadState.FAILED, null,
                    new UploadException(UploadStage.INITIATE, "Failed to initiate upload: executor rejected the task", e));
        }
        return next.result().copy();
    }

    /**
     * Aborts the active attempt. The in-flight collaborator call is signalled
     * through the cancellation token, the attempt moves to
     * {@link UploadState#CANCELLED} and its future fails with
     * {@link UploadCancelledException}. Progress stops being reported.
     *
     * @return true if an active attempt was cancelled, false if none was active
     */
    public boolean cancel() {
        UploadAttempt current;
        UploadCancelledException error;
        synchronized (lock) {
            current = attempt;
            if (current == null || !current.state().isActive()) {
                return false;
            }
            Chunk inFlight = current.inFlightChunk();
            error = new UploadCancelledException(stageOf(current.state()), current.session().getId(),
                    inFlight != null ? inFlight.getIndex() : null, current.succeededChunkIndices());
        }
        log.info("Cancelling upload of {} (session {})", current.session().getFileName(), current.session().getId());
        return settle(current, UploadState.CANCELLED, null, error);
    }

    /**
     * Cancels the active attempt, if any, and forgets the last attempt, returning
     * the orchestrator to {@link UploadState#IDLE}.
     */
    public void reset() {
        cancel();
        synchronized (lock) {
            if (attempt != null && attempt.state().isActive()) {
                // a new attempt was started concurrently; leave it alone
                return;
            }
            attempt = null;
            progress = null;
            lastError = null;
        }
    }

    public UploadState state() {
        synchronized (lock) {
            return attempt == null ? UploadState.IDLE : attempt.state();
        }
    }

    public boolean isUploading() {
        return state().isActive();
    }

    /**
     * @return the last snapshot reported for the current or last attempt, or null
     *         if none was reported yet
     */
    public ProgressSnapshot currentProgress() {
        synchronized (lock) {
            return progress;
        }
    }

    /**
     * @return the error that ended the last attempt, or null
     */
    public UploadException lastError() {
        synchronized (lock) {
            return lastError;
        }
    }

    /**
     * @return the server session id of the current or last attempt, or null
     */
    public String sessionId() {
        synchronized (lock) {
            return attempt == null ? null : attempt.session().getId();
        }
    }

    private UploadAttempt prepare(UploadSource source, String name, UploadListener attemptListener) {
        long totalSize = source.getSize();
        int totalChunks;
        try {
            totalChunks = ChunkSplitter.totalChunks(totalSize, chunkSize);
        } catch (IllegalArgumentException e) {
            throw rejected(new UploadValidationException(e.getMessage()));
        }
        InitiateRequest request = new InitiateRequest(name, totalSize, totalChunks);
        List<String> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            throw rejected(new UploadValidationException(violations));
        }
        UploadSession session = new UploadSession(name, totalSize, totalChunks, chunkSize);
        return new UploadAttempt(session, ChunkSplitter.split(totalSize, chunkSize), request, source, attemptListener);
    }

    private UploadValidationException rejected(UploadValidationException e) {
        log.warn("Upload rejected: {}", e.getMessage());
        lastError = e;
        return e;
    }

    private void initiate(UploadAttempt a) {
        synchronized (lock) {
            if (a.state() != UploadState.INITIATING) {
                return;
            }
        }
        CompletableFuture<String> initiated = invoke(() -> sessionInitiator.initiate(a.request(), a.token()));
        initiated.whenCompleteAsync((sessionId, error) -> onInitiated(a, sessionId, error), executor);
    }

    private void onInitiated(UploadAttempt a, String sessionId, Throwable error) {
        UploadException failure = null;
        synchronized (lock) {
            if (a.state() != UploadState.INITIATING) {
                return;
            }
            if (error != null) {
                failure = toUploadException(UploadStage.INITIATE, null, List.of(), error);
            } else if (sessionId == null || sessionId.isBlank()) {
                failure = new UploadServerException(UploadStage.INITIATE, null, null, 200, "Missing upload id");
            } else {
                a.session().attachId(sessionId);
                try {
                    a.openReader();
                    transition(a, UploadState.UPLOADING);
                    publishProgress(a);
                } catch (IOException e) {
                    failure = new UploadException(UploadStage.CHUNK, sessionId, null, List.of(),
                            "Failed to read upload source: " + e.getMessage(), e);
                }
            }
        }
        if (failure != null) {
            settle(a, UploadState.FAILED, null, failure);
            return;
        }
        dispatch(a);
        log.info("Upload session {} opened for {}", sessionId, a.session().getFileName());
        sendChunks(a, 0);
    }

    /**
     * Sends the chunks from {@code position} on, then finalizes. Acknowledgements
     * that are already complete when the transport returns are handled in this
     * loop; only pending ones resume on the executor, so the stack does not grow
     * with the number of chunks.
     */
    private void sendChunks(UploadAttempt a, int position) {
        int next = position;
        while (next < a.chunks().size()) {
            CompletableFuture<Void> sent = sendChunk(a, next);
            if (sent == null) {
                return;
            }
            int current = next;
            if (!sent.isDone()) {
                sent.whenCompleteAsync((ignored, error) -> {
                    if (onChunkSent(a, current, error)) {
                        sendChunks(a, current + 1);
                    }
                }, executor);
                return;
            }
            Throwable error = sent.handle((ignored, e) -> e).join();
            if (!onChunkSent(a, current, error)) {
                return;
            }
            next++;
        }
        finalizeUpload(a);
    }

    /**
     * Reads the chunk at {@code position} and hands it to the transport.
     *
     * @return the transport's future, or null if the attempt ended meanwhile
     */
    private CompletableFuture<Void> sendChunk(UploadAttempt a, int position) {
        Chunk chunk = a.chunks().get(position);
        String sessionId = a.session().getId();
        byte[] bytes;
        synchronized (lock) {
            if (a.state() != UploadState.UPLOADING) {
                return null;
            }
        }
        try {
            bytes = a.reader().read(chunk.getStart(), (int) chunk.length());
        } catch (IOException e) {
            UploadException failure;
            synchronized (lock) {
                if (a.state() != UploadState.UPLOADING) {
                    return null;
                }
                failure = new ChunkTransportException(sessionId, chunk.getIndex(), a.succeededChunkIndices(), e);
            }
            settle(a, UploadState.FAILED, null, failure);
            return null;
        }
        synchronized (lock) {
            if (a.state() != UploadState.UPLOADING) {
                return null;
            }
            chunk.markInFlight();
            publishProgress(a);
        }
        dispatch(a);
        log.debug("Sending chunk {}/{} of session {} ({} bytes)", chunk.getIndex(), a.chunks().size(), sessionId,
                bytes.length);
        return invoke(() -> chunkTransport.send(sessionId, chunk.getIndex(), bytes, a.token(),
                transferred -> onChunkProgress(a, chunk, transferred)));
    }

    private void onChunkProgress(UploadAttempt a, Chunk chunk, long transferred) {
        synchronized (lock) {
            if (a.state() == UploadState.UPLOADING && chunk.reportTransferred(transferred)) {
                publishProgress(a);
            }
        }
        dispatch(a);
    }

    /**
     * @return true if the chunk was acknowledged and the attempt goes on
     */
    private boolean onChunkSent(UploadAttempt a, int position, Throwable error) {
        Chunk chunk = a.chunks().get(position);
        UploadException failure = null;
        synchronized (lock) {
            if (a.state() != UploadState.UPLOADING) {
                // cancelled meanwhile; a late acknowledgement is discarded
                return false;
            }
            if (error != null) {
                chunk.markFailed();
                failure = new ChunkTransportException(a.session().getId(), chunk.getIndex(), a.succeededChunkIndices(),
                        unwrap(error));
            } else {
                chunk.markSucceeded();
                publishProgress(a);
            }
        }
        if (failure != null) {
            settle(a, UploadState.FAILED, null, failure);
            return false;
        }
        dispatch(a);
        log.debug("Chunk {}/{} of session {} acknowledged", chunk.getIndex(), a.chunks().size(), a.session().getId());
        return true;
    }

    private void finalizeUpload(UploadAttempt a) {
        String sessionId = a.session().getId();
        CompletableFuture<String> completed;
        synchronized (lock) {
            if (a.state() != UploadState.UPLOADING || a.isCancellationRequested()) {
                return;
            }
            transition(a, UploadState.FINALIZING);
            a.closeReader();
            // invoked under the lock: a concurrent cancel sees FINALIZING and aborts the call via the token
            completed = invoke(() -> completionFinalizer.complete(sessionId, a.token()));
        }
        dispatch(a);
        log.debug("Finalizing session {}", sessionId);
        completed.whenCompleteAsync((locator, error) -> onFinalized(a, locator, error), executor);
    }

    private void onFinalized(UploadAttempt a, String locator, Throwable error) {
        String sessionId = a.session().getId();
        if (error == null && locator != null && !locator.isBlank()) {
            settle(a, UploadState.COMPLETED, new UploadOutcome(sessionId, locator), null);
            return;
        }
        List<Integer> succeeded;
        synchronized (lock) {
            succeeded = a.succeededChunkIndices();
        }
        if (error != null) {
            settle(a, UploadState.FAILED, null, toUploadException(UploadStage.FINALIZE, sessionId, succeeded, error));
        } else {
            settle(a, UploadState.FAILED, null, new UploadServerException(UploadStage.FINALIZE, sessionId, null, 200,
                    "Missing download url").withContext(sessionId, succeeded));
        }
    }

    /**
     * Moves the attempt to a terminal state and fills its result slot. Only the
     * first call per attempt has an effect.
     *
     * @return true if this call ended the attempt
     */
    private boolean settle(UploadAttempt a, UploadState terminal, UploadOutcome outcome, UploadException error) {
        synchronized (lock) {
            if (a.state().isTerminal()) {
                return false;
            }
            transition(a, terminal);
            if (error != null && attempt == a) {
                lastError = error;
            }
        }
        dispatch(a);
        a.release();
        if (error == null) {
            log.info("Upload of {} completed: session {}, download url {}", a.session().getFileName(),
                    outcome.getSessionId(), outcome.getDownloadLocator());
            a.result().complete(outcome);
        } else {
            if (terminal == UploadState.CANCELLED) {
                log.info("Upload of {} cancelled during {}", a.session().getFileName(), error.getStage());
            } else {
                log.warn("Upload of {} failed: {}", a.session().getFileName(), error.getMessage());
                log.debug("Upload failure details", error);
            }
            a.result().completeExceptionally(error);
        }
        return true;
    }

    // caller holds the lock
    private void transition(UploadAttempt a, UploadState next) {
        UploadState previous = a.state();
        a.session().setState(next);
        log.debug("Upload of {}: {} -> {}", a.session().getFileName(), previous, next);
        notifyListeners(a, l -> l.onStateChanged(previous, next));
    }

    // caller holds the lock
    private void publishProgress(UploadAttempt a) {
        ProgressSnapshot snapshot = ProgressAggregator.aggregate(a.chunks());
        ProgressSnapshot last = a.lastSnapshot();
        if (last != null && (snapshot.equals(last) || snapshot.getUploadedBytes() < last.getUploadedBytes())) {
            return;
        }
        a.lastSnapshot(snapshot);
        if (attempt == a) {
            progress = snapshot;
        }
        notifyListeners(a, l -> l.onProgress(snapshot));
    }

    // caller holds the lock; delivered by dispatch once it is released
    private void notifyListeners(UploadAttempt a, Consumer<UploadListener> event) {
        a.enqueueEvent(event);
    }

    // caller must not hold the lock
    private void dispatch(UploadAttempt a) {
        a.drainEvents(event -> {
            for (UploadListener target : new UploadListener[]{listener, a.listener()}) {
                if (target == UploadListener.NONE) {
                    continue;
                }
                try {
                    event.accept(target);
                } catch (RuntimeException e) {
                    log.warn("Upload listener failed: {}", e.getMessage(), e);
                }
            }
        });
    }

    /**
     * Calls a collaborator, turning a synchronous throw or a null future into a
     * failed future.
     */
    private static <T> CompletableFuture<T> invoke(Supplier<CompletableFuture<T>> call) {
        try {
            CompletableFuture<T> future = call.get();
            return future != null ? future
                    : CompletableFuture.failedFuture(new IllegalStateException("Collaborator returned no future"));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Maps a collaborator failure to the attempt's error. Errors already of the
     * upload hierarchy keep their type but carry the attempt's session id and
     * acknowledged chunks.
     */
    private static UploadException toUploadException(UploadStage stage, String sessionId, List<Integer> succeeded,
                                                     Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof UploadException) {
            UploadException e = (UploadException) cause;
            String session = sessionId != null ? sessionId : e.getSessionId();
            if (Objects.equals(session, e.getSessionId()) && succeeded.equals(e.getSucceededChunks())) {
                return e;
            }
            return e.withContext(session, succeeded);
        }
        return new UploadException(stage, sessionId, null, succeeded,
                "Failed to " + stage.getAction() + ": " + cause.getMessage(), cause);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static UploadStage stageOf(UploadState state) {
        switch (state) {
            case INITIATING:
                return UploadStage.INITIATE;
            case FINALIZING:
                return UploadStage.FINALIZE;
            default:
                return UploadStage.CHUNK;
        }
    }

    /**
     * Builder for {@link UploadOrchestrator}.
     */
    public static class Builder {
        private SessionInitiator sessionInitiator;
        private ChunkTransport chunkTransport;
        private CompletionFinalizer completionFinalizer;
        private int chunkSize = DEFAULT_CHUNK_SIZE;
        private Executor executor = ForkJoinPool.commonPool();
        private UploadListener listener = UploadListener.NONE;
        private PayloadValidator validator = PayloadValidator.getDefault();

        public Builder sessionInitiator(SessionInitiator sessionInitiator) {
            this.sessionInitiator = sessionInitiator;
            return this;
        }

        public Builder chunkTransport(ChunkTransport chunkTransport) {
            this.chunkTransport = chunkTransport;
            return this;
        }

        public Builder completionFinalizer(CompletionFinalizer completionFinalizer) {
            this.completionFinalizer = completionFinalizer;
            return this;
        }

        /**
         * Wires all three collaborators from one adapter.
         */
        public <T extends SessionInitiator & ChunkTransport & CompletionFinalizer> Builder api(T api) {
            return sessionInitiator(api).chunkTransport(api).completionFinalizer(api);
        }

        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        /**
         * Executor running the attempt's continuations. Defaults to the common pool.
         * A direct executor ({@code Runnable::run}) runs every step on the thread
         * that completed the previous collaborator call.
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public Builder listener(UploadListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder validator(PayloadValidator validator) {
            this.validator = validator;
            return this;
        }

        public UploadOrchestrator build() {
            if (sessionInitiator == null || chunkTransport == null || completionFinalizer == null) {
                throw new IllegalStateException("sessionInitiator, chunkTransport and completionFinalizer are required");
            }
            if (chunkSize <= 0) {
                throw new IllegalStateException("chunkSize must be positive");
            }
            if (executor == null) {
                throw new IllegalStateException("executor is required");
            }
            if (listener == null) {
                listener = UploadListener.NONE;
            }
            if (validator == null) {
                validator = PayloadValidator.getDefault();
            }
            return new UploadOrchestrator(this);
        }
    }
}
