package com.quickshare.upload.client.exception;

import java.util.List;

/**
 * Base class of every error reported by an upload attempt.
 *
 * <p>
 * Besides the message and cause, each error carries the context needed to decide
 * on a follow-up attempt:
 * <ul>
 * <li>the {@link UploadStage} that failed</li>
 * <li>the server session id, when one had been assigned</li>
 * <li>the one-based chunk index, when a chunk was involved</li>
 * <li>the indices of chunks the server had already acknowledged</li>
 * </ul>
 */
public class UploadException extends RuntimeException {

    private final UploadStage stage;
    private final String sessionId;
    private final Integer chunkIndex;
    private final List<Integer> succeededChunks;

    public UploadException(UploadStage stage, String message, Throwable cause) {
        this(stage, null, null, List.of(), message, cause);
    }

    public UploadException(UploadStage stage, String sessionId, Integer chunkIndex, List<Integer> succeededChunks,
                           String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.sessionId = sessionId;
        this.chunkIndex = chunkIndex;
        this.succeededChunks = succeededChunks == null ? List.of() : List.copyOf(succeededChunks);
    }

    /**
     * Returns this error with the session id and acknowledged chunks replaced, as
     * known to the caller that observed it. Subclasses return their own type; the
     * message, cause and stack trace are kept.
     */
    public UploadException withContext(String sessionId, List<Integer> succeededChunks) {
        return keepTrace(new UploadException(stage, sessionId, chunkIndex, succeededChunks, getMessage(), getCause()));
    }

    protected <E extends UploadException> E keepTrace(E copy) {
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    public UploadStage getStage() {
        return stage;
    }

    /**
     * @return the server session id, or null if the session was never opened
     */
    public String getSessionId() {
        return sessionId;
    }

    /**
     * @return the one-based index of the chunk involved, or null
     */
    public Integer getChunkIndex() {
        return chunkIndex;
    }

    /**
     * @return indices of chunks acknowledged before the attempt ended, in upload order
     */
    public List<Integer> getSucceededChunks() {
        return succeededChunks;
    }
}
