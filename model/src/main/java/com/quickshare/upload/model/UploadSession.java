package com.quickshare.upload.model;

import lombok.Getter;
import lombok.ToString;

/**
 * Client-side view of one upload session.
 *
 * <p>
 * Created when an attempt starts; the server-assigned identifier is attached once
 * the session has been opened. The session is discarded when the attempt reaches
 * a terminal state.
 */
@Getter
@ToString
public class UploadSession {

    /** Session identifier assigned by the server, null until initiated. */
    private String id;

    private final String fileName;

    /** Total size of the file in bytes. */
    private final long totalSize;

    private final int totalChunks;

    /** Size of every chunk except possibly the last one. */
    private final int chunkSize;

    private UploadState state = UploadState.IDLE;

    public UploadSession(String fileName, long totalSize, int totalChunks, int chunkSize) {
        this.fileName = fileName;
        this.totalSize = totalSize;
        this.totalChunks = totalChunks;
        this.chunkSize = chunkSize;
    }

    /**
     * Attaches the identifier returned by the server.
     *
     * @param id non-blank session identifier
     * @throws IllegalArgumentException if the identifier is blank
     * @throws IllegalStateException    if an identifier was already attached
     */
    public void attachId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Session id must not be blank");
        }
        if (this.id != null) {
            throw new IllegalStateException("Session already has id " + this.id);
        }
        this.id = id;
    }

    public void setState(UploadState state) {
        this.state = state;
    }
}
