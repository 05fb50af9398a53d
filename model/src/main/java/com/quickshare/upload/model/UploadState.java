package com.quickshare.upload.model;

/**
 * Lifecycle of a single upload attempt.
 *
 * <pre>
 * IDLE -> INITIATING -> UPLOADING -> FINALIZING -> COMPLETED
 *              |            |            |
 *              +------------+------------+--> FAILED | CANCELLED
 * </pre>
 */
public enum UploadState {
    IDLE,
    INITIATING,
    UPLOADING,
    FINALIZING,
    COMPLETED,
    FAILED,
    CANCELLED;

    /**
     * @return true once the attempt can no longer change state
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * @return true while an attempt owns the orchestrator
     */
    public boolean isActive() {
        return this == INITIATING || this == UPLOADING || this == FINALIZING;
    }
}
