package com.quickshare.upload.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Point-in-time summary of an upload's progress.
 *
 * <p>
 * Snapshots are immutable and recomputed from chunk statuses on every change;
 * they are never persisted.
 *
 * @see com.quickshare.upload.model.util.ProgressAggregator
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ProgressSnapshot {

    /** Bytes acknowledged by the server plus bytes of the chunk currently in flight. */
    private final long uploadedBytes;

    private final long totalBytes;

    /** Rounded share of {@link #uploadedBytes} in {@link #totalBytes}, between 0 and 100. */
    private final int percentage;

    /** One-based index of the first chunk not yet persisted, or the last index once all are. */
    private final int currentChunkIndex;

    private final int totalChunks;

    public ProgressSnapshot(long uploadedBytes, long totalBytes, int percentage, int currentChunkIndex, int totalChunks) {
        this.uploadedBytes = uploadedBytes;
        this.totalBytes = totalBytes;
        this.percentage = percentage;
        this.currentChunkIndex = currentChunkIndex;
        this.totalChunks = totalChunks;
    }
}
