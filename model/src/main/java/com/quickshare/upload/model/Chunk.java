package com.quickshare.upload.model;

import lombok.Getter;

/**
 * Represents a single byte range of a file being uploaded.
 *
 * <p>
 * A chunk contains:
 * <ul>
 * <li>Its one-based index in the overall file</li>
 * <li>The half-open byte range {@code [start, end)} it covers</li>
 * <li>Its transfer status and the number of times it was sent</li>
 * <li>The bytes reported as transferred while it is in flight</li>
 * </ul>
 *
 * <p>
 * Chunks are mutable and not thread-safe. They belong to the upload attempt that
 * created them and are only mutated by it, under its lock.
 *
 * @see com.quickshare.upload.model.util.ChunkSplitter
 */
@Getter
public class Chunk {

    /** One-based position of this chunk in the file. */
    private final int index;

    /** First byte of the range, inclusive. */
    private final long start;

    /** Last byte of the range, exclusive. */
    private final long end;

    private ChunkStatus status = ChunkStatus.PENDING;

    /** How many times this chunk was handed to the transport. */
    private int attempts;

    /** Bytes reported as sent for the current attempt; only meaningful while in flight. */
    private long transferredBytes;

    /**
     * Creates a pending chunk covering {@code [start, end)}.
     *
     * @param index One-based chunk index
     * @param start First byte of the range, inclusive
     * @param end   Last byte of the range, exclusive
     */
    public Chunk(int index, long start, long end) {
        if (index < 1) {
            throw new IllegalArgumentException("Chunk index starts at 1, got " + index);
        }
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid byte range [" + start + ", " + end + ")");
        }
        this.index = index;
        this.start = start;
        this.end = end;
    }

    /**
     * @return number of bytes covered by this chunk
     */
    public long length() {
        return end - start;
    }

    /**
     * Marks the chunk as handed to the transport, starting a new attempt.
     */
    public void markInFlight() {
        status = ChunkStatus.IN_FLIGHT;
        attempts++;
        transferredBytes = 0;
    }

    /**
     * Records partial progress of the in-flight attempt.
     *
     * <p>
     * Reports are cumulative. Smaller values than the current one are ignored and
     * values above the chunk length are clamped, so progress never moves backwards.
     *
     * @param bytes cumulative bytes sent for this attempt
     * @return true if the recorded value changed
     */
    public boolean reportTransferred(long bytes) {
        if (status != ChunkStatus.IN_FLIGHT) {
            return false;
        }
        long clamped = Math.min(Math.max(bytes, 0), length());
        if (clamped <= transferredBytes) {
            return false;
        }
        transferredBytes = clamped;
        return true;
    }

    /**
     * Marks the chunk as persisted by the server.
     */
    public void markSucceeded() {
        status = ChunkStatus.SUCCEEDED;
        transferredBytes = length();
    }

    public void markFailed() {
        status = ChunkStatus.FAILED;
        transferredBytes = 0;
    }

    @Override
    public String toString() {
        return "Chunk{index=" + index + ", range=[" + start + ", " + end + "), status=" + status
                + ", attempts=" + attempts + "}";
    }
}
