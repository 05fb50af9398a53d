package com.quickshare.upload.model;

/**
 * Transfer status of a single chunk.
 */
public enum ChunkStatus {
    /** Not sent yet. */
    PENDING,
    /** Currently being transferred. */
    IN_FLIGHT,
    /** Server acknowledged persistence. */
    SUCCEEDED,
    FAILED
}
