package com.quickshare.upload.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * Request payload for opening a new upload session.
 *
 * <p>
 * Carries the metadata the server needs to allocate a session:
 * <ul>
 * <li>The name the uploaded file will be stored under</li>
 * <li>The total size of the file in bytes</li>
 * <li>The number of chunks the client is going to send</li>
 * </ul>
 */
public class InitiateRequest {

    /** Maximum accepted length of {@link #fileName}. */
    public static final int MAX_FILE_NAME_LENGTH = 255;

    /**
     * Name of the file being uploaded.
     * Required, 1 to 255 characters.
     */
    @NotEmpty(message = "File name is required")
    @Size(max = MAX_FILE_NAME_LENGTH, message = "File name is too long")
    @JsonProperty("file_name")
    private String fileName;

    /**
     * Total size of the file in bytes.
     * Must be greater than 0.
     */
    @Positive(message = "Total size must be greater than zero")
    @JsonProperty("total_size")
    private long totalSize;

    /**
     * Number of chunks the file is split into.
     * Must be at least 1.
     */
    @Positive(message = "Total chunks must be at least 1")
    @JsonProperty("total_chunks")
    private int totalChunks;

    /**
     * Default constructor for JSON deserialization.
     */
    public InitiateRequest() {
    }

    /**
     * Creates a request for a new upload session.
     *
     * @param fileName    Name of the file being uploaded
     * @param totalSize   Total size of the file in bytes
     * @param totalChunks Number of chunks the file is split into
     */
    public InitiateRequest(String fileName, long totalSize, int totalChunks) {
        this.fileName = fileName;
        this.totalSize = totalSize;
        this.totalChunks = totalChunks;
    }

    /**
     * Gets the name of the file being uploaded.
     *
     * @return The file name.
     */
    public String getFileName() {
        return fileName;
    }

    /**
     * Sets the name of the file being uploaded.
     *
     * @param fileName The file name.
     */
    public void setFileName(String fileName) {
        this.fileName = fileName;
    }

    /**
     * Gets the total file size in bytes.
     *
     * @return The total file size in bytes.
     */
    public long getTotalSize() {
        return totalSize;
    }

    /**
     * Sets the total file size in bytes.
     *
     * @param totalSize The total file size in bytes.
     */
    public void setTotalSize(long totalSize) {
        this.totalSize = totalSize;
    }

    public int getTotalChunks() {
        return totalChunks;
    }

    public void setTotalChunks(int totalChunks) {
        this.totalChunks = totalChunks;
    }
}
