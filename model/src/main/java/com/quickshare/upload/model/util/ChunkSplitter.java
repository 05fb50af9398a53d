package com.quickshare.upload.model.util;

import com.quickshare.upload.model.Chunk;

import java.util.ArrayList;
import java.util.List;

/**
 * Utility class partitioning a byte length into ordered chunk descriptors.
 */
public class ChunkSplitter {

    /**
     * Number of chunks a payload of {@code length} bytes is split into.
     * Always at least one, even for an empty payload.
     */
    public static int totalChunks(long length, int chunkSize) {
        checkArguments(length, chunkSize);
        long effective = Math.max(length, 1);
        long count = (effective - 1) / chunkSize + 1;
        if (count > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Too many chunks for length " + length + " and chunk size " + chunkSize);
        }
        return (int) count;
    }

    /**
     * Splits {@code [0, length)} into contiguous, non-overlapping chunks of
     * {@code chunkSize} bytes; only the last chunk may be shorter. An empty payload
     * yields a single empty chunk {@code [0, 0)}.
     */
    public static List<Chunk> split(long length, int chunkSize) {
        int totalChunks = totalChunks(length, chunkSize);
        List<Chunk> chunks = new ArrayList<>(totalChunks);
        for (int i = 0; i < totalChunks; i++) {
            long start = (long) i * chunkSize;
            long end = Math.min(start + chunkSize, length);
            chunks.add(new Chunk(i + 1, start, end));
        }
        return chunks;
    }

    private static void checkArguments(long length, int chunkSize) {
        if (length < 0) {
            throw new IllegalArgumentException("length must not be negative: " + length);
        }
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
    }
}
