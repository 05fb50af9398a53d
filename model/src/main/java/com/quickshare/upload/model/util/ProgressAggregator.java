package com.quickshare.upload.model.util;

import com.quickshare.upload.model.Chunk;
import com.quickshare.upload.model.ChunkStatus;
import com.quickshare.upload.model.ProgressSnapshot;

import java.util.List;

/**
 * Utility class deriving a {@link ProgressSnapshot} from chunk statuses.
 */
public class ProgressAggregator {

    /**
     * Aggregates the given chunks into a progress snapshot.
     *
     * <p>
     * Rules:
     * <ul>
     * <li>uploaded bytes = lengths of succeeded chunks + bytes reported by the in-flight chunk</li>
     * <li>total bytes = end of the last chunk (chunks partition the whole payload)</li>
     * <li>percentage = rounded ratio, clamped to [0, 100]; an empty payload is 100% once
     * its single chunk succeeded</li>
     * <li>current chunk = first chunk not yet succeeded, or the last one when all are</li>
     * </ul>
     *
     * @param chunks all chunks of one upload, in index order
     * @return the snapshot
     * @throws IllegalArgumentException if {@code chunks} is null or empty
     */
    public static ProgressSnapshot aggregate(List<Chunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            throw new IllegalArgumentException("At least one chunk is required");
        }
        int totalChunks = chunks.size();
        long totalBytes = chunks.get(totalChunks - 1).getEnd();
        long uploadedBytes = 0;
        int currentChunkIndex = 0;
        boolean allSucceeded = true;

        for (Chunk chunk : chunks) {
            if (chunk.getStatus() == ChunkStatus.SUCCEEDED) {
                uploadedBytes += chunk.length();
                continue;
            }
            allSucceeded = false;
            if (currentChunkIndex == 0) {
                currentChunkIndex = chunk.getIndex();
            }
            if (chunk.getStatus() == ChunkStatus.IN_FLIGHT) {
                uploadedBytes += chunk.getTransferredBytes();
            }
        }
        if (allSucceeded) {
            currentChunkIndex = totalChunks;
        }
        return new ProgressSnapshot(uploadedBytes, totalBytes, percentage(uploadedBytes, totalBytes, allSucceeded),
                currentChunkIndex, totalChunks);
    }

    private static int percentage(long uploadedBytes, long totalBytes, boolean allSucceeded) {
        if (totalBytes == 0) {
            return allSucceeded ? 100 : 0;
        }
        long rounded = Math.round(uploadedBytes * 100.0 / totalBytes);
        return (int) Math.min(100, Math.max(0, rounded));
    }
}
