package com.quickshare.upload.model.util;

import com.quickshare.upload.model.Chunk;
import com.quickshare.upload.model.ProgressSnapshot;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProgressAggregatorTest {

    @Test
    void testAggregate_nothingSent() {
        List<Chunk> chunks = ChunkSplitter.split(12_000_000L, 5_000_000);
        ProgressSnapshot snapshot = ProgressAggregator.aggregate(chunks);

        assertEquals(new ProgressSnapshot(0, 12_000_000L, 0, 1, 3), snapshot);
    }

    /**
     * After the second of three chunks succeeded, 10,000,000 of 12,000,000 bytes
     * are uploaded: 83.33% rounds to 83 and the third chunk is current.
     */
    @Test
    void testAggregate_afterSecondChunkOfThree() {
        List<Chunk> chunks = ChunkSplitter.split(12_000_000L, 5_000_000);
        chunks.get(0).markInFlight();
        chunks.get(0).markSucceeded();
        chunks.get(1).markInFlight();
        chunks.get(1).markSucceeded();

        ProgressSnapshot snapshot = ProgressAggregator.aggregate(chunks);

        assertEquals(10_000_000L, snapshot.getUploadedBytes());
        assertEquals(12_000_000L, snapshot.getTotalBytes());
        assertEquals(83, snapshot.getPercentage());
        assertEquals(3, snapshot.getCurrentChunkIndex());
        assertEquals(3, snapshot.getTotalChunks());
    }

    @Test
    void testAggregate_includesPartialBytesOfInFlightChunk() {
        List<Chunk> chunks = ChunkSplitter.split(4000, 1000);
        chunks.get(0).markInFlight();
        chunks.get(0).markSucceeded();
        chunks.get(1).markInFlight();
        chunks.get(1).reportTransferred(500);

        ProgressSnapshot snapshot = ProgressAggregator.aggregate(chunks);

        assertEquals(1500, snapshot.getUploadedBytes());
        assertEquals(38, snapshot.getPercentage(), "37.5 rounds up");
        assertEquals(2, snapshot.getCurrentChunkIndex());
    }

    @Test
    void testAggregate_ignoresFailedChunkBytes() {
        List<Chunk> chunks = ChunkSplitter.split(2000, 1000);
        chunks.get(0).markInFlight();
        chunks.get(0).reportTransferred(900);
        chunks.get(0).markFailed();

        ProgressSnapshot snapshot = ProgressAggregator.aggregate(chunks);

        assertEquals(0, snapshot.getUploadedBytes());
        assertEquals(1, snapshot.getCurrentChunkIndex());
    }

    @Test
    void testAggregate_allSucceeded() {
        List<Chunk> chunks = ChunkSplitter.split(2500, 1000);
        chunks.forEach(c -> {
            c.markInFlight();
            c.markSucceeded();
        });

        ProgressSnapshot snapshot = ProgressAggregator.aggregate(chunks);

        assertEquals(new ProgressSnapshot(2500, 2500, 100, 3, 3), snapshot);
    }

    @Test
    void testAggregate_emptyPayload() {
        List<Chunk> chunks = ChunkSplitter.split(0, 1000);
        assertEquals(0, ProgressAggregator.aggregate(chunks).getPercentage());

        chunks.get(0).markInFlight();
        chunks.get(0).markSucceeded();
        assertEquals(new ProgressSnapshot(0, 0, 100, 1, 1), ProgressAggregator.aggregate(chunks));
    }

    /**
     * Partial reports that go backwards or beyond the chunk are clamped, so the
     * percentage never decreases while chunks advance.
     */
    @Test
    void testAggregate_monotonicAcrossUpdates() {
        List<Chunk> chunks = ChunkSplitter.split(3000, 1000);
        int last = ProgressAggregator.aggregate(chunks).getPercentage();
        long[] reports = {100, 50, 700, 2000};
        for (Chunk chunk : chunks) {
            chunk.markInFlight();
            for (long report : reports) {
                chunk.reportTransferred(report);
                int current = ProgressAggregator.aggregate(chunks).getPercentage();
                assertTrue(current >= last, "percentage went from " + last + " to " + current);
                last = current;
            }
            chunk.markSucceeded();
            int current = ProgressAggregator.aggregate(chunks).getPercentage();
            assertTrue(current >= last);
            last = current;
        }
        assertEquals(100, last);
    }

    @Test
    void testAggregate_rejectsEmptyList() {
        assertThrows(IllegalArgumentException.class, () -> ProgressAggregator.aggregate(List.of()));
        assertThrows(IllegalArgumentException.class, () -> ProgressAggregator.aggregate(null));
    }
}
