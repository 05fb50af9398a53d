package com.quickshare.upload.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChunkTest {

    @Test
    void testReportTransferred_OnlyWhileInFlight() {
        Chunk chunk = new Chunk(1, 0, 100);

        assertFalse(chunk.reportTransferred(50), "pending chunk should ignore progress");

        chunk.markInFlight();
        assertTrue(chunk.reportTransferred(50));
        assertEquals(50, chunk.getTransferredBytes());

        assertFalse(chunk.reportTransferred(40), "progress must not move backwards");
        assertFalse(chunk.reportTransferred(50), "repeated value is not a change");
        assertTrue(chunk.reportTransferred(500));
        assertEquals(100, chunk.getTransferredBytes(), "progress is clamped to the chunk length");
    }

    @Test
    void testStatusTransitions() {
        Chunk chunk = new Chunk(2, 100, 150);

        chunk.markInFlight();
        chunk.reportTransferred(20);
        chunk.markFailed();
        assertEquals(ChunkStatus.FAILED, chunk.getStatus());
        assertEquals(0, chunk.getTransferredBytes());

        chunk.markInFlight();
        assertEquals(2, chunk.getAttempts());
        chunk.markSucceeded();
        assertEquals(ChunkStatus.SUCCEEDED, chunk.getStatus());
        assertEquals(50, chunk.getTransferredBytes());
        assertFalse(chunk.reportTransferred(10));
    }

    @Test
    void testConstructor_RejectsInvalidRange() {
        assertThrows(IllegalArgumentException.class, () -> new Chunk(0, 0, 10));
        assertThrows(IllegalArgumentException.class, () -> new Chunk(1, -1, 10));
        assertThrows(IllegalArgumentException.class, () -> new Chunk(1, 10, 5));
    }
}
