package com.quickshare.upload.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UploadSessionTest {

    @Test
    void testAttachId_OnlyOnce() {
        UploadSession session = new UploadSession("report.pdf", 12, 3, 5);
        assertNull(session.getId());
        assertEquals(UploadState.IDLE, session.getState());

        session.attachId("abc");

        assertEquals("abc", session.getId());
        assertThrows(IllegalStateException.class, () -> session.attachId("def"));
    }

    @Test
    void testAttachId_RejectsBlank() {
        UploadSession session = new UploadSession("report.pdf", 12, 3, 5);

        assertThrows(IllegalArgumentException.class, () -> session.attachId(" "));
        assertThrows(IllegalArgumentException.class, () -> session.attachId(null));
    }

    @Test
    void testStateClassification() {
        for (UploadState state : UploadState.values()) {
            assertFalse(state.isActive() && state.isTerminal(), state + " cannot be both active and terminal");
        }
        assertFalse(UploadState.IDLE.isActive());
        assertFalse(UploadState.IDLE.isTerminal());
        assertTrue(UploadState.FINALIZING.isActive());
        assertTrue(UploadState.CANCELLED.isTerminal());
    }
}
