package com.coedit.socket.session;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DocumentStateTest {

    @Test
    void testOlderTimestamp_IsRejected() {
        DocumentState state = new DocumentState("d1", "");

        assertTrue(state.apply("new", 2000, true));
        assertFalse(state.apply("old", 1000, true));

        assertEquals("new", state.getContent());
        assertEquals(2000, state.getLastAppliedTimestamp());
        assertEquals(1, state.getVersion());
    }

    @Test
    void testEqualTimestamp_LaterArrivalWins() {
        DocumentState state = new DocumentState("d1", "");

        state.apply("first", 1000, true);
        assertTrue(state.apply("second", 1000, true));

        assertEquals("second", state.getContent());
    }

    @Test
    void testRemoteApply_DoesNotMarkDirty() {
        DocumentState state = new DocumentState("d1", "stored");

        state.apply("remote edit", 1000, false);

        assertFalse(state.isDirty());
        assertNull(state.captureIfDirty());
        assertEquals(1, state.getVersion());
    }

    @Test
    void testFlush_ClearsDirtyOnlyWhenVersionUnchanged() {
        DocumentState state = new DocumentState("d1", "");
        state.apply("v1", 1000, true);

        DocumentState.Snapshot snapshot = state.captureIfDirty();
        assertNotNull(snapshot);
        assertEquals("v1", snapshot.getContent());

        state.apply("v2", 1001, true);
        assertFalse(state.markFlushed(snapshot.getVersion()));
        assertTrue(state.isDirty());

        DocumentState.Snapshot second = state.captureIfDirty();
        assertEquals("v2", second.getContent());
        assertTrue(state.markFlushed(second.getVersion()));
        assertFalse(state.isDirty());
    }
}
