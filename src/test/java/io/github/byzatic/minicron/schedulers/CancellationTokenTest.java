package io.github.byzatic.minicron.schedulers;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    void firstReasonWins() {
        CancellationToken t = new CancellationToken();
        assertFalse(t.isStopRequested());
        assertTrue(t.requestStop("first"));
        assertFalse(t.requestStop("second"));
        assertTrue(t.isStopRequested());
        assertEquals("first", t.reason());
    }

    @Test
    void throwIfStopRequestedThrows() throws Exception {
        CancellationToken t = new CancellationToken();
        t.throwIfStopRequested();
        t.requestStop("halt");
        InterruptedException ex = assertThrows(InterruptedException.class, t::throwIfStopRequested);
        assertTrue(ex.getMessage().contains("halt"));
    }
}
