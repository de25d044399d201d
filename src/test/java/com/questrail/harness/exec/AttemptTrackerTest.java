package com.questrail.harness.exec;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AttemptTrackerTest {

    @Test
    void countsAttemptsAndRemembersPortsInOrder() {
        AttemptTracker tracker = new AttemptTracker();

        assertEquals(1, tracker.recordAttempt(50_010));
        assertEquals(2, tracker.recordAttempt(50_003));

        assertEquals(2, tracker.attempts());
        assertEquals(List.of(50_010, 50_003), tracker.ports());
        assertTrue(tracker.hasUsed(50_003));
        assertFalse(tracker.hasUsed(50_011));
    }

    @Test
    void reusingAPortIsRejected() {
        AttemptTracker tracker = new AttemptTracker();
        tracker.recordAttempt(50_010);

        assertThrows(IllegalStateException.class, () -> tracker.recordAttempt(50_010));
        assertEquals(1, tracker.attempts());
    }

    @Test
    void terminalAttemptCannotChangeStatus() {
        Attempt attempt = Attempt.pending(1, 50_010, 0L).withStatus(Attempt.Status.TIMED_OUT);

        assertThrows(IllegalStateException.class, () -> attempt.withStatus(Attempt.Status.READY));
    }
}
