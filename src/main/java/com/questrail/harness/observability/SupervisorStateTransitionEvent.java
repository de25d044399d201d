package com.questrail.harness.observability;

import com.questrail.harness.exec.SupervisorState;

import java.time.Instant;

/**
 * Record representing a state transition of a supervisor run.
 *
 * @param attempt attempt index in effect when the transition happened, 0 before the first
 */
public record SupervisorStateTransitionEvent(
    Instant timestamp,
    SupervisorState oldState,
    SupervisorState newState,
    int attempt
) {
}
