package com.questrail.harness.observability;

import java.time.Instant;

/**
 * Record representing an error the supervisor handled without giving up its
 * primary outcome, such as a failed teardown of an abandoned attempt.
 */
public record SupervisorErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
