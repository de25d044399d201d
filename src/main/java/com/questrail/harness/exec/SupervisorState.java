package com.questrail.harness.exec;

/**
 * Lifecycle of one supervisor run.
 *
 * <pre>
 *   IDLE → ATTEMPTING → SUCCEEDED
 *                     → EXHAUSTED
 * </pre>
 *
 * {@code SUCCEEDED} and {@code EXHAUSTED} are terminal.
 */
public enum SupervisorState {
    IDLE,
    ATTEMPTING,
    SUCCEEDED,
    EXHAUSTED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == EXHAUSTED;
    }
}
