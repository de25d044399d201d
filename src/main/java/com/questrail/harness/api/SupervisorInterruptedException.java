package com.questrail.harness.api;

/**
 * The thread driving the supervisor was interrupted. The active attempt has
 * been disposed and the interrupt flag restored.
 */
public class SupervisorInterruptedException extends HarnessException {

    public SupervisorInterruptedException(String message, InterruptedException cause) {
        super(message, cause);
    }
}
