package com.questrail.harness.observability;

/**
 * Receives supervisor observability events.
 * Implementations can provide logging, metrics, or test recording.
 */
public interface SupervisorObservabilitySink {
    /**
     * Called when a supervisor run changes state.
     * @param event the transition event details
     */
    void onStateTransition(SupervisorStateTransitionEvent event);

    /**
     * Called as an attempt is launched, probed and disposed.
     * @param event the attempt event
     */
    void onAttemptEvent(AttemptObservabilityEvent event);

    /**
     * Called when an error is handled without changing the run's outcome.
     * @param event the error event
     */
    void onError(SupervisorErrorEvent event);
}
