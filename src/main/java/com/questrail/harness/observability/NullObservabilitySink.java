package com.questrail.harness.observability;

/**
 * No-op implementation of SupervisorObservabilitySink.
 */
public final class NullObservabilitySink implements SupervisorObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(SupervisorStateTransitionEvent event) {}

    @Override
    public void onAttemptEvent(AttemptObservabilityEvent event) {}

    @Override
    public void onError(SupervisorErrorEvent event) {}
}
