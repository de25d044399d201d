package com.questrail.harness.observability;

import com.questrail.harness.exec.SupervisorState;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements SupervisorObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onStateTransition(SupervisorStateTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onAttemptEvent(AttemptObservabilityEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(SupervisorErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<SupervisorState> getStates() {
        return events.stream()
            .filter(e -> e instanceof SupervisorStateTransitionEvent)
            .map(e -> ((SupervisorStateTransitionEvent) e).newState())
            .collect(Collectors.toList());
    }

    public synchronized <T> List<T> getEventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
