package com.questrail.harness.observability;

import com.questrail.harness.probe.ProbeResult;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Events describing the progress of individual startup attempts.
 */
public sealed interface AttemptObservabilityEvent
        permits AttemptObservabilityEvent.Launched,
                AttemptObservabilityEvent.ProbeCompleted,
                AttemptObservabilityEvent.Disposed
{
    Instant timestamp();

    int attempt();

    int port();

    /** Process spawned for an attempt. */
    record Launched(Instant timestamp, int attempt, int port, long pid)
            implements AttemptObservabilityEvent {}

    /** Readiness probing of an attempt finished. */
    record ProbeCompleted(Instant timestamp, int attempt, int port,
                          ProbeResult.Outcome outcome, Duration elapsed, int polls,
                          Optional<String> lastProbeError)
            implements AttemptObservabilityEvent {}

    /** Process of an abandoned attempt terminated and its output drained. */
    record Disposed(Instant timestamp, int attempt, int port, OptionalInt exitCode)
            implements AttemptObservabilityEvent {}
}
