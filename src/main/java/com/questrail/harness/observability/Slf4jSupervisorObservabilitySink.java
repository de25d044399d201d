package com.questrail.harness.observability;

import com.questrail.harness.probe.ProbeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of SupervisorObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jSupervisorObservabilitySink implements SupervisorObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSupervisorObservabilitySink.class);

    @Override
    public void onStateTransition(SupervisorStateTransitionEvent event) {
        log.info("Supervisor State: {} -> {} (attempt {})",
            event.oldState(),
            event.newState(),
            event.attempt());
    }

    @Override
    public void onAttemptEvent(AttemptObservabilityEvent event) {
        if (event instanceof AttemptObservabilityEvent.Launched launched) {
            log.info("Attempt {}: launched pid {} on port {}",
                launched.attempt(), launched.pid(), launched.port());
        } else if (event instanceof AttemptObservabilityEvent.ProbeCompleted probe) {
            if (probe.outcome() == ProbeResult.Outcome.READY) {
                log.info("Attempt {}: port {} ready after {} ms ({} polls)",
                    probe.attempt(), probe.port(), probe.elapsed().toMillis(), probe.polls());
            } else {
                log.warn("Attempt {}: port {} {} after {} ms ({} polls), last probe error: {}",
                    probe.attempt(), probe.port(), probe.outcome(), probe.elapsed().toMillis(),
                    probe.polls(), probe.lastProbeError().orElse("none"));
            }
        } else {
            log.debug("Attempt Event: {}", event);
        }
    }

    @Override
    public void onError(SupervisorErrorEvent event) {
        log.error("Supervisor Error: {}", event.message(), event.cause());
    }
}
