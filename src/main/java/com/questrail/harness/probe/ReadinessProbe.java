package com.questrail.harness.probe;

import com.questrail.harness.api.ServiceEndpoint;
import com.questrail.harness.config.ReadinessTimingPolicy;
import com.questrail.harness.internal.time.MonotonicClock;
import com.questrail.harness.internal.time.Sleeper;
import com.questrail.harness.process.CapturedOutput;
import com.questrail.harness.process.LaunchedProcess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * ReadinessProbe
 * =============================================================================
 * Polls a candidate endpoint until the service reports {@link HealthStatus#SERVING},
 * its process exits, or the readiness deadline passes.
 *
 * <h2>Loop</h2>
 * <pre>
 *   process exited?        → CRASHED_BEFORE_READY (exit code + output)
 *   deadline passed?       → TIMED_OUT (last probe error)
 *   health check (bounded by min(callTimeout, time left))
 *       SERVING and alive  → READY
 *       anything else      → remember as last probe error
 *   pause min(pollInterval, time left)
 * </pre>
 *
 * <p>Liveness is checked before every call, so a crash is seen on the next
 * iteration rather than at the deadline. A {@code SERVING} answer from an
 * endpoint whose process has already exited is never reported as ready.</p>
 *
 * <p>All time comes from the injected {@link MonotonicClock} and every pause
 * goes through the injected {@link Sleeper}.</p>
 */
public final class ReadinessProbe {
    private static final Logger log = LoggerFactory.getLogger(ReadinessProbe.class);

    private final HealthCheck healthCheck;
    private final String serviceName;
    private final ReadinessTimingPolicy policy;
    private final MonotonicClock clock;
    private final Sleeper sleeper;

    public ReadinessProbe(HealthCheck healthCheck,
                          String serviceName,
                          ReadinessTimingPolicy policy,
                          MonotonicClock clock,
                          Sleeper sleeper) {
        this.healthCheck = Objects.requireNonNull(healthCheck, "healthCheck");
        this.serviceName = Objects.requireNonNull(serviceName, "serviceName");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Probe {@code endpoint}, served by {@code process}, for at most the
     * policy's readiness deadline.
     *
     * @throws InterruptedException if interrupted while pausing between polls
     */
    public ProbeResult await(ServiceEndpoint endpoint, LaunchedProcess process) throws InterruptedException {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(process, "process");

        final long start = clock.nowNanos();
        final long deadline = start + policy.readinessDeadline().toNanos();
        int polls = 0;
        Optional<String> lastError = Optional.empty();

        while (true) {
            if (!process.isAlive()) {
                CapturedOutput output = process.drainOutput(policy.outputDrainTimeout());
                int code = process.exitCode().orElse(-1);
                log.debug("{} exited with code {} before becoming ready", endpoint, code);
                return ProbeResult.crashed(elapsedSince(start), polls, code, output, lastError);
            }

            long remaining = deadline - clock.nowNanos();
            if (remaining <= 0) {
                log.debug("{} not ready after {} polls: {}", endpoint, polls, lastError.orElse("no response"));
                return ProbeResult.timedOut(elapsedSince(start), polls, lastError);
            }

            polls++;
            try {
                Duration callTimeout = min(policy.callTimeout(), remaining);
                HealthStatus status = healthCheck.check(endpoint, serviceName, callTimeout);
                if (status == HealthStatus.SERVING) {
                    if (process.isAlive()) {
                        return ProbeResult.ready(elapsedSince(start), polls);
                    }
                    // Answer came from something other than our process; the
                    // liveness check at the top reports the crash.
                    lastError = Optional.of("SERVING answered after process exit");
                    continue;
                }
                lastError = Optional.of("status " + status);
            } catch (HealthCheckException e) {
                lastError = Optional.of(e.getMessage());
            }

            remaining = deadline - clock.nowNanos();
            if (remaining > 0) {
                sleeper.sleep(min(policy.pollInterval(), remaining));
            }
        }
    }

    private Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(clock.nowNanos() - startNanos);
    }

    private static Duration min(Duration d, long nanos) {
        return d.toNanos() <= nanos ? d : Duration.ofNanos(nanos);
    }
}
