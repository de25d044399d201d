package com.questrail.harness.config;

import java.time.Duration;
import java.util.Objects;

/**
 * ReadinessTimingPolicy
 * -----------------------------------------------------------------------------
 * Every timing ceiling the supervisor honours.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>pollInterval</b>: Pause between two health-check calls of the same
 *       attempt.</li>
 *   <li><b>callTimeout</b>: Deadline of a single health-check call. Strictly
 *       smaller than {@code readinessDeadline}.</li>
 *   <li><b>readinessDeadline</b>: Overall budget of one attempt. Exceeding it
 *       is not an error in itself; it ends the attempt and triggers a retry.</li>
 *   <li><b>gracefulStopTimeout</b>: How long teardown waits after the
 *       termination request before escalating to a forced kill.</li>
 *   <li><b>forcedStopTimeout</b>: How long teardown waits after the forced
 *       kill before reporting the process as unkillable.</li>
 *   <li><b>outputDrainTimeout</b>: Ceiling for collecting a dead process's
 *       remaining output.</li>
 * </ul>
 */
public record ReadinessTimingPolicy(
        Duration pollInterval,
        Duration callTimeout,
        Duration readinessDeadline,
        Duration gracefulStopTimeout,
        Duration forcedStopTimeout,
        Duration outputDrainTimeout
) {
    public ReadinessTimingPolicy {
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(callTimeout, "callTimeout");
        Objects.requireNonNull(readinessDeadline, "readinessDeadline");
        Objects.requireNonNull(gracefulStopTimeout, "gracefulStopTimeout");
        Objects.requireNonNull(forcedStopTimeout, "forcedStopTimeout");
        Objects.requireNonNull(outputDrainTimeout, "outputDrainTimeout");

        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        if (callTimeout.isNegative() || callTimeout.isZero()) {
            throw new IllegalArgumentException("callTimeout must be positive");
        }
        if (readinessDeadline.isNegative() || readinessDeadline.isZero()) {
            throw new IllegalArgumentException("readinessDeadline must be positive");
        }
        if (callTimeout.compareTo(readinessDeadline) >= 0) {
            throw new IllegalArgumentException("callTimeout must be smaller than readinessDeadline");
        }
        if (gracefulStopTimeout.isNegative()) {
            throw new IllegalArgumentException("gracefulStopTimeout must be non-negative");
        }
        if (forcedStopTimeout.isNegative()) {
            throw new IllegalArgumentException("forcedStopTimeout must be non-negative");
        }
        if (outputDrainTimeout.isNegative()) {
            throw new IllegalArgumentException("outputDrainTimeout must be non-negative");
        }
    }

    /**
     * Policy with the customary harness values.
     *
     * <ul>
     *   <li>pollInterval: 100ms</li>
     *   <li>callTimeout: 500ms</li>
     *   <li>readinessDeadline: 10s</li>
     *   <li>gracefulStopTimeout: 2s</li>
     *   <li>forcedStopTimeout: 2s</li>
     *   <li>outputDrainTimeout: 2s</li>
     * </ul>
     */
    public static ReadinessTimingPolicy defaults() {
        return new ReadinessTimingPolicy(
                Duration.ofMillis(100),
                Duration.ofMillis(500),
                Duration.ofSeconds(10),
                Duration.ofSeconds(2),
                Duration.ofSeconds(2),
                Duration.ofSeconds(2)
        );
    }

    /**
     * Defaults with a different readiness deadline; handy for tests of slow or
     * never-ready services.
     */
    public ReadinessTimingPolicy withReadinessDeadline(Duration deadline) {
        return new ReadinessTimingPolicy(pollInterval, callTimeout, deadline,
                gracefulStopTimeout, forcedStopTimeout, outputDrainTimeout);
    }

    public ReadinessTimingPolicy withStopTimeouts(Duration graceful, Duration forced) {
        return new ReadinessTimingPolicy(pollInterval, callTimeout, readinessDeadline,
                graceful, forced, outputDrainTimeout);
    }
}
