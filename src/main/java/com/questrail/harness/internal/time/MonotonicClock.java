package com.questrail.harness.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every supervisor deadline.
 *
 * <h2>Binding invariant</h2>
 * Readiness deadlines, poll pacing and teardown ceilings MUST use a monotonic
 * time source. Wall-clock time (e.g. {@code Instant.now()}) is permitted only
 * for observability.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>
     * Values are only meaningful for elapsed time computations.
     * </p>
     */
    long nowNanos();
}
