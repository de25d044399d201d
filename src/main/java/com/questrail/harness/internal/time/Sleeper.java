package com.questrail.harness.internal.time;

import java.time.Duration;

/**
 * Sleeper
 * =============================================================================
 * Blocking pause used between readiness polls.
 *
 * <p>Kept separate from {@link MonotonicClock} so tests can substitute a
 * sleeper that advances a manual clock instead of blocking the thread.</p>
 */
public interface Sleeper
{
    /**
     * Pause the calling thread for {@code duration}.
     *
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    void sleep(Duration duration) throws InterruptedException;
}
