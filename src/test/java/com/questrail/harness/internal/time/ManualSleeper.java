package com.questrail.harness.internal.time;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Sleeper that never blocks: each sleep advances a {@link ManualMonotonicClock}
 * by exactly the requested duration and is recorded.
 */
public final class ManualSleeper implements Sleeper {

    private final ManualMonotonicClock clock;
    private final List<Duration> sleeps = new ArrayList<>();

    public ManualSleeper(ManualMonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized void sleep(Duration duration) {
        sleeps.add(duration);
        clock.advanceNanos(duration.toNanos());
    }

    public synchronized List<Duration> sleeps() {
        return new ArrayList<>(sleeps);
    }
}
