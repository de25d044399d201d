package com.questrail.harness.exec;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-run attempt and port ledger.
 *
 * - Counts attempts made by one supervisor run
 * - Remembers every port handed to an attempt, so none is reused
 * - Does not encode retry policy
 */
public final class AttemptTracker {

    private final Set<Integer> usedPorts = new LinkedHashSet<>();

    /**
     * Record that an attempt is about to use {@code port}.
     *
     * @return the 1-based index of the new attempt
     * @throws IllegalStateException if the port was already used in this run
     */
    public int recordAttempt(int port) {
        if (!usedPorts.add(port)) {
            throw new IllegalStateException("port " + port + " already used in this run");
        }
        return usedPorts.size();
    }

    public boolean hasUsed(int port) {
        return usedPorts.contains(port);
    }

    /**
     * Attempts recorded so far (0 if none).
     */
    public int attempts() {
        return usedPorts.size();
    }

    /**
     * Ports used, in attempt order.
     */
    public List<Integer> ports() {
        return new ArrayList<>(usedPorts);
    }
}
