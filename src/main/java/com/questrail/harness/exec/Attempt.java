package com.questrail.harness.exec;

import java.util.Objects;

/**
 * One bounded try at launching the service and seeing it become ready.
 *
 * @param index      1-based attempt index
 * @param port       port allocated for this attempt only
 * @param startNanos monotonic launch time
 * @param status     where the attempt stands
 */
public record Attempt(int index, int port, long startNanos, Status status) {

    public enum Status {
        PENDING,
        READY,
        CRASHED_BEFORE_READY,
        TIMED_OUT;

        public boolean isTerminal() {
            return this != PENDING;
        }
    }

    public Attempt {
        Objects.requireNonNull(status, "status");
        if (index < 1) {
            throw new IllegalArgumentException("index must be >= 1");
        }
    }

    public static Attempt pending(int index, int port, long startNanos) {
        return new Attempt(index, port, startNanos, Status.PENDING);
    }

    public Attempt withStatus(Status newStatus) {
        if (status.isTerminal()) {
            throw new IllegalStateException("attempt " + index + " already " + status);
        }
        return new Attempt(index, port, startNanos, newStatus);
    }
}
