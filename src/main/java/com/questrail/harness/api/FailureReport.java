package com.questrail.harness.api;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Diagnostics accumulated across every failed startup attempt of one
 * supervisor run.
 *
 * <p>Entries are appended as attempts fail; the report only reaches the
 * caller when the last permitted attempt has failed as well.</p>
 */
public final class FailureReport {

    /** Why an attempt was abandoned. */
    public enum Reason {
        CRASHED_BEFORE_READY,
        TIMED_OUT
    }

    /**
     * One failed attempt.
     *
     * @param attempt         1-based attempt index
     * @param port            port the attempt was launched on
     * @param reason          why the attempt was abandoned
     * @param exitCode        exit code, if the process had exited when disposed
     * @param elapsed         time spent waiting for readiness
     * @param lastProbeError  last health-check error or non-serving status seen
     * @param stdout          captured standard output (possibly truncated)
     * @param stderr          captured standard error (possibly truncated)
     * @param teardownFailure description of a failed disposal, if any
     */
    public record Entry(
            int attempt,
            int port,
            Reason reason,
            OptionalInt exitCode,
            Duration elapsed,
            Optional<String> lastProbeError,
            String stdout,
            String stderr,
            Optional<String> teardownFailure
    ) {
        public Entry {
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(exitCode, "exitCode");
            Objects.requireNonNull(elapsed, "elapsed");
            Objects.requireNonNull(lastProbeError, "lastProbeError");
            Objects.requireNonNull(stdout, "stdout");
            Objects.requireNonNull(stderr, "stderr");
            Objects.requireNonNull(teardownFailure, "teardownFailure");
        }
    }

    private final int maxAttempts;
    private final List<Entry> entries;

    private FailureReport(int maxAttempts, List<Entry> entries) {
        this.maxAttempts = maxAttempts;
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public List<Entry> entries() {
        return entries;
    }

    /**
     * Ports tried, in attempt order.
     */
    public List<Integer> ports() {
        List<Integer> ports = new ArrayList<>(entries.size());
        for (Entry e : entries) {
            ports.add(e.port());
        }
        return ports;
    }

    /**
     * Human-readable rendering, one block per attempt.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("Service failed to become ready after ")
                .append(entries.size()).append(" of ").append(maxAttempts).append(" attempt(s)");
        for (Entry e : entries) {
            sb.append("\n\n--- attempt ").append(e.attempt()).append('/').append(maxAttempts)
                    .append(" (port=").append(e.port());
            e.exitCode().ifPresent(code -> sb.append(", code=").append(code));
            sb.append(") ---\n");

            if (e.reason() == Reason.CRASHED_BEFORE_READY) {
                sb.append("Server exited during startup after ").append(e.elapsed().toMillis()).append(" ms.");
            } else {
                sb.append("Server failed readiness within ").append(e.elapsed().toMillis()).append(" ms.");
            }
            sb.append("\nLast probe error: ").append(e.lastProbeError().orElse("none"));
            e.teardownFailure().ifPresent(f -> sb.append("\nTeardown failure: ").append(f));
            sb.append("\nstdout:\n").append(e.stdout());
            sb.append("\nstderr:\n").append(e.stderr());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }

    public static Builder builder(int maxAttempts) {
        return new Builder(maxAttempts);
    }

    public static final class Builder {
        private final int maxAttempts;
        private final List<Entry> entries = new ArrayList<>();

        private Builder(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1");
            }
            this.maxAttempts = maxAttempts;
        }

        public Builder append(Entry entry) {
            entries.add(Objects.requireNonNull(entry, "entry"));
            return this;
        }

        public int size() {
            return entries.size();
        }

        public FailureReport build() {
            return new FailureReport(maxAttempts, entries);
        }
    }
}
