package com.questrail.harness.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * OutputCollector
 * =============================================================================
 * Drains a child's stdout and stderr so the child can never block on a full
 * pipe, keeping a bounded tail of each stream for diagnostics.
 *
 * <h2>Threading</h2>
 * One daemon pump thread per stream. Pumps run until end of stream; a child
 * whose descendants keep the pipe open simply leaves its pump parked, which is
 * why {@link #drain(Duration)} never waits past its ceiling.
 *
 * <h2>Logging</h2>
 * Output is captured as it arrives, whether or not it ends in a newline.
 * Every complete line is also logged at DEBUG under
 * {@code fluxgraph.child.<name>}.
 */
public final class OutputCollector {

    public static final int DEFAULT_CAPACITY_CHARS = 64 * 1024;

    private static final int CHUNK_CHARS = 4096;

    private final Pump stdout;
    private final Pump stderr;

    private OutputCollector(Pump stdout, Pump stderr) {
        this.stdout = stdout;
        this.stderr = stderr;
    }

    /**
     * Start pumping both streams of {@code process}.
     *
     * @param name label for threads and log lines, e.g. {@code port-50123}
     */
    public static OutputCollector attach(Process process, String name, int capacityChars) {
        Objects.requireNonNull(process, "process");
        Objects.requireNonNull(name, "name");
        if (capacityChars <= 0) {
            throw new IllegalArgumentException("capacityChars must be positive");
        }
        Logger childLog = LoggerFactory.getLogger("fluxgraph.child." + name);
        Pump out = new Pump(process.getInputStream(), capacityChars, childLog, "stdout");
        Pump err = new Pump(process.getErrorStream(), capacityChars, childLog, "stderr");
        out.start("fluxgraph-" + name + "-stdout");
        err.start("fluxgraph-" + name + "-stderr");
        return new OutputCollector(out, err);
    }

    /**
     * Whatever has been captured so far, without waiting.
     */
    public CapturedOutput snapshot() {
        return stdout.merge(stderr);
    }

    /**
     * Wait at most {@code timeout} for both streams to reach end of stream,
     * then return what was captured, complete or not.
     *
     * <p>An interrupt ends the wait early; the interrupt flag is restored.</p>
     */
    public CapturedOutput drain(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            stdout.join(deadline);
            stderr.join(deadline);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return snapshot();
    }

    /**
     * Whether both pumps have seen end of stream.
     */
    public boolean isComplete() {
        return stdout.isDone() && stderr.isDone();
    }

    private static final class Pump implements Runnable {
        private final InputStream stream;
        private final int capacity;
        private final Logger childLog;
        private final String label;
        private final StringBuilder tail = new StringBuilder();
        private boolean truncated;
        private Thread thread;

        Pump(InputStream stream, int capacity, Logger childLog, String label) {
            this.stream = stream;
            this.capacity = capacity;
            this.childLog = childLog;
            this.label = label;
        }

        void start(String threadName) {
            thread = new Thread(this, threadName);
            thread.setDaemon(true);
            thread.start();
        }

        @Override
        public void run() {
            char[] chunk = new char[CHUNK_CHARS];
            StringBuilder line = new StringBuilder();
            try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
                int n;
                while ((n = reader.read(chunk)) != -1) {
                    append(chunk, n);
                    logLines(chunk, n, line);
                }
            } catch (IOException e) {
                // Stream closed underneath us when the process was reaped.
                childLog.debug("[{}] stream closed: {}", label, e.getMessage());
            }
            if (line.length() > 0) {
                childLog.debug("[{}] {}", label, line);
            }
        }

        /**
         * Log complete lines only; a partial line waits for its newline but
         * never grows past the tail capacity.
         */
        private void logLines(char[] chunk, int n, StringBuilder line) {
            for (int i = 0; i < n; i++) {
                char c = chunk[i];
                if (c == '\n') {
                    childLog.debug("[{}] {}", label, line);
                    line.setLength(0);
                } else if (c != '\r') {
                    line.append(c);
                    if (line.length() >= capacity) {
                        childLog.debug("[{}] {}", label, line);
                        line.setLength(0);
                    }
                }
            }
        }

        private synchronized void append(char[] chunk, int n) {
            tail.append(chunk, 0, n);
            int excess = tail.length() - capacity;
            if (excess > 0) {
                tail.delete(0, excess);
                truncated = true;
            }
        }

        void join(long deadlineNanos) throws InterruptedException {
            long remaining = deadlineNanos - System.nanoTime();
            if (remaining > 0) {
                TimeUnit.NANOSECONDS.timedJoin(thread, remaining);
            }
        }

        boolean isDone() {
            return !thread.isAlive();
        }

        synchronized String text() {
            return tail.toString();
        }

        synchronized boolean wasTruncated() {
            return truncated;
        }

        CapturedOutput merge(Pump err) {
            return new CapturedOutput(text(), err.text(), wasTruncated() || err.wasTruncated());
        }
    }
}
