package com.questrail.harness.process;

import com.questrail.harness.api.ProcessTerminationException;
import com.questrail.harness.api.ServiceEndpoint;
import com.questrail.harness.config.ReadinessTimingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * ManagedProcess
 * =============================================================================
 * Exclusive owner of one running instance of the service under test.
 *
 * <h2>Scoped acquisition</h2>
 * Instances are {@link AutoCloseable}; {@link #close()} is {@link #stop()}.
 * Acquire in a try-with-resources block (or through the JUnit extension) and
 * teardown runs on every exit path, exceptions included. A JVM shutdown hook
 * covers the paths that never unwind.
 *
 * <h2>Teardown</h2>
 * <ol>
 *   <li>request graceful termination, wait up to {@code gracefulStopTimeout}</li>
 *   <li>if still alive, force termination, wait up to {@code forcedStopTimeout}</li>
 *   <li>drain remaining output, bounded by {@code outputDrainTimeout}</li>
 * </ol>
 * A process that already exited on its own is not an error. Once a stop has
 * succeeded every further call is a no-op. A process that survives the forced
 * kill is reported with {@link ProcessTerminationException}; a later call
 * tries again.
 */
public final class ManagedProcess implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ManagedProcess.class);

    private final LaunchedProcess process;
    private final ServiceEndpoint endpoint;
    private final Duration gracefulStopTimeout;
    private final Duration forcedStopTimeout;
    private final Duration outputDrainTimeout;
    private final Thread shutdownHook;

    private boolean stopped;
    private CapturedOutput finalOutput;

    public ManagedProcess(LaunchedProcess process, ServiceEndpoint endpoint, ReadinessTimingPolicy policy) {
        this.process = Objects.requireNonNull(process, "process");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(policy, "policy");
        this.gracefulStopTimeout = policy.gracefulStopTimeout();
        this.forcedStopTimeout = policy.forcedStopTimeout();
        this.outputDrainTimeout = policy.outputDrainTimeout();

        this.shutdownHook = new Thread(this::stopQuietlyOnShutdown, "fluxgraph-stop-" + process.pid());
        Runtime.getRuntime().addShutdownHook(shutdownHook);
    }

    public ServiceEndpoint endpoint() {
        return endpoint;
    }

    public long pid() {
        return process.pid();
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    public OptionalInt exitCode() {
        return process.exitCode();
    }

    /**
     * Captured stdout/stderr: live while running, final once stopped.
     */
    public synchronized CapturedOutput output() {
        return finalOutput != null ? finalOutput : process.output();
    }

    public synchronized boolean isStopped() {
        return stopped;
    }

    /**
     * Stop the process; see the class documentation for the escalation steps.
     *
     * @throws ProcessTerminationException if the process is still running
     *         after the forced kill
     */
    public synchronized void stop() {
        if (stopped) {
            return;
        }

        boolean interrupted = false;
        try {
            if (process.isAlive()) {
                log.debug("Stopping pid {} on {}", process.pid(), endpoint);
                process.requestTermination();
                WaitResult graceful = awaitExit(gracefulStopTimeout);
                interrupted = graceful.interrupted;

                if (!graceful.exited) {
                    log.warn("pid {} did not exit within {} ms of termination request, killing",
                            process.pid(), gracefulStopTimeout.toMillis());
                    process.forceTermination();
                    WaitResult forced = awaitExit(forcedStopTimeout);
                    interrupted |= forced.interrupted;

                    if (!forced.exited) {
                        throw new ProcessTerminationException(process.pid(),
                                "Process " + process.pid() + " on " + endpoint
                                        + " still running " + forcedStopTimeout.toMillis()
                                        + " ms after forced termination");
                    }
                }
            }

            finalOutput = process.drainOutput(outputDrainTimeout);
            stopped = true;
            removeShutdownHook();
            log.debug("pid {} stopped (exit code {})", process.pid(),
                    process.exitCode().isPresent() ? process.exitCode().getAsInt() : "unknown");
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public void close() {
        stop();
    }

    @Override
    public String toString() {
        return "ManagedProcess[pid=" + process.pid() + ", endpoint=" + endpoint + "]";
    }

    private record WaitResult(boolean exited, boolean interrupted) {}

    /**
     * Wait for exit without letting an interrupt cut teardown short; the
     * interrupt is reported back so the caller can restore it.
     */
    private WaitResult awaitExit(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        boolean interrupted = false;
        while (true) {
            long remaining = Math.max(0, deadline - System.nanoTime());
            try {
                return new WaitResult(process.awaitExit(Duration.ofNanos(remaining)), interrupted);
            } catch (InterruptedException e) {
                interrupted = true;
                if (remaining == 0) {
                    return new WaitResult(!process.isAlive(), true);
                }
            }
        }
    }

    private void removeShutdownHook() {
        if (Thread.currentThread() == shutdownHook) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            // JVM already shutting down; the hook will find us stopped.
            log.debug("Shutdown in progress, leaving hook for pid {}", process.pid());
        }
    }

    private void stopQuietlyOnShutdown() {
        try {
            stop();
        } catch (ProcessTerminationException e) {
            log.error("Could not stop pid {} during JVM shutdown", process.pid(), e);
        }
    }
}
