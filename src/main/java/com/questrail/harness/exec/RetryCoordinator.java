package com.questrail.harness.exec;

import com.questrail.harness.api.FailureReport;
import com.questrail.harness.api.HarnessConfigurationException;
import com.questrail.harness.api.ProcessTerminationException;
import com.questrail.harness.api.ServiceEndpoint;
import com.questrail.harness.api.SupervisorExhaustedException;
import com.questrail.harness.api.SupervisorInterruptedException;
import com.questrail.harness.config.SupervisorConfig;
import com.questrail.harness.internal.port.PortAllocator;
import com.questrail.harness.internal.time.MonotonicClock;
import com.questrail.harness.internal.time.WallClock;
import com.questrail.harness.observability.AttemptObservabilityEvent;
import com.questrail.harness.observability.NullObservabilitySink;
import com.questrail.harness.observability.SupervisorErrorEvent;
import com.questrail.harness.observability.SupervisorObservabilitySink;
import com.questrail.harness.observability.SupervisorStateTransitionEvent;
import com.questrail.harness.probe.ProbeResult;
import com.questrail.harness.probe.ReadinessProbe;
import com.questrail.harness.process.CapturedOutput;
import com.questrail.harness.process.LaunchSpec;
import com.questrail.harness.process.LaunchedProcess;
import com.questrail.harness.process.ManagedProcess;
import com.questrail.harness.process.ProcessLauncher;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * RetryCoordinator
 * =============================================================================
 * Drives one supervisor run: a bounded sequence of launch + readiness attempts.
 *
 * <h2>State machine</h2>
 * <pre>
 *   IDLE → ATTEMPTING → SUCCEEDED   (an attempt reported READY)
 *                     → EXHAUSTED   (maxAttempts failures, or a fatal error)
 * </pre>
 *
 * <h2>Per attempt</h2>
 * <ol>
 *   <li>allocate a port never used before in this run, launch on it</li>
 *   <li>probe readiness for the full per-attempt deadline</li>
 *   <li>dispatch on the {@link ProbeResult.Outcome}:
 *     <ul>
 *       <li>{@code READY}: hand the {@link ManagedProcess} to the caller</li>
 *       <li>{@code CRASHED_BEFORE_READY} / {@code TIMED_OUT}: dispose the
 *           process, record a {@link FailureReport} entry, try again</li>
 *     </ul>
 *   </li>
 * </ol>
 *
 * <h2>Ordering guarantees</h2>
 * <ul>
 *   <li>No endpoint leaves this class before READY was observed.</li>
 *   <li>A failed attempt is fully disposed before the next port is drawn, so at
 *       most one process of this run is alive at any time.</li>
 *   <li>Every exit path other than success disposes the active attempt.</li>
 * </ul>
 *
 * <h2>Errors</h2>
 * Crashes and readiness timeouts are handled here. Only configuration errors
 * (propagated as-is, no further attempts), interruption and exhaustion reach
 * the caller. A failed disposal is recorded in the report and attached as a
 * suppressed exception; it never replaces the run's outcome.
 *
 * <p>A coordinator serves exactly one run.</p>
 */
public final class RetryCoordinator {

    /** How many times an allocator may hand back a used port before we give up. */
    static final int MAX_PORT_REDRAWS = 16;

    private final SupervisorConfig config;
    private final PortAllocator portAllocator;
    private final ProcessLauncher launcher;
    private final ReadinessProbe probe;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final SupervisorObservabilitySink sink;

    private final AttemptTracker tracker = new AttemptTracker();
    private final List<Attempt> history = new CopyOnWriteArrayList<>();
    private volatile SupervisorState state = SupervisorState.IDLE;

    public RetryCoordinator(SupervisorConfig config,
                            PortAllocator portAllocator,
                            ProcessLauncher launcher,
                            ReadinessProbe probe,
                            MonotonicClock clock,
                            WallClock wallClock,
                            SupervisorObservabilitySink sink) {
        this.config = Objects.requireNonNull(config, "config");
        this.portAllocator = Objects.requireNonNull(portAllocator, "portAllocator");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.probe = Objects.requireNonNull(probe, "probe");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNullElse(sink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Current state; readable from any thread while a run is in progress.
     */
    public SupervisorState state() {
        return state;
    }

    /**
     * Attempts of this run so far, each in its latest status.
     */
    public List<Attempt> attempts() {
        return List.copyOf(history);
    }

    /**
     * Run the state machine until a process is ready or all attempts failed.
     *
     * @return a ready process; the caller owns it and must stop it
     * @throws SupervisorExhaustedException    after {@code maxAttempts} failed attempts
     * @throws HarnessConfigurationException   if the service cannot be launched at all
     * @throws SupervisorInterruptedException  if the calling thread was interrupted
     * @throws IllegalStateException           if this coordinator already ran
     */
    public synchronized ManagedProcess acquire() {
        if (state != SupervisorState.IDLE) {
            throw new IllegalStateException("RetryCoordinator serves a single run; state is " + state);
        }
        transition(SupervisorState.ATTEMPTING, 0);

        final int maxAttempts = config.maxAttempts();
        FailureReport.Builder report = FailureReport.builder(maxAttempts);
        List<ProcessTerminationException> teardownFailures = new ArrayList<>();

        for (int i = 1; i <= maxAttempts; i++) {
            ManagedProcess managed = null;
            try {
                int port = allocateFreshPort();
                tracker.recordAttempt(port);
                Attempt attempt = Attempt.pending(i, port, clock.nowNanos());
                history.add(attempt);

                LaunchSpec spec = new LaunchSpec(config.serverCommand(), config.portFlag(), port,
                        config.launchArguments(), config.workingDirectory());
                LaunchedProcess launched = launcher.launch(spec);
                ServiceEndpoint endpoint = new ServiceEndpoint(config.host(), port);
                managed = manage(launched, endpoint);
                sink.onAttemptEvent(new AttemptObservabilityEvent.Launched(wallClock.now(), i, port, launched.pid()));

                ProbeResult result = probe.await(endpoint, launched);
                sink.onAttemptEvent(new AttemptObservabilityEvent.ProbeCompleted(wallClock.now(), i, port,
                        result.outcome(), result.elapsed(), result.polls(), result.lastProbeError()));

                switch (result.outcome()) {
                    case READY -> {
                        updateLatest(attempt.withStatus(Attempt.Status.READY));
                        transition(SupervisorState.SUCCEEDED, i);
                        return managed;
                    }
                    case CRASHED_BEFORE_READY, TIMED_OUT -> {
                        Attempt.Status status = result.outcome() == ProbeResult.Outcome.TIMED_OUT
                                ? Attempt.Status.TIMED_OUT
                                : Attempt.Status.CRASHED_BEFORE_READY;
                        updateLatest(attempt.withStatus(status));

                        Optional<ProcessTerminationException> teardown = dispose(i, managed);
                        teardown.ifPresent(teardownFailures::add);
                        report.append(entryFor(attempt, result, managed, teardown));
                        managed = null;
                    }
                    default -> throw new IllegalStateException("Unhandled outcome " + result.outcome());
                }
            } catch (InterruptedException e) {
                disposeQuietly(i, managed);
                transition(SupervisorState.EXHAUSTED, i);
                Thread.currentThread().interrupt();
                throw new SupervisorInterruptedException("Interrupted during startup attempt " + i, e);
            } catch (RuntimeException e) {
                disposeQuietly(i, managed);
                transition(SupervisorState.EXHAUSTED, i);
                throw e;
            }
        }

        transition(SupervisorState.EXHAUSTED, maxAttempts);
        SupervisorExhaustedException exhausted = new SupervisorExhaustedException(report.build());
        teardownFailures.forEach(exhausted::addSuppressed);
        throw exhausted;
    }

    /**
     * Take ownership of a freshly launched process. If that fails the process
     * has no owner yet, so it is killed here.
     */
    private ManagedProcess manage(LaunchedProcess launched, ServiceEndpoint endpoint) {
        try {
            return new ManagedProcess(launched, endpoint, config.timingPolicy());
        } catch (RuntimeException e) {
            launched.forceTermination();
            throw e;
        }
    }

    private int allocateFreshPort() {
        for (int draw = 0; draw < MAX_PORT_REDRAWS; draw++) {
            int port = portAllocator.allocate();
            if (!tracker.hasUsed(port)) {
                return port;
            }
        }
        throw new HarnessConfigurationException("Port allocator kept returning ports already used in this run: "
                + tracker.ports());
    }

    /**
     * Stop an abandoned attempt's process. A process that refuses to die is
     * reported, not thrown, so the run can still report its own outcome.
     */
    private Optional<ProcessTerminationException> dispose(int attempt, ManagedProcess managed) {
        try {
            managed.stop();
            sink.onAttemptEvent(new AttemptObservabilityEvent.Disposed(wallClock.now(), attempt,
                    managed.endpoint().port(), managed.exitCode()));
            return Optional.empty();
        } catch (ProcessTerminationException e) {
            sink.onError(new SupervisorErrorEvent(wallClock.now(),
                    "Failed to dispose attempt " + attempt + " on " + managed.endpoint(), e));
            return Optional.of(e);
        }
    }

    private void disposeQuietly(int attempt, ManagedProcess managed) {
        if (managed != null) {
            dispose(attempt, managed);
        }
    }

    /**
     * Build the report entry once the attempt is disposed, so a timed-out
     * process contributes its final output and exit code too.
     */
    private FailureReport.Entry entryFor(Attempt attempt, ProbeResult result, ManagedProcess disposed,
                                         Optional<ProcessTerminationException> teardown) {
        CapturedOutput output = result.outcome() == ProbeResult.Outcome.CRASHED_BEFORE_READY
                ? result.output()
                : disposed.output();
        OptionalInt exitCode = result.exitCode().isPresent() ? result.exitCode() : disposed.exitCode();
        return new FailureReport.Entry(
                attempt.index(),
                attempt.port(),
                result.outcome() == ProbeResult.Outcome.TIMED_OUT
                        ? FailureReport.Reason.TIMED_OUT
                        : FailureReport.Reason.CRASHED_BEFORE_READY,
                exitCode,
                result.elapsed(),
                result.lastProbeError(),
                output.stdout(),
                output.stderr(),
                teardown.map(Throwable::getMessage)
        );
    }

    private void updateLatest(Attempt attempt) {
        history.set(history.size() - 1, attempt);
    }

    private void transition(SupervisorState next, int attempt) {
        SupervisorState previous = state;
        state = next;
        sink.onStateTransition(new SupervisorStateTransitionEvent(wallClock.now(), previous, next, attempt));
    }
}
