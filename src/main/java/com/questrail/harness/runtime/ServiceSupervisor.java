package com.questrail.harness.runtime;

import com.questrail.harness.api.HarnessConfigurationException;
import com.questrail.harness.api.SupervisorExhaustedException;
import com.questrail.harness.api.SupervisorInterruptedException;
import com.questrail.harness.bindings.ClientBindings;
import com.questrail.harness.config.SupervisorConfig;
import com.questrail.harness.exec.RetryCoordinator;
import com.questrail.harness.internal.port.LoopbackPortAllocator;
import com.questrail.harness.internal.port.PortAllocator;
import com.questrail.harness.internal.time.MonotonicClock;
import com.questrail.harness.internal.time.Sleeper;
import com.questrail.harness.internal.time.SystemMonotonicClock;
import com.questrail.harness.internal.time.SystemWallClock;
import com.questrail.harness.internal.time.ThreadSleeper;
import com.questrail.harness.internal.time.WallClock;
import com.questrail.harness.observability.SupervisorObservabilitySink;
import com.questrail.harness.observability.Slf4jSupervisorObservabilitySink;
import com.questrail.harness.probe.HealthCheck;
import com.questrail.harness.probe.ReadinessProbe;
import com.questrail.harness.process.LocalProcessLauncher;
import com.questrail.harness.process.ManagedProcess;
import com.questrail.harness.process.ProcessLauncher;
import com.questrail.harness.transport.grpc.GrpcHealthCheck;

import java.util.Objects;
import java.util.Optional;

/**
 * ServiceSupervisor
 * =============================================================================
 * Composition root of the harness.
 *
 * <p>Wires the port allocator, process launcher, readiness probe and retry
 * coordinator from one {@link SupervisorConfig}. Every collaborator has a
 * production default and can be replaced through the {@link Builder}, which is
 * how tests drive the supervisor on virtual time with fake processes.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * try (ServiceSupervisor supervisor = ServiceSupervisor.builder(config).build();
 *      ManagedProcess server = supervisor.start()) {
 *     ServiceEndpoint endpoint = server.endpoint();
 *     ...
 * }
 * }</pre>
 *
 * <p>Each {@link #start()} is an independent supervisor run with its own
 * ports. Closing the supervisor releases the probe transport; processes
 * already handed out stay with their owners.</p>
 */
public final class ServiceSupervisor implements AutoCloseable {

    private final SupervisorConfig config;
    private final PortAllocator portAllocator;
    private final ProcessLauncher launcher;
    private final HealthCheck healthCheck;
    private final MonotonicClock clock;
    private final Sleeper sleeper;
    private final WallClock wallClock;
    private final SupervisorObservabilitySink sink;
    private final Optional<ClientBindings> bindings;

    private RetryCoordinator lastRun;

    private ServiceSupervisor(Builder b) {
        this.config = b.config;
        this.portAllocator = b.portAllocator;
        this.launcher = b.launcher;
        this.healthCheck = b.healthCheck != null ? b.healthCheck : new GrpcHealthCheck();
        this.clock = b.clock;
        this.sleeper = b.sleeper;
        this.wallClock = b.wallClock;
        this.sink = b.sink;
        this.bindings = Optional.ofNullable(b.bindings);
    }

    public static Builder builder(SupervisorConfig config) {
        return new Builder(config);
    }

    public SupervisorConfig config() {
        return config;
    }

    /**
     * Launch the service and wait until it is ready.
     *
     * @return a ready process; the caller owns it and must close it
     * @throws HarnessConfigurationException  if bindings or the binary are unusable
     * @throws SupervisorExhaustedException   if every attempt failed
     * @throws SupervisorInterruptedException if interrupted while starting
     */
    public synchronized ManagedProcess start() {
        bindings.ifPresent(ClientBindings::ensureAvailable);

        ReadinessProbe probe = new ReadinessProbe(healthCheck, config.healthServiceName(),
                config.timingPolicy(), clock, sleeper);
        lastRun = new RetryCoordinator(config, portAllocator, launcher, probe, clock, wallClock, sink);
        return lastRun.acquire();
    }

    /**
     * The coordinator of the most recent {@link #start()}, for inspecting its
     * attempts.
     */
    public synchronized Optional<RetryCoordinator> lastRun() {
        return Optional.ofNullable(lastRun);
    }

    @Override
    public void close() {
        healthCheck.close();
    }

    public static final class Builder {
        private final SupervisorConfig config;
        private PortAllocator portAllocator = LoopbackPortAllocator.INSTANCE;
        private ProcessLauncher launcher = new LocalProcessLauncher();
        private HealthCheck healthCheck;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private Sleeper sleeper = ThreadSleeper.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private SupervisorObservabilitySink sink = new Slf4jSupervisorObservabilitySink();
        private ClientBindings bindings;

        private Builder(SupervisorConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        public Builder withPortAllocator(PortAllocator portAllocator) {
            this.portAllocator = Objects.requireNonNull(portAllocator);
            return this;
        }

        public Builder withLauncher(ProcessLauncher launcher) {
            this.launcher = Objects.requireNonNull(launcher);
            return this;
        }

        public Builder withHealthCheck(HealthCheck healthCheck) {
            this.healthCheck = Objects.requireNonNull(healthCheck);
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        public Builder withSleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper);
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = Objects.requireNonNull(wallClock);
            return this;
        }

        public Builder withObservabilitySink(SupervisorObservabilitySink sink) {
            this.sink = Objects.requireNonNull(sink);
            return this;
        }

        public Builder withClientBindings(ClientBindings bindings) {
            this.bindings = Objects.requireNonNull(bindings);
            return this;
        }

        public ServiceSupervisor build() {
            return new ServiceSupervisor(this);
        }
    }
}
