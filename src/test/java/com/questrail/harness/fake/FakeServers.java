package com.questrail.harness.fake;

import com.questrail.harness.config.ReadinessTimingPolicy;
import com.questrail.harness.config.ServerCommand;
import com.questrail.harness.config.SupervisorConfig;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Configurations that run {@link FakeHealthServer} in a child JVM.
 */
public final class FakeServers {

    /** JVM startup dominates readiness time; allow for slow CI hosts. */
    public static final ReadinessTimingPolicy TIMING = new ReadinessTimingPolicy(
            Duration.ofMillis(100),
            Duration.ofMillis(500),
            Duration.ofSeconds(30),
            Duration.ofSeconds(5),
            Duration.ofSeconds(5),
            Duration.ofSeconds(2)
    );

    private FakeServers() {}

    public static ServerCommand command(String mode) {
        Path java = ProcessHandle.current().info().command()
                .map(Path::of)
                .orElse(Path.of(System.getProperty("java.home"), "bin", "java"));
        return new ServerCommand(java, List.of(
                "-cp", System.getProperty("java.class.path"),
                FakeHealthServer.class.getName(),
                mode));
    }

    public static SupervisorConfig.Builder config(String mode) {
        return SupervisorConfig.builder()
                .withServerCommand(command(mode))
                .withTimingPolicy(TIMING);
    }
}
