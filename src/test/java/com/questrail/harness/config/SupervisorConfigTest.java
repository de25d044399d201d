package com.questrail.harness.config;

import com.questrail.harness.api.HarnessConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SupervisorConfigTest {

    private static final Path EXE = Path.of("/opt/fluxgraph/bin/fluxgraph-server");

    @Test
    void builderDefaults() {
        SupervisorConfig config = SupervisorConfig.builder().withExecutable(EXE).build();

        assertEquals(3, config.maxAttempts());
        assertEquals("127.0.0.1", config.host());
        assertEquals("--port", config.portFlag());
        assertEquals("", config.healthServiceName());
        assertEquals(ReadinessTimingPolicy.defaults(), config.timingPolicy());
        assertEquals(List.of(), config.launchArguments());
        assertEquals(List.of(), config.serverCommand().prefixArguments());
    }

    @Test
    void launchArgumentsRenderTimestepConfigThenExtras(@TempDir Path dir) throws IOException {
        Path graph = Files.writeString(dir.resolve("graph.yaml"), "models: []\n");

        SupervisorConfig config = SupervisorConfig.builder()
                .withExecutable(EXE)
                .withTimestep(Duration.ofMillis(100))
                .withPreloadConfig(graph)
                .addExtraArguments("--verbose")
                .build();

        assertEquals(List.of("--dt", "0.1", "--config", graph.toString(), "--verbose"), config.launchArguments());
    }

    @Test
    void timestepIsRenderedInPlainSeconds() {
        assertEquals("1", SupervisorConfig.seconds(Duration.ofSeconds(1)));
        assertEquals("0.001", SupervisorConfig.seconds(Duration.ofMillis(1)));
        assertEquals("2.5", SupervisorConfig.seconds(Duration.ofMillis(2500)));
    }

    @Test
    void missingPreloadConfigIsAConfigurationError(@TempDir Path dir) {
        Path missing = dir.resolve("missing.yaml");

        HarnessConfigurationException e = assertThrows(HarnessConfigurationException.class, () ->
                SupervisorConfig.builder().withExecutable(EXE).withPreloadConfig(missing).build());
        assertEquals("Config file not found: " + missing, e.getMessage());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(NullPointerException.class, () -> SupervisorConfig.builder().build());
        assertThrows(IllegalArgumentException.class, () ->
                SupervisorConfig.builder().withExecutable(EXE).withMaxAttempts(0).build());
        assertThrows(IllegalArgumentException.class, () ->
                SupervisorConfig.builder().withExecutable(EXE).withPortFlag(" ").build());
        assertThrows(IllegalArgumentException.class, () ->
                SupervisorConfig.builder().withExecutable(EXE).withTimestep(Duration.ZERO).build());
    }
}
