package com.questrail.harness.bindings;

import com.questrail.harness.api.HarnessConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClientBindingsTest {

    private static final List<String> REQUIRED = List.of("fluxgraph_pb2.py", "fluxgraph_pb2_grpc.py");

    @TempDir
    Path root;

    @Test
    void presentBindingsAreUsedAsIs() throws IOException {
        Path dir = Files.createDirectories(root.resolve("bindings"));
        for (String name : REQUIRED) {
            Files.writeString(dir.resolve(name), "");
        }

        ClientBindings bindings = ClientBindings.builder(dir).requireFiles(REQUIRED).build();

        assertEquals(dir, bindings.ensureAvailable());
    }

    @Test
    void missingBindingsWithoutGeneratorAreAConfigurationError() {
        Path dir = root.resolve("bindings");
        ClientBindings bindings = ClientBindings.builder(dir).requireFiles(REQUIRED).build();

        HarnessConfigurationException e = assertThrows(HarnessConfigurationException.class, bindings::ensureAvailable);

        assertTrue(e.getMessage().contains("Directory: " + dir));
        assertTrue(e.getMessage().contains("Missing files: fluxgraph_pb2.py, fluxgraph_pb2_grpc.py"));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void generatorFillsInMissingFiles() {
        Path dir = root.resolve("bindings");
        ClientBindings bindings = ClientBindings.builder(dir)
                .requireFiles(REQUIRED)
                .withGenerator(List.of("sh", "-c", "touch \"$0/fluxgraph_pb2.py\" \"$0/fluxgraph_pb2_grpc.py\""))
                .build();

        assertEquals(dir, bindings.ensureAvailable());
        assertTrue(Files.isRegularFile(dir.resolve("fluxgraph_pb2_grpc.py")));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void failingGeneratorReportsItsOutput() {
        ClientBindings bindings = ClientBindings.builder(root.resolve("bindings"))
                .requireFiles(REQUIRED)
                .withGenerator(List.of("sh", "-c", "echo 'protoc: not found' >&2; exit 3"))
                .build();

        HarnessConfigurationException e = assertThrows(HarnessConfigurationException.class, bindings::ensureAvailable);

        assertTrue(e.getMessage().startsWith("Failed to generate client bindings (exit code 3)."));
        assertTrue(e.getMessage().contains("protoc: not found"));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void generatorRunsOnlyOnce() throws IOException {
        Path counter = root.resolve("runs");
        ClientBindings bindings = ClientBindings.builder(root.resolve("bindings"))
                .requireFiles(REQUIRED)
                .withGenerator(List.of("sh", "-c", "echo run >> \"$0/../runs\"; touch \"$0/fluxgraph_pb2.py\""))
                .build();

        HarnessConfigurationException first = assertThrows(HarnessConfigurationException.class, bindings::ensureAvailable);
        HarnessConfigurationException second = assertThrows(HarnessConfigurationException.class, bindings::ensureAvailable);

        assertSame(first, second);
        assertTrue(first.getMessage().contains("Missing files: fluxgraph_pb2_grpc.py"));
        assertEquals(1, Files.readAllLines(counter).size());
    }

    @Test
    void environmentSelectsTheDirectory() {
        Path custom = root.resolve("custom");

        ClientBindings fromEnv = ClientBindings.fromEnvironment(root,
                Map.of(ClientBindings.BINDINGS_DIR_ENV, custom.toString()), REQUIRED);
        ClientBindings byDefault = ClientBindings.fromEnvironment(root, Map.of(), REQUIRED);

        assertEquals(custom, fromEnv.directory());
        assertEquals(root.resolve("build-server").resolve("bindings"), byDefault.directory());
        assertEquals(REQUIRED, byDefault.requiredFiles());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void repositoryGeneratorScriptIsFound() throws IOException {
        Path scripts = Files.createDirectories(root.resolve("scripts"));
        Files.writeString(scripts.resolve("generate-proto-python.sh"),
                "touch \"$1/fluxgraph_pb2.py\" \"$1/fluxgraph_pb2_grpc.py\"\n");

        ClientBindings bindings = ClientBindings.fromEnvironment(root, Map.of(), REQUIRED);

        Path dir = root.resolve("build-server").resolve("bindings");
        assertEquals(dir, bindings.ensureAvailable());
        assertTrue(Files.isRegularFile(dir.resolve("fluxgraph_pb2.py")));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void underscoreSpellingOfTheGeneratorIsAccepted() throws IOException {
        Path scripts = Files.createDirectories(root.resolve("scripts"));
        Files.writeString(scripts.resolve("generate_proto_python.sh"),
                "touch \"$1/fluxgraph_pb2.py\" \"$1/fluxgraph_pb2_grpc.py\"\n");

        ClientBindings bindings = ClientBindings.fromEnvironment(root, Map.of(), REQUIRED);

        assertEquals(root.resolve("build-server").resolve("bindings"), bindings.ensureAvailable());
    }
}
