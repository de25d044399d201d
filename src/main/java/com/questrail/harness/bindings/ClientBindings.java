package com.questrail.harness.bindings;

import com.questrail.harness.api.HarnessConfigurationException;
import com.questrail.harness.api.SupervisorInterruptedException;
import com.questrail.harness.process.CapturedOutput;
import com.questrail.harness.process.OutputCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * ClientBindings
 * =============================================================================
 * The directory of generated client bindings that tests talking to the service
 * need on their path.
 *
 * <h2>Resolution</h2>
 * <ol>
 *   <li>if every required file is present, the directory is used as-is</li>
 *   <li>otherwise the generator command, if any, is run once with the
 *       directory appended as its last argument, bounded by a timeout</li>
 *   <li>the directory is checked again; anything still missing is a
 *       {@link HarnessConfigurationException}</li>
 * </ol>
 *
 * <p>{@link #ensureAvailable()} is lazy and idempotent: the outcome of the
 * first call, success or failure, is returned by every later call.</p>
 */
public final class ClientBindings {
    private static final Logger log = LoggerFactory.getLogger(ClientBindings.class);

    public static final String BINDINGS_DIR_ENV = "FLUXGRAPH_BINDINGS_DIR";
    public static final Duration DEFAULT_GENERATOR_TIMEOUT = Duration.ofMinutes(2);

    static final String DEFAULT_DIR = "build-server/bindings";
    /** Checked in order; the first that exists is used. */
    static final List<String> DEFAULT_GENERATORS = List.of(
            "scripts/generate-proto-python.sh",
            "scripts/generate_proto_python.sh");

    private final Path directory;
    private final List<String> requiredFiles;
    private final List<String> generatorCommand;
    private final Duration generatorTimeout;

    private Path available;
    private HarnessConfigurationException failure;

    private ClientBindings(Builder b) {
        this.directory = Objects.requireNonNull(b.directory, "directory");
        this.requiredFiles = List.copyOf(b.requiredFiles);
        this.generatorCommand = List.copyOf(b.generatorCommand);
        this.generatorTimeout = Objects.requireNonNull(b.generatorTimeout, "generatorTimeout");
        if (generatorTimeout.isNegative() || generatorTimeout.isZero()) {
            throw new IllegalArgumentException("generatorTimeout must be positive");
        }
    }

    public static Builder builder(Path directory) {
        return new Builder(directory);
    }

    /**
     * Bindings directory from {@value #BINDINGS_DIR_ENV}, else
     * {@code <root>/build-server/bindings}. The repository's generator script,
     * {@code scripts/generate-proto-python.sh} or its underscore spelling, is
     * used when it exists.
     */
    public static ClientBindings fromEnvironment(Path repositoryRoot,
                                                 Map<String, String> environment,
                                                 List<String> requiredFiles) {
        String override = environment.get(BINDINGS_DIR_ENV);
        Path dir = override != null && !override.isBlank()
                ? Path.of(override.trim())
                : repositoryRoot.resolve(DEFAULT_DIR);

        Builder builder = builder(dir).requireFiles(requiredFiles);
        for (String candidate : DEFAULT_GENERATORS) {
            Path script = repositoryRoot.resolve(candidate);
            if (Files.isRegularFile(script)) {
                builder.withGenerator(List.of("bash", script.toString()));
                break;
            }
        }
        return builder.build();
    }

    public Path directory() {
        return directory;
    }

    public List<String> requiredFiles() {
        return requiredFiles;
    }

    /**
     * @return the bindings directory, every required file present
     * @throws HarnessConfigurationException if the bindings are missing and
     *         could not be generated
     */
    public synchronized Path ensureAvailable() {
        if (available != null) {
            return available;
        }
        if (failure != null) {
            throw failure;
        }
        try {
            available = resolve();
            return available;
        } catch (HarnessConfigurationException e) {
            failure = e;
            throw e;
        }
    }

    private Path resolve() {
        if (missingFiles().isEmpty()) {
            return directory;
        }
        if (!generatorCommand.isEmpty()) {
            generate();
        }
        List<String> missing = missingFiles();
        if (!missing.isEmpty()) {
            throw new HarnessConfigurationException("Client bindings missing"
                    + (generatorCommand.isEmpty() ? "" : " after generation") + ".\n"
                    + "Directory: " + directory + "\n"
                    + "Missing files: " + String.join(", ", missing));
        }
        return directory;
    }

    List<String> missingFiles() {
        List<String> missing = new ArrayList<>();
        for (String name : requiredFiles) {
            if (!Files.isRegularFile(directory.resolve(name))) {
                missing.add(name);
            }
        }
        return missing;
    }

    private void generate() {
        List<String> command = new ArrayList<>(generatorCommand);
        command.add(directory.toString());
        log.info("Generating client bindings: {}", String.join(" ", command));

        Process process;
        try {
            Files.createDirectories(directory);
            process = new ProcessBuilder(command)
                    .redirectInput(ProcessBuilder.Redirect.from(new File(nullDevice())))
                    .start();
        } catch (IOException e) {
            throw new HarnessConfigurationException("Failed to run binding generator: " + String.join(" ", command), e);
        }

        OutputCollector output = OutputCollector.attach(process, "bindings", OutputCollector.DEFAULT_CAPACITY_CHARS);
        try {
            if (!process.waitFor(generatorTimeout.toNanos(), TimeUnit.NANOSECONDS)) {
                process.destroyForcibly();
                throw new HarnessConfigurationException(failureMessage(
                        "Binding generator timed out after " + generatorTimeout.toSeconds() + " s.",
                        command, output.drain(Duration.ofSeconds(1))));
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new SupervisorInterruptedException("Interrupted while generating client bindings", e);
        }

        CapturedOutput captured = output.drain(Duration.ofSeconds(2));
        if (process.exitValue() != 0) {
            throw new HarnessConfigurationException(failureMessage(
                    "Failed to generate client bindings (exit code " + process.exitValue() + ").",
                    command, captured));
        }
    }

    private static String failureMessage(String headline, List<String> command, CapturedOutput output) {
        return headline + "\n"
                + "Command: " + String.join(" ", command) + "\n"
                + "stdout:\n" + output.stdout() + "\n"
                + "stderr:\n" + output.stderr();
    }

    private static String nullDevice() {
        return System.getProperty("os.name", "").startsWith("Windows") ? "NUL" : "/dev/null";
    }

    public static final class Builder {
        private final Path directory;
        private final List<String> requiredFiles = new ArrayList<>();
        private List<String> generatorCommand = List.of();
        private Duration generatorTimeout = DEFAULT_GENERATOR_TIMEOUT;

        private Builder(Path directory) {
            this.directory = Objects.requireNonNull(directory, "directory");
        }

        public Builder requireFiles(List<String> names) {
            requiredFiles.addAll(names);
            return this;
        }

        public Builder requireFiles(String... names) {
            return requireFiles(List.of(names));
        }

        /**
         * Command to run when files are missing; the bindings directory is
         * appended as its last argument.
         */
        public Builder withGenerator(List<String> command) {
            this.generatorCommand = List.copyOf(command);
            return this;
        }

        public Builder withGeneratorTimeout(Duration timeout) {
            this.generatorTimeout = timeout;
            return this;
        }

        public ClientBindings build() {
            return new ClientBindings(this);
        }
    }
}
