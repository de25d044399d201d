package com.questrail.harness.process;

import com.questrail.harness.api.HarnessConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * {@link ProcessLauncher} backed by {@link ProcessBuilder}.
 *
 * <p>Both output streams are piped to an {@link OutputCollector}; stdin is
 * closed for the child.</p>
 */
public final class LocalProcessLauncher implements ProcessLauncher {
    private static final Logger log = LoggerFactory.getLogger(LocalProcessLauncher.class);

    private final int outputCapacityChars;

    public LocalProcessLauncher() {
        this(OutputCollector.DEFAULT_CAPACITY_CHARS);
    }

    public LocalProcessLauncher(int outputCapacityChars) {
        if (outputCapacityChars <= 0) {
            throw new IllegalArgumentException("outputCapacityChars must be positive");
        }
        this.outputCapacityChars = outputCapacityChars;
    }

    @Override
    public LaunchedProcess launch(LaunchSpec spec) {
        Path exe = spec.executable();
        if (!Files.isRegularFile(exe)) {
            throw new HarnessConfigurationException("Server executable not found: " + exe);
        }
        if (!Files.isExecutable(exe)) {
            throw new HarnessConfigurationException("Server executable is not executable: " + exe);
        }

        List<String> argv = spec.commandLine();
        ProcessBuilder builder = new ProcessBuilder(argv)
                .redirectInput(ProcessBuilder.Redirect.from(nullDevice()));
        spec.workingDirectory().ifPresent(dir -> builder.directory(dir.toFile()));

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new HarnessConfigurationException("Failed to spawn " + argv, e);
        }
        log.debug("Spawned pid {}: {}", process.pid(), argv);

        OutputCollector collector = OutputCollector.attach(process, "port-" + spec.port(), outputCapacityChars);
        return new OsLaunchedProcess(process, collector);
    }

    private static File nullDevice() {
        return new File(System.getProperty("os.name").startsWith("Windows") ? "NUL" : "/dev/null");
    }
}
