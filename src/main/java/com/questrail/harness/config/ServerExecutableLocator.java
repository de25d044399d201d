package com.questrail.harness.config;

import com.questrail.harness.api.HarnessConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves the server binary built outside this repository.
 *
 * <p>Lookup order: the {@value #SERVER_EXE_ENV} environment variable, then the
 * conventional build directories below a repository root. An environment value
 * that points nowhere is logged and ignored.</p>
 */
public final class ServerExecutableLocator {
    private static final Logger log = LoggerFactory.getLogger(ServerExecutableLocator.class);

    public static final String SERVER_EXE_ENV = "FLUXGRAPH_SERVER_EXE";

    static final List<String> BUILD_DIRS = List.of(
            "build/server",
            "build/server/Release",
            "build/server/Debug",
            "build-server",
            "build-server/Release",
            "build-server/Debug"
    );

    static final List<String> NAMES = List.of("fluxgraph-server.exe", "fluxgraph-server");

    private final Path repositoryRoot;
    private final Map<String, String> environment;

    public ServerExecutableLocator(Path repositoryRoot, Map<String, String> environment) {
        this.repositoryRoot = Objects.requireNonNull(repositoryRoot, "repositoryRoot");
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
    }

    public static ServerExecutableLocator fromSystem(Path repositoryRoot) {
        return new ServerExecutableLocator(repositoryRoot, System.getenv());
    }

    /**
     * @return absolute, normalized path of an existing regular file
     * @throws HarnessConfigurationException if no candidate exists
     */
    public Path locate() {
        String override = environment.get(SERVER_EXE_ENV);
        if (override != null && !override.isBlank()) {
            Path path = Path.of(override.trim());
            if (Files.isRegularFile(path)) {
                return path.toAbsolutePath().normalize();
            }
            log.warn("{}={} does not exist, falling back to search", SERVER_EXE_ENV, override);
        }

        List<Path> tried = new ArrayList<>();
        for (String dir : BUILD_DIRS) {
            for (String name : NAMES) {
                Path candidate = repositoryRoot.resolve(dir).resolve(name);
                if (Files.isRegularFile(candidate)) {
                    return candidate.toAbsolutePath().normalize();
                }
                tried.add(candidate);
            }
        }

        StringBuilder msg = new StringBuilder("Server executable not found. Tried:");
        for (Path p : tried) {
            msg.append("\n  - ").append(p);
        }
        msg.append("\nBuild the server first or set ").append(SERVER_EXE_ENV).append('.');
        throw new HarnessConfigurationException(msg.toString());
    }
}
