package com.questrail.harness.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * The program that hosts the service under test.
 *
 * <p>For the native server binary the prefix is empty. For a service that runs
 * inside an interpreter or VM the executable is that runtime and the prefix
 * carries whatever selects the service (classpath, main class, script).</p>
 *
 * @param executable     program to start
 * @param prefixArguments arguments placed before the port flag
 */
public record ServerCommand(Path executable, List<String> prefixArguments) {

    public ServerCommand {
        Objects.requireNonNull(executable, "executable");
        prefixArguments = List.copyOf(Objects.requireNonNull(prefixArguments, "prefixArguments"));
    }

    public static ServerCommand of(Path executable) {
        return new ServerCommand(executable, List.of());
    }
}
