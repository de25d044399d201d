package com.questrail.harness.process;

import com.questrail.harness.config.ServerCommand;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable description of how to start one attempt.
 *
 * @param command          program and prefix arguments hosting the service
 * @param portFlag         flag that introduces the port, e.g. {@code --port}
 * @param port             port the service must listen on
 * @param extraArguments   arguments after the port (timestep, config, ...)
 * @param workingDirectory directory to start in; the harness's own if empty
 */
public record LaunchSpec(
        ServerCommand command,
        String portFlag,
        int port,
        List<String> extraArguments,
        Optional<Path> workingDirectory
) {
    public LaunchSpec {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(portFlag, "portFlag");
        extraArguments = List.copyOf(Objects.requireNonNull(extraArguments, "extraArguments"));
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be 1-65535, was " + port);
        }
    }

    public Path executable() {
        return command.executable();
    }

    /**
     * Full argv: {@code executable prefix... portFlag port extra...}.
     */
    public List<String> commandLine() {
        List<String> argv = new ArrayList<>();
        argv.add(command.executable().toString());
        argv.addAll(command.prefixArguments());
        argv.add(portFlag);
        argv.add(Integer.toString(port));
        argv.addAll(extraArguments);
        return List.copyOf(argv);
    }
}
