package com.questrail.harness.config;

import com.questrail.harness.api.HarnessConfigurationException;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated configuration for one supervised service.
 */
public record SupervisorConfig(
        ServerCommand serverCommand,
        int maxAttempts,
        ReadinessTimingPolicy timingPolicy,
        String host,
        String portFlag,
        List<String> extraArguments,
        Optional<Duration> timestep,
        Optional<Path> preloadConfig,
        Optional<Path> workingDirectory,
        String healthServiceName
) {
    public static final String TIMESTEP_FLAG = "--dt";
    public static final String CONFIG_FLAG = "--config";

    public SupervisorConfig {
        Objects.requireNonNull(serverCommand, "serverCommand");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(portFlag, "portFlag");
        extraArguments = List.copyOf(Objects.requireNonNull(extraArguments, "extraArguments"));
        Objects.requireNonNull(timestep, "timestep");
        Objects.requireNonNull(preloadConfig, "preloadConfig");
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        Objects.requireNonNull(healthServiceName, "healthServiceName");

        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (portFlag.isBlank()) {
            throw new IllegalArgumentException("portFlag must not be blank");
        }
        timestep.ifPresent(dt -> {
            if (dt.isNegative() || dt.isZero()) {
                throw new IllegalArgumentException("timestep must be positive");
            }
        });
    }

    /**
     * Arguments that follow the port on the command line: timestep override,
     * preloaded config file, then any free-form extras.
     */
    public List<String> launchArguments() {
        List<String> args = new ArrayList<>();
        timestep.ifPresent(dt -> {
            args.add(TIMESTEP_FLAG);
            args.add(seconds(dt));
        });
        preloadConfig.ifPresent(path -> {
            args.add(CONFIG_FLAG);
            args.add(path.toString());
        });
        args.addAll(extraArguments);
        return List.copyOf(args);
    }

    static String seconds(Duration d) {
        return BigDecimal.valueOf(d.toNanos(), 9).stripTrailingZeros().toPlainString();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ServerCommand serverCommand;
        private int maxAttempts = 3;
        private ReadinessTimingPolicy timingPolicy = ReadinessTimingPolicy.defaults();
        private String host = "127.0.0.1";
        private String portFlag = "--port";
        private final List<String> extraArguments = new ArrayList<>();
        private Duration timestep;
        private Path preloadConfig;
        private Path workingDirectory;
        private String healthServiceName = "";

        public Builder withServerCommand(ServerCommand command) {
            this.serverCommand = command;
            return this;
        }

        public Builder withExecutable(Path executable) {
            this.serverCommand = ServerCommand.of(executable);
            return this;
        }

        public Builder withMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder withTimingPolicy(ReadinessTimingPolicy policy) {
            this.timingPolicy = policy;
            return this;
        }

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPortFlag(String portFlag) {
            this.portFlag = portFlag;
            return this;
        }

        public Builder addExtraArguments(String... arguments) {
            extraArguments.addAll(List.of(arguments));
            return this;
        }

        public Builder withTimestep(Duration timestep) {
            this.timestep = timestep;
            return this;
        }

        public Builder withPreloadConfig(Path configFile) {
            this.preloadConfig = configFile;
            return this;
        }

        public Builder withWorkingDirectory(Path directory) {
            this.workingDirectory = directory;
            return this;
        }

        public Builder withHealthServiceName(String serviceName) {
            this.healthServiceName = serviceName;
            return this;
        }

        /**
         * @throws HarnessConfigurationException if a preload config file was
         *         given but does not exist
         */
        public SupervisorConfig build() {
            Objects.requireNonNull(serverCommand, "serverCommand");
            if (preloadConfig != null && !Files.isRegularFile(preloadConfig)) {
                throw new HarnessConfigurationException("Config file not found: " + preloadConfig);
            }
            return new SupervisorConfig(
                    serverCommand,
                    maxAttempts,
                    timingPolicy,
                    host,
                    portFlag,
                    extraArguments,
                    Optional.ofNullable(timestep),
                    Optional.ofNullable(preloadConfig),
                    Optional.ofNullable(workingDirectory),
                    healthServiceName
            );
        }
    }
}
