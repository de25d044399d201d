package com.questrail.harness.process;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Launcher that hands out {@link FakeLaunchedProcess}es and records every
 * launch.
 */
public final class FakeProcessLauncher implements ProcessLauncher {

    private final Function<LaunchSpec, FakeLaunchedProcess> factory;
    private final List<LaunchSpec> specs = new ArrayList<>();
    private final List<FakeLaunchedProcess> launched = new ArrayList<>();

    public FakeProcessLauncher(Function<LaunchSpec, FakeLaunchedProcess> factory) {
        this.factory = factory;
    }

    public static FakeProcessLauncher alwaysRunning() {
        return new FakeProcessLauncher(spec -> FakeLaunchedProcess.running());
    }

    public static FakeProcessLauncher alwaysCrashing(int code, String stderr) {
        return new FakeProcessLauncher(spec -> FakeLaunchedProcess.exited(code, stderr));
    }

    @Override
    public synchronized LaunchedProcess launch(LaunchSpec spec) {
        specs.add(spec);
        FakeLaunchedProcess process = factory.apply(spec);
        launched.add(process);
        return process;
    }

    public synchronized List<LaunchSpec> specs() {
        return new ArrayList<>(specs);
    }

    public synchronized List<FakeLaunchedProcess> launched() {
        return new ArrayList<>(launched);
    }

    public synchronized FakeLaunchedProcess last() {
        return launched.get(launched.size() - 1);
    }
}
