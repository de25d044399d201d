package com.questrail.harness.process;

import java.time.Duration;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;

/**
 * {@link LaunchedProcess} over a real {@link Process}.
 */
final class OsLaunchedProcess implements LaunchedProcess {

    private final Process process;
    private final OutputCollector output;

    OsLaunchedProcess(Process process, OutputCollector output) {
        this.process = Objects.requireNonNull(process, "process");
        this.output = Objects.requireNonNull(output, "output");
    }

    @Override
    public long pid() {
        return process.pid();
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    @Override
    public OptionalInt exitCode() {
        return process.isAlive() ? OptionalInt.empty() : OptionalInt.of(process.exitValue());
    }

    @Override
    public void requestTermination() {
        if (process.isAlive()) {
            process.destroy();
        }
    }

    @Override
    public void forceTermination() {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    @Override
    public boolean awaitExit(Duration timeout) throws InterruptedException {
        return process.waitFor(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    @Override
    public CapturedOutput output() {
        return output.snapshot();
    }

    @Override
    public CapturedOutput drainOutput(Duration timeout) {
        return output.drain(timeout);
    }
}
