package com.questrail.harness.process;

import java.time.Duration;
import java.util.OptionalInt;

/**
 * Handle to a child process started by a {@link ProcessLauncher}.
 *
 * <p>Only the {@link ManagedProcess} wrapping a handle may signal or wait on
 * it.</p>
 */
public interface LaunchedProcess
{
    long pid();

    boolean isAlive();

    /**
     * Exit code, present once the process has exited.
     */
    OptionalInt exitCode();

    /**
     * Ask the process to exit (SIGTERM on POSIX). Harmless if it already has.
     */
    void requestTermination();

    /**
     * Kill the process and its descendants (SIGKILL on POSIX).
     */
    void forceTermination();

    /**
     * Wait at most {@code timeout} for the process to exit.
     *
     * @return {@code true} if the process has exited
     */
    boolean awaitExit(Duration timeout) throws InterruptedException;

    /**
     * Output captured so far, without waiting.
     */
    CapturedOutput output();

    /**
     * Wait at most {@code timeout} for the output streams to close, then
     * return what was captured.
     */
    CapturedOutput drainOutput(Duration timeout);
}
