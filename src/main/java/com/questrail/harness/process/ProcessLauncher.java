package com.questrail.harness.process;

/**
 * Starts the service under test as a child process.
 */
@FunctionalInterface
public interface ProcessLauncher
{
    /**
     * Start a process as described by {@code spec} and return immediately.
     *
     * @throws com.questrail.harness.api.HarnessConfigurationException if the
     *         executable cannot be found or spawned; this is never retried
     */
    LaunchedProcess launch(LaunchSpec spec);
}
