package com.questrail.harness.api;

/**
 * A child process was still running after both graceful and forced
 * termination were requested and waited on.
 */
public class ProcessTerminationException extends HarnessException {

    private final long pid;

    public ProcessTerminationException(long pid, String message) {
        super(message);
        this.pid = pid;
    }

    public long pid() {
        return pid;
    }
}
