package com.questrail.harness.probe;

/**
 * A single health-check call failed at the transport level (connection
 * refused, call deadline exceeded, ...). While probing for readiness this
 * means "not ready yet", never a failure of the attempt.
 */
public final class HealthCheckException extends RuntimeException
{
    public HealthCheckException(String message) {
        super(message);
    }

    public HealthCheckException(String message, Throwable cause) {
        super(message, cause);
    }
}
