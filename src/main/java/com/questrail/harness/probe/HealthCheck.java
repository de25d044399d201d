package com.questrail.harness.probe;

import com.questrail.harness.api.ServiceEndpoint;

import java.time.Duration;

/**
 * One lightweight health-check call against a candidate endpoint.
 *
 * <p>Implementations must return or fail within {@code callTimeout}; a hung
 * call may not hold the readiness loop past its own deadline.</p>
 */
public interface HealthCheck extends AutoCloseable
{
    /**
     * @param endpoint    candidate address
     * @param serviceName service name sent in the request; empty means the
     *                    whole server
     * @param callTimeout deadline of this single call
     * @throws HealthCheckException on any transport-level failure
     */
    HealthStatus check(ServiceEndpoint endpoint, String serviceName, Duration callTimeout);

    /**
     * Release transport resources held for probing.
     */
    @Override
    default void close() {}
}
