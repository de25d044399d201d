package com.questrail.harness.probe;

/**
 * Serving status reported by a health check. Mirrors the
 * {@code grpc.health.v1.HealthCheckResponse.ServingStatus} values.
 */
public enum HealthStatus {
    UNKNOWN,
    SERVING,
    NOT_SERVING,
    SERVICE_UNKNOWN
}
