/**
 * Health-check transport
 * =============================================================================
 *
 * <p>Everything that speaks the service's wire protocol lives below this
 * package. The supervisor core only sees {@link com.questrail.harness.probe.HealthCheck}
 * and {@link com.questrail.harness.api.ServiceEndpoint}.</p>
 *
 * <h2>Layers</h2>
 * <pre>
 *   ReadinessProbe
 *        → GrpcHealthCheck           (grpc.health.v1.Health/Check)
 *            → NettyHealthChannelFactory (Netty event loop, plaintext)
 * </pre>
 *
 * <h2>Architectural constraints (binding)</h2>
 * <ul>
 *   <li>Netty types stay inside {@code transport.grpc.netty}</li>
 *   <li>Transport failures surface as {@link com.questrail.harness.probe.HealthCheckException},
 *       which the probe reads as "not ready yet"</li>
 *   <li>No retries or pacing here; the probe owns timing</li>
 * </ul>
 */
package com.questrail.harness.transport;
