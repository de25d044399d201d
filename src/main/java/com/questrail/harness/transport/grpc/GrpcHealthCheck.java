package com.questrail.harness.transport.grpc;

import com.questrail.harness.api.ServiceEndpoint;
import com.questrail.harness.probe.HealthCheck;
import com.questrail.harness.probe.HealthCheckException;
import com.questrail.harness.probe.HealthStatus;
import com.questrail.harness.transport.grpc.netty.NettyHealthChannelFactory;
import io.grpc.ConnectivityState;
import io.grpc.ManagedChannel;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.health.v1.HealthCheckRequest;
import io.grpc.health.v1.HealthCheckResponse;
import io.grpc.health.v1.HealthGrpc;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link HealthCheck} over the standard {@code grpc.health.v1.Health/Check} RPC.
 *
 * <p>One channel is kept for the endpoint currently being probed and replaced
 * when a new endpoint is asked for, so each attempt talks to its own port.
 * Connection failures put a gRPC channel into reconnect backoff; the backoff
 * is reset before every call so a freshly bound server is seen on the next
 * poll rather than after the backoff delay.</p>
 *
 * <p>Not thread-safe; a supervisor probes one endpoint at a time.</p>
 */
public final class GrpcHealthCheck implements HealthCheck {

    private final NettyHealthChannelFactory channels;
    private final boolean ownsFactory;

    private ServiceEndpoint currentEndpoint;
    private ManagedChannel currentChannel;

    public GrpcHealthCheck() {
        this(new NettyHealthChannelFactory(), true);
    }

    public GrpcHealthCheck(NettyHealthChannelFactory channels) {
        this(channels, false);
    }

    private GrpcHealthCheck(NettyHealthChannelFactory channels, boolean ownsFactory) {
        this.channels = Objects.requireNonNull(channels, "channels");
        this.ownsFactory = ownsFactory;
    }

    @Override
    public HealthStatus check(ServiceEndpoint endpoint, String serviceName, Duration callTimeout) {
        ManagedChannel channel = channelFor(endpoint);
        if (channel.getState(false) == ConnectivityState.TRANSIENT_FAILURE) {
            channel.resetConnectBackoff();
        }

        HealthCheckRequest request = HealthCheckRequest.newBuilder().setService(serviceName).build();
        try {
            HealthCheckResponse response = HealthGrpc.newBlockingStub(channel)
                    .withDeadlineAfter(callTimeout.toNanos(), TimeUnit.NANOSECONDS)
                    .check(request);
            return map(response.getStatus());
        } catch (StatusRuntimeException e) {
            if (e.getStatus().getCode() == Status.Code.NOT_FOUND) {
                return HealthStatus.SERVICE_UNKNOWN;
            }
            throw new HealthCheckException(describe(e.getStatus()), e);
        }
    }

    @Override
    public void close() {
        closeCurrentChannel();
        if (ownsFactory) {
            channels.close();
        }
    }

    private ManagedChannel channelFor(ServiceEndpoint endpoint) {
        Objects.requireNonNull(endpoint, "endpoint");
        if (!endpoint.equals(currentEndpoint)) {
            closeCurrentChannel();
            currentChannel = channels.open(endpoint);
            currentEndpoint = endpoint;
        }
        return currentChannel;
    }

    private void closeCurrentChannel() {
        if (currentChannel != null) {
            currentChannel.shutdownNow();
            currentChannel = null;
            currentEndpoint = null;
        }
    }

    static HealthStatus map(HealthCheckResponse.ServingStatus status) {
        switch (status) {
            case SERVING:
                return HealthStatus.SERVING;
            case NOT_SERVING:
                return HealthStatus.NOT_SERVING;
            case SERVICE_UNKNOWN:
                return HealthStatus.SERVICE_UNKNOWN;
            default:
                return HealthStatus.UNKNOWN;
        }
    }

    private static String describe(Status status) {
        return status.getDescription() == null
                ? status.getCode().name()
                : status.getCode() + ": " + status.getDescription();
    }
}
