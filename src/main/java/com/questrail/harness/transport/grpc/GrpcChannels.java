package com.questrail.harness.transport.grpc;

import com.questrail.harness.api.ServiceEndpoint;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Channels for test code talking to a ready service.
 */
public final class GrpcChannels {

    private GrpcChannels() {}

    /**
     * Plaintext channel to {@code endpoint}.
     */
    public static ManagedChannel open(ServiceEndpoint endpoint) {
        return ManagedChannelBuilder.forTarget(endpoint.target())
                .usePlaintext()
                .build();
    }

    /**
     * Shut {@code channel} down, waiting at most {@code timeout} before
     * cancelling in-flight calls.
     */
    public static void close(ManagedChannel channel, Duration timeout) {
        channel.shutdown();
        try {
            if (!channel.awaitTermination(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                channel.shutdownNow();
            }
        } catch (InterruptedException e) {
            channel.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
