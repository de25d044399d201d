package com.questrail.harness.transport.grpc.netty;

import com.questrail.harness.api.ServiceEndpoint;
import io.grpc.ManagedChannel;
import io.grpc.netty.NettyChannelBuilder;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NettyHealthChannelFactory
 * =============================================================================
 * Builds plaintext gRPC channels for readiness probing over one small, shared
 * Netty event loop.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code EventLoopGroup}, {@code Channel}) MUST NOT escape
 * this package; callers only ever see gRPC's {@link ManagedChannel}.
 *
 * <h2>Lifecycle</h2>
 * The factory owns its event loop group. {@link #close()} shuts it down;
 * channels opened from it must be shut down first by their owner.
 */
public final class NettyHealthChannelFactory implements AutoCloseable
{
    private final EventLoopGroup group;

    public NettyHealthChannelFactory()
    {
        // Daemon threads: a forgotten factory must not keep a test JVM alive.
        this.group = new NioEventLoopGroup(1, new DefaultThreadFactory("fluxgraph-probe", true));
    }

    /**
     * Open a channel to {@code endpoint}. The channel connects lazily on its
     * first call.
     */
    public ManagedChannel open(ServiceEndpoint endpoint)
    {
        Objects.requireNonNull(endpoint, "endpoint");
        if (group.isShuttingDown()) {
            throw new IllegalStateException("channel factory is closed");
        }
        return NettyChannelBuilder.forAddress(endpoint.toSocketAddress())
                .eventLoopGroup(group)
                .channelType(NioSocketChannel.class)
                .usePlaintext()
                .build();
    }

    @Override
    public void close()
    {
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }
}
