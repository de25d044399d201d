package com.questrail.harness.internal.port;

import com.questrail.harness.api.HarnessConfigurationException;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;

/**
 * Discovers a free port by binding a socket to port 0 on the loopback
 * interface and releasing it immediately.
 */
public final class LoopbackPortAllocator implements PortAllocator {

    public static final LoopbackPortAllocator INSTANCE = new LoopbackPortAllocator();

    private LoopbackPortAllocator() {}

    @Override
    public int allocate() {
        try (ServerSocket socket = new ServerSocket()) {
            // No reuse: a port still in TIME_WAIT is not a good candidate.
            socket.setReuseAddress(false);
            socket.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
            return socket.getLocalPort();
        } catch (IOException e) {
            throw new HarnessConfigurationException("Failed to find a free loopback TCP port", e);
        }
    }
}
