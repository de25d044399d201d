package com.questrail.harness.internal.port;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;

import static org.junit.jupiter.api.Assertions.*;

class LoopbackPortAllocatorTest {

    @Test
    void allocatedPortIsUnprivilegedAndBindable() throws IOException {
        int port = LoopbackPortAllocator.INSTANCE.allocate();

        assertTrue(port >= 1024 && port <= 65535, "port " + port);
        try (ServerSocket socket = new ServerSocket()) {
            socket.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), port));
            assertEquals(port, socket.getLocalPort());
        }
    }
}
