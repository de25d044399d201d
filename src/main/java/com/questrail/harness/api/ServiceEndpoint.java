package com.questrail.harness.api;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Network address of a service under test, as handed to test code.
 *
 * <p>An endpoint is only ever exposed after the service has reported itself
 * serving on it.</p>
 */
public record ServiceEndpoint(String host, int port) {

    public ServiceEndpoint {
        Objects.requireNonNull(host, "host");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be 1-65535, was " + port);
        }
    }

    public static ServiceEndpoint loopback(int port) {
        return new ServiceEndpoint("127.0.0.1", port);
    }

    /**
     * {@code host:port}, the form accepted by gRPC channel builders.
     */
    public String target() {
        return host + ":" + port;
    }

    public InetSocketAddress toSocketAddress() {
        return new InetSocketAddress(host, port);
    }

    @Override
    public String toString() {
        return target();
    }
}
