package com.questrail.harness.api;

/**
 * The harness cannot run at all: the server binary is missing or cannot be
 * spawned, client bindings are absent, or no local port can be probed.
 *
 * <p>Never retried. Distinct from a readiness failure, which consumes an
 * attempt.</p>
 */
public class HarnessConfigurationException extends HarnessException {

    public HarnessConfigurationException(String message) {
        super(message);
    }

    public HarnessConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
