package com.questrail.harness.api;

/**
 * Base type for every failure the harness surfaces to test code.
 */
public class HarnessException extends RuntimeException {

    public HarnessException(String message) {
        super(message);
    }

    public HarnessException(String message, Throwable cause) {
        super(message, cause);
    }
}
