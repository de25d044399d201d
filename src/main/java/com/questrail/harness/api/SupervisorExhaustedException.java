package com.questrail.harness.api;

import java.util.Objects;

/**
 * Every permitted startup attempt failed. The message is the rendered
 * {@link FailureReport}.
 */
public class SupervisorExhaustedException extends HarnessException {

    private final transient FailureReport report;

    public SupervisorExhaustedException(FailureReport report) {
        super(Objects.requireNonNull(report, "report").render());
        this.report = report;
    }

    public FailureReport report() {
        return report;
    }
}
