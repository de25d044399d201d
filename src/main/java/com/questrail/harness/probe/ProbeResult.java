package com.questrail.harness.probe;

import com.questrail.harness.process.CapturedOutput;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Terminal result of probing one attempt.
 *
 * @param outcome        which way the attempt ended
 * @param elapsed        time from probe start to this result
 * @param polls          number of health-check calls issued
 * @param exitCode       present for {@link Outcome#CRASHED_BEFORE_READY}
 * @param output         output collected from a crashed process, empty otherwise
 * @param lastProbeError last transport error or non-serving status observed
 */
public record ProbeResult(
        Outcome outcome,
        Duration elapsed,
        int polls,
        OptionalInt exitCode,
        CapturedOutput output,
        Optional<String> lastProbeError
) {
    public enum Outcome {
        READY,
        CRASHED_BEFORE_READY,
        TIMED_OUT
    }

    public ProbeResult {
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(elapsed, "elapsed");
        Objects.requireNonNull(exitCode, "exitCode");
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(lastProbeError, "lastProbeError");
    }

    public static ProbeResult ready(Duration elapsed, int polls) {
        return new ProbeResult(Outcome.READY, elapsed, polls, OptionalInt.empty(),
                CapturedOutput.empty(), Optional.empty());
    }

    public static ProbeResult crashed(Duration elapsed, int polls, int exitCode,
                                      CapturedOutput output, Optional<String> lastProbeError) {
        return new ProbeResult(Outcome.CRASHED_BEFORE_READY, elapsed, polls, OptionalInt.of(exitCode),
                output, lastProbeError);
    }

    public static ProbeResult timedOut(Duration elapsed, int polls, Optional<String> lastProbeError) {
        return new ProbeResult(Outcome.TIMED_OUT, elapsed, polls, OptionalInt.empty(),
                CapturedOutput.empty(), lastProbeError);
    }

    public boolean isReady() {
        return outcome == Outcome.READY;
    }
}
