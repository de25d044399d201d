package com.questrail.harness.process;

import java.util.Objects;

/**
 * Output captured from a child process. Diagnostic only.
 *
 * @param stdout    captured standard output
 * @param stderr    captured standard error
 * @param truncated whether the oldest output was dropped to stay within bounds
 */
public record CapturedOutput(String stdout, String stderr, boolean truncated) {

    private static final CapturedOutput EMPTY = new CapturedOutput("", "", false);

    public CapturedOutput {
        Objects.requireNonNull(stdout, "stdout");
        Objects.requireNonNull(stderr, "stderr");
    }

    public static CapturedOutput empty() {
        return EMPTY;
    }

    /**
     * Combined logs, stdout first.
     */
    public String combined() {
        StringBuilder sb = new StringBuilder();
        if (truncated) {
            sb.append("[output truncated]\n");
        }
        sb.append("stdout:\n").append(stdout);
        sb.append("\nstderr:\n").append(stderr);
        return sb.toString();
    }
}
