package com.secpipe.orchestrator.tool;

import java.time.Duration;

/**
 * Outcome of one external process run.
 *
 * A non-zero exit code is ordinary data here (a scanner that finds issues
 * exits non-zero); only a process that could not be started is an error.
 */
public record ToolResult(
        int      exitCode,
        String   stdout,
        String   stderr,
        boolean  timedOut,
        Duration elapsed
) {
    /** Exit code reported when the process was killed after its timeout. */
    public static final int TIMEOUT_EXIT_CODE = 124;

    public boolean success() {
        return exitCode == 0;
    }

    /** stdout followed by stderr, for stages that archive both streams in one file. */
    public String combinedOutput() {
        StringBuilder sb = new StringBuilder();
        if (stdout != null && !stdout.isEmpty()) sb.append(stdout);
        if (stderr != null && !stderr.isEmpty()) {
            if (!sb.isEmpty() && sb.charAt(sb.length() - 1) != '\n') sb.append('\n');
            sb.append(stderr);
        }
        return sb.toString();
    }

    /** Last non-blank line of stderr (or stdout), used as a one-line failure detail. */
    public String summaryLine() {
        String source = stderr != null && !stderr.isBlank() ? stderr : stdout;
        if (source == null || source.isBlank()) return "exit code " + exitCode;
        String[] lines = source.strip().split("\\R");
        return lines[lines.length - 1].strip();
    }
}
