package com.secpipe.orchestrator.correlate;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Counts pulled from a test runner's summary line ("2 failed, 3 passed in 0.12s").
 * Missing counts are zero.
 */
public record TestSummary(int passed, int failed, int errors, int skipped) {

    // Counts are capped at nine digits so they always fit an int.
    private static final Pattern PASSED  = Pattern.compile("(?<!\\d)(\\d{1,9})\\s+passed");
    private static final Pattern FAILED  = Pattern.compile("(?<!\\d)(\\d{1,9})\\s+failed");
    private static final Pattern ERRORS  = Pattern.compile("(?<!\\d)(\\d{1,9})\\s+errors?\\b");
    private static final Pattern SKIPPED = Pattern.compile("(?<!\\d)(\\d{1,9})\\s+skipped");

    public static final TestSummary EMPTY = new TestSummary(0, 0, 0, 0);

    public static TestSummary parse(String output) {
        if (output == null || output.isBlank()) return EMPTY;
        return new TestSummary(
                first(PASSED, output),
                first(FAILED, output),
                first(ERRORS, output),
                first(SKIPPED, output));
    }

    public int total() {
        return passed + failed + errors + skipped;
    }

    /** Percentage of passed tests, one decimal place; 0 when nothing ran. */
    public double passRate() {
        if (total() == 0) return 0.0;
        return Math.round(passed * 1000.0 / total()) / 10.0;
    }

    private static int first(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        return m.find() ? Integer.parseInt(m.group(1)) : 0;
    }
}
