package com.secpipe.orchestrator.correlate;

import com.secpipe.orchestrator.artifact.ArtifactStore;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rough finding counts scraped from the scanner reports in the artifact store.
 *
 * These are text heuristics over each tool's default report layout, good
 * enough for a headline number; the attached reports remain authoritative.
 */
public record SecuritySummary(int sastFindings, int dependencyVulnerabilities,
                              int imageHighFindings, int dastHighAlerts) {

    public static final String SAST_REPORT       = "bandit_report.html";
    public static final String DEPENDENCY_REPORT = "dependency_vuln.txt";
    public static final String IMAGE_REPORT      = "trivy_report.txt";
    public static final String DAST_REPORT       = "zap_dast_report.html";

    private static final Pattern SAST_ISSUE = Pattern.compile("class=\"issue[\\s\"-]");
    private static final Pattern HIGH       = Pattern.compile("\\bHIGH\\b", Pattern.CASE_INSENSITIVE);
    // A table row with content, not a +---+ or |===| separator.
    private static final Pattern TABLE_ROW  = Pattern.compile("(?m)^(?=.*\\|)(?=.*[A-Za-z0-9]).*$");

    public static SecuritySummary collect(ArtifactStore store) {
        return new SecuritySummary(
                count(SAST_ISSUE, store.read(SAST_REPORT).orElse("")),
                count(TABLE_ROW,  store.read(DEPENDENCY_REPORT).orElse("")),
                count(HIGH,       store.read(IMAGE_REPORT).orElse("")),
                count(HIGH,       store.read(DAST_REPORT).orElse("")));
    }

    static int count(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int n = 0;
        while (m.find()) n++;
        return n;
    }
}
