package com.secpipe.orchestrator.correlate;

import org.springframework.web.util.HtmlUtils;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Renders the versioned HTML summary report of a run.
 *
 * Pure string building, no I/O; the correlate stage writes the result to the
 * artifact store.
 */
public final class ReportGenerator {

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    private ReportGenerator() {}

    public static String render(String title, VersionRecord record,
                                TestSummary tests, SecuritySummary security) {
        String status = record.status().name();
        return String.format(Locale.ROOT, """
                <html>
                <head>
                  <meta charset="UTF-8">
                  <title>%1$s v%2$d</title>
                  <style>
                    body { font-family: Arial, sans-serif; margin: 20px; }
                    h1, h2 { color: #007bff; }
                    .summary { background-color: #f8f9fa; padding: 15px; border-radius: 8px; }
                    .security { background-color: #eef7ff; border: 1px solid #007bff; padding: 15px; margin: 15px 0; }
                    .pass { color: green; }
                    .fail { color: red; }
                    .unknown { color: gray; }
                  </style>
                </head>
                <body>
                  <h1>%1$s v%2$d</h1>
                  <p><b>Date:</b> %3$s</p>
                  <div class="summary">
                    <h2>Test Summary</h2>
                    <ul>
                      <li>Passed: %4$d</li>
                      <li>Failed: %5$d</li>
                      <li>Errors: %6$d</li>
                      <li>Skipped: %7$d</li>
                      <li>Pass Rate: %8$.1f%%</li>
                      <li>Status: <b class="%9$s">%10$s</b></li>
                    </ul>
                  </div>
                  <div class="security">
                    <h2>Security Summary</h2>
                    <ul>
                      <li><b>SAST:</b> %11$d findings</li>
                      <li><b>Dependency vulnerabilities:</b> %12$d issues</li>
                      <li><b>Container image scan:</b> %13$d High vulnerabilities</li>
                      <li><b>DAST:</b> %14$d High alerts</li>
                    </ul>
                  </div>
                  <p><i>Generated automatically by the DevSecOps pipeline.</i></p>
                </body>
                </html>
                """,
                HtmlUtils.htmlEscape(title),
                record.version(),
                TIMESTAMP.format(record.timestamp()),
                tests.passed(),
                tests.failed(),
                tests.errors(),
                tests.skipped(),
                tests.passRate(),
                status.toLowerCase(),
                status,
                security.sastFindings(),
                security.dependencyVulnerabilities(),
                security.imageHighFindings(),
                security.dastHighAlerts());
    }
}
