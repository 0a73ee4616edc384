package com.secpipe.orchestrator.correlate;

/**
 * Pass/fail status stamped on a run's report.
 *
 * UNKNOWN means no test output was captured during the run.
 */
public enum ReportStatus {
    PASS,
    FAIL,
    UNKNOWN
}
