package com.secpipe.orchestrator.correlate;

import com.secpipe.orchestrator.artifact.ArtifactKind;

import java.time.Instant;

/**
 * Version and derived status of one pipeline run.
 *
 * @param version   strictly greater than every version previously seen in the store
 * @param status    derived from the run's test output
 * @param timestamp when the record was computed
 */
public record VersionRecord(int version, ReportStatus status, Instant timestamp) {

    public VersionRecord {
        if (version < 1) throw new IllegalArgumentException("version must be >= 1, was " + version);
        if (status == null) throw new IllegalArgumentException("status must not be null");
    }

    /** {@code <basename>_v<version>.<ext>}, e.g. test_result_report_v7.html */
    public String artifactName(String basename, ArtifactKind kind) {
        return basename + "_v" + version + "." + kind.extension();
    }
}
