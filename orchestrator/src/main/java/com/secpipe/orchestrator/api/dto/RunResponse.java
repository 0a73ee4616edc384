package com.secpipe.orchestrator.api.dto;

import com.secpipe.orchestrator.model.RunRecord;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for POST /runs and GET /runs/{id}.
 *
 * reportVersion, reportStatus and reportLink are null until the run has
 * reached its correlate/publish stages.
 */
public record RunResponse(
        UUID    id,
        String  state,
        boolean cancelled,
        Integer reportVersion,
        String  reportStatus,
        String  reportLink,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt
) {
    public static RunResponse from(RunRecord run) {
        return new RunResponse(
                run.getId(),
                run.getState().name(),
                run.isCancelled(),
                run.getReportVersion(),
                run.getReportStatus(),
                run.getReportLink(),
                run.getCreatedAt(),
                run.getStartedAt(),
                run.getFinishedAt()
        );
    }
}
