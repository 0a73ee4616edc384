package com.secpipe.orchestrator.api.dto;

import com.secpipe.orchestrator.model.StageRecord;
import com.secpipe.orchestrator.pipeline.StageOutcome;

import java.time.Instant;

/**
 * Read-only view of one stage result returned by GET /runs/{id}/stages.
 * Skipped stages are listed with a null exit code.
 */
public record StageResponse(
        int          position,
        String       name,
        boolean      enabled,
        StageOutcome outcome,
        Integer      exitCode,
        String       detail,
        String       artifactsJson,
        Instant      startedAt,
        long         durationMs
) {
    public static StageResponse from(StageRecord s) {
        return new StageResponse(
                s.getPosition(),
                s.getName(),
                s.isEnabled(),
                s.getOutcome(),
                s.getExitCode(),
                s.getDetail(),
                s.getArtifactsJson(),
                s.getStartedAt(),
                s.getDurationMs()
        );
    }
}
