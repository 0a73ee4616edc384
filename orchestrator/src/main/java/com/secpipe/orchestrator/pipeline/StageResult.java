package com.secpipe.orchestrator.pipeline;

import com.secpipe.orchestrator.artifact.ArtifactRef;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Immutable record of how one stage went.
 *
 * @param exitCode {@code null} when the stage was skipped
 */
public record StageResult(
        String            name,
        boolean           enabled,
        Integer           exitCode,
        List<ArtifactRef> artifacts,
        StageOutcome      outcome,
        String            detail,
        Instant           startedAt,
        Duration          duration
) {
    public StageResult {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }

    public static StageResult skipped(String name, Instant at) {
        return new StageResult(name, false, null, List.of(), StageOutcome.SKIPPED, "disabled", at, Duration.ZERO);
    }
}
