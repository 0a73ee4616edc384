package com.secpipe.orchestrator.pipeline;

import com.secpipe.orchestrator.artifact.ArtifactRef;

import java.util.List;

/**
 * What a stage action reports back to the executor.
 *
 * @param exitCode  0 for success; any other value is a failure
 * @param detail    one-line human-readable summary, may be {@code null}
 * @param artifacts files the action produced (or was expected to produce)
 */
public record ActionResult(int exitCode, String detail, List<ArtifactRef> artifacts) {

    public ActionResult {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }

    public static ActionResult ok() {
        return new ActionResult(0, null, List.of());
    }

    public static ActionResult ok(String detail, List<ArtifactRef> artifacts) {
        return new ActionResult(0, detail, artifacts);
    }

    public static ActionResult failed(int exitCode, String detail) {
        return new ActionResult(exitCode, detail, List.of());
    }

    public boolean success() {
        return exitCode == 0;
    }
}
