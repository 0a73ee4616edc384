package com.secpipe.orchestrator.artifact;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A named report file produced by a stage.
 *
 * {@code exists} is captured when the reference is created; a stage that was
 * expected to write a file but did not still reports the reference with
 * {@code exists = false} so the gap stays visible in the run summary.
 */
public record ArtifactRef(String name, ArtifactKind kind, boolean exists, Path path) {

    public static ArtifactRef of(Path path) {
        String name = path.getFileName().toString();
        return new ArtifactRef(name, ArtifactKind.fromFileName(name), Files.isRegularFile(path), path);
    }
}
