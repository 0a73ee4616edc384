package com.secpipe.orchestrator.artifact;

/**
 * Thrown when the artifact directory cannot be created, read or written.
 */
public class ArtifactStoreException extends RuntimeException {

    public ArtifactStoreException(String message) {
        super(message);
    }

    public ArtifactStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
