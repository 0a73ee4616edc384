package com.secpipe.orchestrator.publish;

/**
 * Thrown when the documentation system returns an error, is unreachable,
 * rejects our credentials, or is not configured.
 */
public class DocumentationException extends RuntimeException {

    public DocumentationException(String message) {
        super(message);
    }

    public DocumentationException(String message, Throwable cause) {
        super(message, cause);
    }
}
