package com.secpipe.orchestrator.resource;

/**
 * Thrown when an ephemeral container or network cannot be brought up.
 * Anything created before the failure has already been torn down.
 */
public class ResourceProvisionException extends RuntimeException {

    public ResourceProvisionException(String message) {
        super(message);
    }

    public ResourceProvisionException(String message, Throwable cause) {
        super(message, cause);
    }
}
