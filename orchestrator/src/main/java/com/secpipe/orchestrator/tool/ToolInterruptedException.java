package com.secpipe.orchestrator.tool;

/**
 * Thrown when the thread waiting on an external program is interrupted.
 * The child process has already been killed when this is raised.
 */
public class ToolInterruptedException extends RuntimeException {

    public ToolInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
