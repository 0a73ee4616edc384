package com.secpipe.orchestrator.tool;

/**
 * Thrown when an external program cannot be started at all
 * (binary not found, permission denied, bad working directory).
 */
public class ToolLaunchException extends RuntimeException {

    /** Conventional shell exit code for "command not found". */
    public static final int EXIT_CODE = 127;

    public ToolLaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
