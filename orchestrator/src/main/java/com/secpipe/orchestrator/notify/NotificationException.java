package com.secpipe.orchestrator.notify;

/**
 * Thrown when the run notification cannot be composed or dispatched.
 */
public class NotificationException extends RuntimeException {

    public NotificationException(String message) {
        super(message);
    }

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
