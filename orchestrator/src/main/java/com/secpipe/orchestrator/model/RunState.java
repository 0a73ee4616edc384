package com.secpipe.orchestrator.model;

/**
 * Lifecycle of a persisted pipeline run.
 *
 * QUEUED → RUNNING → SUCCESS | FAILURE
 */
public enum RunState {
    QUEUED,
    RUNNING,
    SUCCESS,
    FAILURE;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILURE;
    }
}
