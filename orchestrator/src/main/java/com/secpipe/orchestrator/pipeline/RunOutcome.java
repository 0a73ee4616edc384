package com.secpipe.orchestrator.pipeline;

/**
 * Terminal outcome of a pipeline run. FAILURE only on a hard failure or cancellation.
 */
public enum RunOutcome {
    SUCCESS,
    FAILURE
}
