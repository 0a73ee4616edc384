package com.secpipe.orchestrator.pipeline;

/**
 * Classification of one stage in a run.
 *
 *   OK        - action exited 0
 *   SOFT_FAIL - non-zero exit on a non-fatal stage; the run continues
 *   HARD_FAIL - non-zero exit on a fatal stage; the run stops here
 *   SKIPPED   - stage disabled by its toggle; nothing was invoked
 */
public enum StageOutcome {
    OK,
    SOFT_FAIL,
    HARD_FAIL,
    SKIPPED
}
