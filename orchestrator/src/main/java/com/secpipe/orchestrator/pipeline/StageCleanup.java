package com.secpipe.orchestrator.pipeline;

/**
 * Releases whatever an enabled stage acquired. Runs at most once per run.
 */
@FunctionalInterface
public interface StageCleanup {

    void release(StageContext context);
}
