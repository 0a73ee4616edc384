package com.secpipe.orchestrator.pipeline;

/**
 * The work a stage performs.
 *
 * A non-zero exit code in the result is an ordinary failure. Exceptions are
 * also accepted and classified as failures by the executor.
 */
@FunctionalInterface
public interface StageAction {

    ActionResult execute(StageContext context);
}
