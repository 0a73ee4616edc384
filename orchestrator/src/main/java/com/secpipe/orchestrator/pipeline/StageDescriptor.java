package com.secpipe.orchestrator.pipeline;

import java.util.Map;

/**
 * Static definition of one pipeline stage.
 *
 * @param name         unique within a pipeline
 * @param toggle       toggle key gating the stage; {@code null} for an always-on stage
 * @param fatal        whether a failure of this stage stops the run
 * @param action       what the stage does
 * @param cleanup      release step for what the action acquired; {@code null} for none
 * @param releaseAfter name of the last stage that still needs the acquired
 *                     resource; the cleanup runs once that stage is passed
 */
public record StageDescriptor(
        String       name,
        String       toggle,
        boolean      fatal,
        StageAction  action,
        StageCleanup cleanup,
        String       releaseAfter
) {
    public StageDescriptor {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("stage name is required");
        if (action == null) throw new IllegalArgumentException("stage '" + name + "' has no action");
        if (releaseAfter == null) releaseAfter = name;
    }

    public static StageDescriptor always(String name, boolean fatal, StageAction action) {
        return new StageDescriptor(name, null, fatal, action, null, null);
    }

    public static StageDescriptor toggled(String name, String toggle, boolean fatal, StageAction action) {
        return new StageDescriptor(name, toggle, fatal, action, null, null);
    }

    /** Copy of this descriptor with a cleanup that runs after {@code releaseAfter}. */
    public StageDescriptor withCleanup(StageCleanup cleanup, String releaseAfter) {
        return new StageDescriptor(name, toggle, fatal, action, cleanup, releaseAfter);
    }

    public boolean unconditional() {
        return toggle == null;
    }

    public boolean enabledBy(Map<String, Boolean> toggles) {
        return unconditional() || Boolean.TRUE.equals(toggles.get(toggle));
    }
}
