package com.secpipe.orchestrator.api.dto;

import java.util.Map;

/**
 * Request body for POST /runs.
 *
 * Optional: toggles, per-run overrides of the configured stage toggles,
 *   e.g. {"dast-deploy": false, "dast-scan": false}. Omitted toggles keep
 *   their configured value.
 */
public record TriggerRunRequest(Map<String, Boolean> toggles) {

    public TriggerRunRequest {
        if (toggles == null) toggles = Map.of();
    }
}
