package com.secpipe.orchestrator.publish;

/**
 * One hit of a documentation-system content search.
 *
 * @param version page version number; an update must send {@code version + 1}
 */
public record PageSummary(String id, String title, int version) {}
