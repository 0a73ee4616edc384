package com.secpipe.orchestrator.artifact;

import java.util.Locale;

/**
 * Kind tag of a report file kept in the artifact store.
 */
public enum ArtifactKind {
    HTML("html"),
    PDF("pdf"),
    TEXT("txt");

    private final String extension;

    ArtifactKind(String extension) {
        this.extension = extension;
    }

    public String extension() { return extension; }

    /** Anything that is not html or pdf is treated as a text report. */
    public static ArtifactKind fromFileName(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".html") || lower.endsWith(".htm")) return HTML;
        if (lower.endsWith(".pdf")) return PDF;
        return TEXT;
    }
}
