package com.secpipe.orchestrator.publish;

import java.util.Optional;

/**
 * Link to a run's published report page.
 *
 * @param resolvedUrl direct page link, {@code null} when the page could not be
 *                    identified unambiguously
 * @param fallbackUrl space root link, empty when no documentation system is configured
 */
public record PublishedLink(String resolvedUrl, String fallbackUrl) {

    public static PublishedLink fallback(String fallbackUrl) {
        return new PublishedLink(null, fallbackUrl == null ? "" : fallbackUrl);
    }

    public Optional<String> resolved() {
        return Optional.ofNullable(resolvedUrl);
    }

    public boolean isResolved() {
        return resolvedUrl != null;
    }

    /** The best link available: the page itself, else the space root. */
    public String url() {
        return resolvedUrl != null ? resolvedUrl : fallbackUrl;
    }
}
