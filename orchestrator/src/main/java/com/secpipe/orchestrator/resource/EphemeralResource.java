package com.secpipe.orchestrator.resource;

import java.time.Instant;

/**
 * A container attached to its own docker network, alive only for the stages
 * that scan it.
 */
public record EphemeralResource(
        String      name,
        String      networkName,
        String      image,
        PortMapping ports,
        Instant     provisionedAt
) {
    /** URL of the container as seen from another container on the same network. */
    public String networkUrl() {
        return "http://" + name + ":" + ports.containerPort();
    }
}
