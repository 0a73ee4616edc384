package com.secpipe.orchestrator.resource;

/**
 * Host port published for a container port ({@code docker run -p host:container}).
 */
public record PortMapping(int hostPort, int containerPort) {

    public PortMapping {
        if (hostPort <= 0 || containerPort <= 0) {
            throw new IllegalArgumentException("ports must be positive: " + hostPort + ":" + containerPort);
        }
    }

    public String dockerArgument() {
        return hostPort + ":" + containerPort;
    }
}
