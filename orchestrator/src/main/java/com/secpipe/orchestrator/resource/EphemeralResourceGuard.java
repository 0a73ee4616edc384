package com.secpipe.orchestrator.resource;

import com.secpipe.orchestrator.tool.ToolInvoker;
import com.secpipe.orchestrator.tool.ToolLaunchException;
import com.secpipe.orchestrator.tool.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Provisions and tears down the container + network pair used for dynamic scanning.
 *
 * <p>Each successful {@link #provision} is tracked until {@link #release}; a
 * second release of the same resource is a no-op, so callers may release
 * from several exit paths without double teardown. A failed provision tears
 * down whatever it had already created before throwing.
 *
 * <p>Readiness is an HTTP poll against the published port with a bounded
 * timeout, not a fixed sleep.
 */
public class EphemeralResourceGuard {

    private static final Logger log = LoggerFactory.getLogger(EphemeralResourceGuard.class);

    private static final Duration DOCKER_TIMEOUT = Duration.ofMinutes(2);

    private final ToolInvoker    tools;
    private final ReadinessProbe probe;
    private final String         healthPath;
    private final Duration       readinessTimeout;
    private final Duration       pollInterval;
    private final Clock          clock;

    private final Set<EphemeralResource> live = ConcurrentHashMap.newKeySet();

    public EphemeralResourceGuard(ToolInvoker tools, ReadinessProbe probe, String healthPath,
                                  Duration readinessTimeout, Duration pollInterval, Clock clock) {
        this.tools            = tools;
        this.probe            = probe;
        this.healthPath       = healthPath;
        this.readinessTimeout = readinessTimeout;
        this.pollInterval     = pollInterval;
        this.clock            = clock;
    }

    /**
     * Create {@code networkName}, start {@code image} on it as {@code name} with
     * {@code ports} published, and wait until its health endpoint answers.
     *
     * @throws ResourceProvisionException if any step fails; partial resources are removed first
     */
    public EphemeralResource provision(String name, String networkName, String image, PortMapping ports) {
        log.info("Provisioning container '{}' ({}) on network '{}'", name, image, networkName);
        boolean networkCreated   = false;
        boolean containerStarted = false;
        try {
            docker("network create " + networkName, "network", "create", networkName);
            networkCreated = true;

            try {
                docker("run " + name, "run", "-d", "--name", name, "--network", networkName,
                        "-p", ports.dockerArgument(), image);
            } catch (ResourceProvisionException e) {
                // A failed start may leave a created container behind, unless the
                // name was taken by a container this run does not own.
                containerStarted = !isNameConflict(e);
                throw e;
            }
            containerStarted = true;

            URI health = URI.create("http://localhost:" + ports.hostPort() + healthPath);
            if (!probe.awaitReady(health, readinessTimeout, pollInterval)) {
                throw new ResourceProvisionException(
                        "Container '" + name + "' did not become ready within " + readinessTimeout);
            }

            EphemeralResource resource = new EphemeralResource(name, networkName, image, ports, clock.instant());
            live.add(resource);
            log.info("Container '{}' is up at localhost:{}", name, ports.hostPort());
            return resource;
        } catch (ToolLaunchException e) {
            rollback(name, networkName, containerStarted, networkCreated);
            throw new ResourceProvisionException("docker is not available: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            rollback(name, networkName, containerStarted, networkCreated);
            throw e;
        }
    }

    /** Remove the container and its network. Safe to call more than once. */
    public void release(EphemeralResource resource) {
        if (!live.remove(resource)) {
            log.debug("Resource '{}' already released", resource.name());
            return;
        }
        // Teardown must run even when the run is being cancelled.
        boolean interrupted = Thread.interrupted();
        try {
            log.info("Releasing container '{}' and network '{}'", resource.name(), resource.networkName());
            removeQuietly("rm -f " + resource.name(), "rm", "-f", resource.name());
            removeQuietly("network rm " + resource.networkName(), "network", "rm", resource.networkName());
        } finally {
            if (interrupted) Thread.currentThread().interrupt();
        }
    }

    /** Release everything still provisioned; called on application shutdown. */
    public void releaseAll() {
        for (EphemeralResource resource : List.copyOf(live)) {
            release(resource);
        }
    }

    public Set<EphemeralResource> live() {
        return Set.copyOf(live);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void rollback(String name, String networkName, boolean containerStarted, boolean networkCreated) {
        boolean interrupted = Thread.interrupted();
        try {
            if (containerStarted) removeQuietly("rm -f " + name, "rm", "-f", name);
            if (networkCreated)   removeQuietly("network rm " + networkName, "network", "rm", networkName);
        } finally {
            if (interrupted) Thread.currentThread().interrupt();
        }
    }

    static boolean isNameConflict(ResourceProvisionException e) {
        String message = e.getMessage();
        return message != null && message.contains("is already in use");
    }

    private void docker(String opName, String... args) {
        ToolResult result = tools.invoke(command(args), null, Map.of(), DOCKER_TIMEOUT);
        if (!result.success()) {
            throw new ResourceProvisionException(
                    "docker " + opName + " failed (exit " + result.exitCode() + "): " + result.summaryLine());
        }
    }

    /**
     * Best-effort teardown step. A failure is logged, not propagated: the other
     * teardown steps still have to run, and a leftover container only costs
     * resources until the next manual cleanup.
     */
    private void removeQuietly(String opName, String... args) {
        try {
            ToolResult result = tools.invoke(command(args), null, Map.of(), DOCKER_TIMEOUT);
            if (!result.success()) {
                log.warn("docker {} exited {}: {}", opName, result.exitCode(), result.summaryLine());
            }
        } catch (RuntimeException e) {
            log.warn("docker {} failed, manual cleanup may be needed: {}", opName, e.getMessage());
        }
    }

    private static List<String> command(String... args) {
        String[] cmd = new String[args.length + 1];
        cmd[0] = "docker";
        System.arraycopy(args, 0, cmd, 1, args.length);
        return List.of(cmd);
    }
}
