package com.secpipe.orchestrator.resource;

import java.net.URI;
import java.time.Duration;

/**
 * Waits for a freshly started service to answer.
 */
public interface ReadinessProbe {

    /**
     * @return {@code true} once the endpoint responds successfully, {@code false}
     *         if {@code timeout} elapses first or the thread is interrupted
     */
    boolean awaitReady(URI endpoint, Duration timeout, Duration pollInterval);
}
