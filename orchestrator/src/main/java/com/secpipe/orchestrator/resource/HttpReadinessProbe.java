package com.secpipe.orchestrator.resource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Polls an HTTP health endpoint until it returns 2xx/3xx or the deadline passes.
 */
@Component
public class HttpReadinessProbe implements ReadinessProbe {

    private static final Logger log = LoggerFactory.getLogger(HttpReadinessProbe.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(5);

    private final HttpClient http = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(REQUEST_TIMEOUT)
            .build();

    @Override
    public boolean awaitReady(URI endpoint, Duration timeout, Duration pollInterval) {
        long deadline = System.nanoTime() + timeout.toNanos();
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                HttpResponse<Void> resp = http.send(
                        HttpRequest.newBuilder(endpoint).timeout(REQUEST_TIMEOUT).GET().build(),
                        HttpResponse.BodyHandlers.discarding());
                if (resp.statusCode() >= 200 && resp.statusCode() < 400) {
                    log.info("{} ready after {} attempt(s)", endpoint, attempts);
                    return true;
                }
                log.debug("{} answered HTTP {}", endpoint, resp.statusCode());
            } catch (IOException e) {
                log.debug("{} not reachable yet: {}", endpoint, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }

            if (System.nanoTime() + pollInterval.toNanos() > deadline) {
                log.warn("{} not ready after {} ({} attempts)", endpoint, timeout, attempts);
                return false;
            }
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }
}
