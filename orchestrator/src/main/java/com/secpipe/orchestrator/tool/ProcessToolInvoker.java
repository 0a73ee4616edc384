package com.secpipe.orchestrator.tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * {@link ToolInvoker} backed by {@link ProcessBuilder}.
 *
 * stdout and stderr are redirected to temporary files rather than pipes so a
 * chatty scanner can never block on a full pipe buffer while we wait for it.
 */
@Component
public class ProcessToolInvoker implements ToolInvoker {

    private static final Logger log = LoggerFactory.getLogger(ProcessToolInvoker.class);

    // How long to wait for a forcibly killed process to actually go away.
    private static final Duration KILL_GRACE = Duration.ofSeconds(10);

    @Override
    public ToolResult invoke(List<String> command, Path workingDir, Map<String, String> env, Duration timeout) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        String display = String.join(" ", command);
        log.info("Running: {}", display);

        Path out = null;
        Path err = null;
        try {
            out = Files.createTempFile("secpipe-tool-", ".out");
            err = Files.createTempFile("secpipe-tool-", ".err");
            return run(command, workingDir, env, timeout, out, err, display);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create capture files for " + display, e);
        } finally {
            deleteQuietly(out);
            deleteQuietly(err);
        }
    }

    private ToolResult run(List<String> command, Path workingDir, Map<String, String> env,
                           Duration timeout, Path out, Path err, String display) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command)
                .redirectOutput(out.toFile())
                .redirectError(err.toFile());
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        if (env != null) {
            pb.environment().putAll(env);
        }

        long started = System.nanoTime();
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ToolLaunchException("Could not launch '" + command.get(0) + "': " + e.getMessage(), e);
        }

        boolean timedOut = false;
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                timedOut = true;
                log.warn("'{}' exceeded its timeout of {}, killing it", display, timeout);
                process.destroyForcibly();
                process.waitFor(KILL_GRACE.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ToolInterruptedException("Interrupted while waiting for '" + display + "'", e);
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        String stdout = readLenient(out);
        String stderr = readLenient(err);
        if (timedOut) {
            String marker = "timed out after " + timeout.toSeconds() + "s";
            stderr = stderr.isEmpty() ? marker : stderr + System.lineSeparator() + marker;
            return new ToolResult(ToolResult.TIMEOUT_EXIT_CODE, stdout, stderr, true, elapsed);
        }

        int exitCode = process.exitValue();
        log.info("'{}' exited with {} after {} ms", command.get(0), exitCode, elapsed.toMillis());
        return new ToolResult(exitCode, stdout, stderr, false, elapsed);
    }

    // Scanner output is not always valid UTF-8; replace bad bytes instead of failing.
    private static String readLenient(Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    private static void deleteQuietly(Path path) {
        if (path == null) return;
        File file = path.toFile();
        if (file.exists() && !file.delete()) {
            log.debug("Could not delete capture file {}", path);
        }
    }
}
