package com.secpipe.orchestrator.tool;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Runs external programs (scanners, build tools, test runners, docker).
 *
 * Implementations block until the process exits or the timeout elapses.
 */
public interface ToolInvoker {

    /**
     * @param command    program and arguments, no shell interpretation
     * @param workingDir directory to run in; {@code null} inherits the JVM's
     * @param env        extra environment variables layered over the JVM's
     * @param timeout    wall-clock limit; on expiry the process is killed and
     *                   exit code {@link ToolResult#TIMEOUT_EXIT_CODE} is returned
     * @throws ToolLaunchException      if the process could not be started
     * @throws ToolInterruptedException if the calling thread was interrupted
     */
    ToolResult invoke(List<String> command, Path workingDir, Map<String, String> env, Duration timeout);
}
