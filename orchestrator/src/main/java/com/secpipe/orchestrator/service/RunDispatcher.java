package com.secpipe.orchestrator.service;

import com.secpipe.orchestrator.artifact.ArtifactStore;
import com.secpipe.orchestrator.pipeline.PipelineRun;
import com.secpipe.orchestrator.pipeline.StageGraphExecutor;
import com.secpipe.orchestrator.stage.StandardStages;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;

/**
 * Executes queued runs on a single worker thread.
 *
 * One run at a time: a run owns the artifact directory, the version file and
 * the fixed docker container/network names for its whole duration.
 *
 * Cancelling interrupts the worker; the executor notices at the next stage
 * boundary or inside the blocking tool call, and its finaliser still releases
 * the run's resources.
 */
@Component
public class RunDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RunDispatcher.class);

    private static final long SHUTDOWN_WAIT_SECONDS = 30;

    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "pipeline-worker");
        t.setDaemon(false);
        return t;
    });

    /** Where a run is; the queued-to-running and queued-to-cancelled moves are atomic. */
    enum Phase { QUEUED, RUNNING, CANCELLED }

    // Queued or running runs; a run leaves these maps when its task ends.
    private final Map<UUID, FutureTask<PipelineRun>> active = new ConcurrentHashMap<>();
    private final Map<UUID, Phase>                   phases = new ConcurrentHashMap<>();

    private final RunService     runService;
    private final StandardStages stages;
    private final ArtifactStore  artifactStore;
    private final MeterRegistry  meterRegistry;
    private final Clock          clock;

    public RunDispatcher(RunService runService,
                         StandardStages stages,
                         ArtifactStore artifactStore,
                         MeterRegistry meterRegistry,
                         Clock clock) {
        this.runService    = runService;
        this.stages        = stages;
        this.artifactStore = artifactStore;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
    }

    /** Queue a persisted run for background execution. */
    public void dispatch(UUID runId) {
        FutureTask<PipelineRun> task = new FutureTask<>(() -> execute(runId));
        phases.put(runId, Phase.QUEUED);
        active.put(runId, task);
        worker.execute(() -> {
            try {
                task.run();
            } finally {
                // Also covers a task cancelled before it ever started.
                phases.remove(runId);
                active.remove(runId, task);
            }
        });
        log.info("Run {} dispatched", runId);
    }

    /** Execute a persisted run on the calling thread (start-up mode). */
    public PipelineRun runSynchronously(UUID runId) {
        return execute(runId);
    }

    /**
     * Cancel a queued or running run.
     *
     * @return {@code false} if the run is not known to this dispatcher
     */
    public boolean cancel(UUID runId) {
        FutureTask<PipelineRun> task = active.remove(runId);
        if (task == null) {
            return false;
        }
        boolean queued = phases.replace(runId, Phase.QUEUED, Phase.CANCELLED);
        task.cancel(true);
        if (queued) {
            // The worker will not claim it now, so nobody else will close the record.
            runService.markFailed(runId, true);
        }
        log.info("Run {} cancel requested ({})", runId, queued ? "queued" : "running");
        return true;
    }

    public boolean isActive(UUID runId) {
        return active.containsKey(runId);
    }

    /**
     * Claim and execute a run.
     *
     * @return the finished run, or {@code null} if it was cancelled before it could be claimed
     */
    PipelineRun execute(UUID runId) {
        if (!claim(runId)) {
            log.info("Run {} was cancelled before it started, skipping", runId);
            return null;
        }
        try {
            Map<String, Boolean> toggles = runService.toggles(runId);
            runService.markRunning(runId);

            StageGraphExecutor executor = new StageGraphExecutor(artifactStore, meterRegistry, clock);
            executor.configure(stages.descriptors(), toggles);
            PipelineRun run = executor.run(runId);

            // Persist with the interrupt flag cleared: a cancelled run is still recorded.
            boolean interrupted = Thread.interrupted();
            try {
                runService.complete(run);
            } finally {
                if (interrupted) Thread.currentThread().interrupt();
            }
            return run;
        } catch (RuntimeException e) {
            log.error("Run {} aborted before completion: {}", runId, e.getMessage(), e);
            boolean interrupted = Thread.interrupted();
            try {
                runService.markFailed(runId, interrupted);
            } finally {
                if (interrupted) Thread.currentThread().interrupt();
            }
            throw e;
        } finally {
            phases.remove(runId);
            active.remove(runId);
        }
    }

    /** Move the run to RUNNING unless a cancel got there first. */
    private boolean claim(UUID runId) {
        Phase previous = phases.putIfAbsent(runId, Phase.RUNNING);
        return previous == null || phases.replace(runId, Phase.QUEUED, Phase.RUNNING);
    }

    Phase phase(UUID runId) {
        return phases.get(runId);
    }

    /** Interrupt the running run so its cleanups execute before the JVM exits. */
    @PreDestroy
    public void shutdown() {
        log.info("Shutting down pipeline worker ({} active run(s))", active.size());
        worker.shutdownNow();
        try {
            if (!worker.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Pipeline worker did not stop within {} s", SHUTDOWN_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
