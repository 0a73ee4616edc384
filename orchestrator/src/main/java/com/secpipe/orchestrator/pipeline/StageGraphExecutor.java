package com.secpipe.orchestrator.pipeline;

import com.secpipe.orchestrator.artifact.ArtifactStore;
import com.secpipe.orchestrator.tool.ToolInterruptedException;
import com.secpipe.orchestrator.tool.ToolLaunchException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Drives one pipeline run through an ordered stage table.
 *
 * <p>For each descriptor, in declaration order:
 * <ol>
 *   <li>A stage whose toggle is off is recorded as SKIPPED. Nothing is invoked
 *       and no cleanup is registered.</li>
 *   <li>An enabled stage registers its cleanup (if any), then runs its action.</li>
 *   <li>Exit 0 is OK. A non-zero exit (or an exception from the action) is a
 *       SOFT_FAIL on a non-fatal stage and the run continues; on a fatal stage
 *       it is a HARD_FAIL and no further stage runs.</li>
 *   <li>Cleanups whose {@code releaseAfter} stage has just been passed run now.</li>
 * </ol>
 * Every cleanup still pending when the loop ends, for whatever reason
 * (hard failure, cancellation, an unexpected error), runs in a finally block
 * in reverse registration order. Nothing is retried.
 *
 * <p>Every executed stage is timed and counted:
 * <pre>
 *   secpipe.stage.duration{stage}
 *   secpipe.stage.outcomes{stage, outcome="ok|soft_fail|hard_fail|skipped"}
 * </pre>
 *
 * <p>An executor instance handles one configuration; {@link #run} may be
 * called more than once but never concurrently.
 */
public class StageGraphExecutor {

    private static final Logger log = LoggerFactory.getLogger(StageGraphExecutor.class);

    /** Exit code recorded when an action throws instead of returning a result. */
    static final int ACTION_ERROR_EXIT_CODE = 1;

    /** Exit code recorded for the stage that was running when the run was cancelled. */
    static final int CANCELLED_EXIT_CODE = 130;

    private final ArtifactStore artifactStore;
    private final MeterRegistry meterRegistry;
    private final Clock         clock;

    private List<StageDescriptor> descriptors;
    private Map<String, Boolean>  toggles;

    public StageGraphExecutor(ArtifactStore artifactStore, MeterRegistry meterRegistry, Clock clock) {
        this.artifactStore = artifactStore;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
    }

    /**
     * Set the stage table and the toggle values for subsequent runs.
     *
     * @throws IllegalArgumentException on duplicate stage names, a toggle key no
     *         stage uses, or a {@code releaseAfter} that does not name this or a later stage
     */
    public void configure(List<StageDescriptor> descriptors, Map<String, Boolean> toggles) {
        Map<String, Boolean> resolved = toggles == null ? Map.of() : toggles;

        Set<String> names      = new HashSet<>();
        Set<String> toggleKeys = new HashSet<>();
        for (StageDescriptor d : descriptors) {
            if (!names.add(d.name())) {
                throw new IllegalArgumentException("Duplicate stage name: " + d.name());
            }
            if (d.toggle() != null) toggleKeys.add(d.toggle());
        }
        for (String key : resolved.keySet()) {
            if (!toggleKeys.contains(key)) {
                throw new IllegalArgumentException("Unknown toggle '" + key + "', known toggles: " + toggleKeys);
            }
        }
        for (int i = 0; i < descriptors.size(); i++) {
            StageDescriptor d = descriptors.get(i);
            boolean laterOrSelf = descriptors.subList(i, descriptors.size()).stream()
                    .anyMatch(other -> other.name().equals(d.releaseAfter()));
            if (!laterOrSelf) {
                throw new IllegalArgumentException("Stage '" + d.name() + "' releases after '"
                        + d.releaseAfter() + "', which is not this or a later stage");
            }
        }

        this.descriptors = List.copyOf(descriptors);
        this.toggles     = Collections.unmodifiableMap(new LinkedHashMap<>(resolved));
    }

    public PipelineRun run() {
        return run(UUID.randomUUID());
    }

    /**
     * Execute the configured stages under {@code runId}.
     * Blocks until the run ends; returns the finished run.
     */
    public PipelineRun run(UUID runId) {
        if (descriptors == null) {
            throw new IllegalStateException("configure() must be called before run()");
        }
        PipelineRun  run     = new PipelineRun(runId, toggles, clock.instant());
        StageContext context = new StageContext(run, artifactStore);
        LinkedList<PendingCleanup> pending = new LinkedList<>();

        MDC.put("runId", runId.toString());
        log.info("Run {} starting: {} stages, toggles {}", runId, descriptors.size(), toggles);
        try {
            for (StageDescriptor descriptor : descriptors) {
                if (Thread.currentThread().isInterrupted()) {
                    log.warn("Run {} cancelled before stage '{}'", runId, descriptor.name());
                    run.markCancelled();
                    break;
                }

                StageResult result;
                if (descriptor.enabledBy(toggles)) {
                    if (descriptor.cleanup() != null) {
                        pending.add(new PendingCleanup(descriptor, descriptor.releaseAfter()));
                    }
                    result = execute(descriptor, context, run);
                } else {
                    log.info("Stage '{}' skipped (toggle '{}' off)", descriptor.name(), descriptor.toggle());
                    result = StageResult.skipped(descriptor.name(), clock.instant());
                }
                count(descriptor.name(), result.outcome());
                run.append(result);

                runDueCleanups(descriptor.name(), pending, context);

                if (result.outcome() == StageOutcome.HARD_FAIL) {
                    log.error("Stage '{}' failed fatally (exit {}), stopping run {}: {}",
                            descriptor.name(), result.exitCode(), runId, result.detail());
                    break;
                }
                if (run.isCancelled()) {
                    break;
                }
            }
        } finally {
            runAllCleanups(pending, context);
            RunOutcome outcome = run.hasHardFailure() || run.isCancelled()
                    ? RunOutcome.FAILURE
                    : RunOutcome.SUCCESS;
            run.finish(outcome, clock.instant());
            log.info("Run {} finished: {}{}", runId, outcome, run.isCancelled() ? " (cancelled)" : "");
            MDC.remove("runId");
        }
        return run;
    }

    // ------------------------------------------------------------------
    // Stage execution
    // ------------------------------------------------------------------

    private StageResult execute(StageDescriptor descriptor, StageContext context, PipelineRun run) {
        MDC.put("stage", descriptor.name());
        Instant started = clock.instant();
        Timer.Sample sample = Timer.start(meterRegistry);
        log.info("Stage '{}' starting", descriptor.name());

        ActionResult action;
        try {
            action = descriptor.action().execute(context);
            if (action == null) {
                action = ActionResult.failed(ACTION_ERROR_EXIT_CODE, "stage action returned no result");
            }
        } catch (ToolInterruptedException e) {
            run.markCancelled();
            action = ActionResult.failed(CANCELLED_EXIT_CODE, "cancelled: " + e.getMessage());
        } catch (ToolLaunchException e) {
            log.warn("Stage '{}' could not launch its tool: {}", descriptor.name(), e.getMessage());
            action = ActionResult.failed(ToolLaunchException.EXIT_CODE, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Stage '{}' threw {}", descriptor.name(), e.toString(), e);
            action = ActionResult.failed(ACTION_ERROR_EXIT_CODE, e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            sample.stop(meterRegistry.timer("secpipe.stage.duration", "stage", descriptor.name()));
        }

        StageOutcome outcome = classify(descriptor, action);
        Duration duration = Duration.between(started, clock.instant());
        if (outcome == StageOutcome.OK) {
            log.info("Stage '{}' OK in {} ms", descriptor.name(), duration.toMillis());
        } else if (outcome == StageOutcome.SOFT_FAIL) {
            log.warn("Stage '{}' failed (exit {}), continuing: {}",
                    descriptor.name(), action.exitCode(), action.detail());
        }
        MDC.remove("stage");
        return new StageResult(descriptor.name(), true, action.exitCode(), action.artifacts(),
                outcome, action.detail(), started, duration);
    }

    static StageOutcome classify(StageDescriptor descriptor, ActionResult action) {
        if (action.success()) return StageOutcome.OK;
        return descriptor.fatal() ? StageOutcome.HARD_FAIL : StageOutcome.SOFT_FAIL;
    }

    private void count(String stage, StageOutcome outcome) {
        meterRegistry.counter("secpipe.stage.outcomes",
                "stage", stage, "outcome", outcome.name().toLowerCase()).increment();
    }

    // ------------------------------------------------------------------
    // Cleanups
    // ------------------------------------------------------------------

    private record PendingCleanup(StageDescriptor owner, String releaseAfter) {}

    private void runDueCleanups(String passedStage, List<PendingCleanup> pending, StageContext context) {
        Iterator<PendingCleanup> it = pending.iterator();
        List<PendingCleanup> due = new ArrayList<>();
        while (it.hasNext()) {
            PendingCleanup p = it.next();
            if (p.releaseAfter().equals(passedStage)) {
                it.remove();
                due.add(p);
            }
        }
        Collections.reverse(due);
        due.forEach(p -> runCleanup(p, context));
    }

    private void runAllCleanups(LinkedList<PendingCleanup> pending, StageContext context) {
        while (!pending.isEmpty()) {
            runCleanup(pending.removeLast(), context);
        }
    }

    /**
     * Run one cleanup with the interrupt flag cleared, so teardown of external
     * resources still happens while a cancelled run unwinds. Errors are logged
     * and do not change the run outcome.
     */
    private void runCleanup(PendingCleanup cleanup, StageContext context) {
        String owner = cleanup.owner().name();
        boolean interrupted = Thread.interrupted();
        try {
            log.info("Running cleanup of stage '{}'", owner);
            cleanup.owner().cleanup().release(context);
        } catch (RuntimeException e) {
            log.warn("Cleanup of stage '{}' failed, manual cleanup may be needed: {}", owner, e.getMessage(), e);
        } finally {
            if (interrupted) Thread.currentThread().interrupt();
        }
    }
}
