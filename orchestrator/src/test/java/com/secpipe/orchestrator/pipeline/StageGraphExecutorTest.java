package com.secpipe.orchestrator.pipeline;

import com.secpipe.orchestrator.artifact.ArtifactStore;
import com.secpipe.orchestrator.correlate.ReportStatus;
import com.secpipe.orchestrator.correlate.VersionRecord;
import com.secpipe.orchestrator.tool.ToolInterruptedException;
import com.secpipe.orchestrator.tool.ToolLaunchException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the stage loop: enablement, classification, cleanup
 * scheduling, cancellation and metrics. Stage actions are lambdas that
 * record what ran.
 */
class StageGraphExecutorTest {

    @TempDir Path tmp;

    SimpleMeterRegistry meters;
    StageGraphExecutor  executor;
    List<String>        executed;

    @BeforeEach
    void setUp() {
        meters   = new SimpleMeterRegistry();
        executor = new StageGraphExecutor(new ArtifactStore(tmp), meters,
                Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC));
        executed = new ArrayList<>();
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    // ------------------------------------------------------------------
    // Enablement
    // ------------------------------------------------------------------

    @Test
    void run_disabledStage_isSkippedWithoutInvocationOrCleanup() {
        AtomicInteger cleanups = new AtomicInteger();
        executor.configure(List.of(
                StageDescriptor.always("prepare", true, exiting("prepare", 0)),
                StageDescriptor.toggled("sast", "sast", false, exiting("sast", 0))
                        .withCleanup(ctx -> cleanups.incrementAndGet(), "sast")
        ), Map.of("sast", false));

        PipelineRun run = executor.run();

        assertThat(executed).containsExactly("prepare");
        assertThat(cleanups).hasValue(0);
        StageResult sast = run.result("sast").orElseThrow();
        assertThat(sast.outcome()).isEqualTo(StageOutcome.SKIPPED);
        assertThat(sast.enabled()).isFalse();
        assertThat(sast.exitCode()).isNull();
        assertThat(sast.artifacts()).isEmpty();
        assertThat(run.getOutcome()).isEqualTo(RunOutcome.SUCCESS);
    }

    @Test
    void run_toggleAbsentFromMap_countsAsDisabled() {
        executor.configure(List.of(
                StageDescriptor.toggled("sast", "sast", false, exiting("sast", 0))
        ), Map.of());

        PipelineRun run = executor.run();

        assertThat(executed).isEmpty();
        assertThat(run.result("sast").orElseThrow().outcome()).isEqualTo(StageOutcome.SKIPPED);
    }

    // ------------------------------------------------------------------
    // Classification
    // ------------------------------------------------------------------

    @Test
    void run_softFailure_continuesAndRunSucceeds() {
        executor.configure(List.of(
                StageDescriptor.toggled("sast", "sast", false, exiting("sast", 1)),
                StageDescriptor.always("correlate", false, exiting("correlate", 0))
        ), Map.of("sast", true));

        PipelineRun run = executor.run();

        assertThat(executed).containsExactly("sast", "correlate");
        assertThat(run.result("sast").orElseThrow().outcome()).isEqualTo(StageOutcome.SOFT_FAIL);
        assertThat(run.result("sast").orElseThrow().exitCode()).isEqualTo(1);
        assertThat(run.getOutcome()).isEqualTo(RunOutcome.SUCCESS);
    }

    @Test
    void run_hardFailure_stopsAndRunFails() {
        executor.configure(List.of(
                StageDescriptor.always("prepare", true, exiting("prepare", 0)),
                StageDescriptor.toggled("image-build", "image-build", true, exiting("image-build", 2)),
                StageDescriptor.toggled("dast-scan", "dast-scan", false, exiting("dast-scan", 0)),
                StageDescriptor.always("correlate", false, exiting("correlate", 0))
        ), Map.of("image-build", true, "dast-scan", true));

        PipelineRun run = executor.run();

        assertThat(executed).containsExactly("prepare", "image-build");
        assertThat(run.getResults()).extracting(StageResult::name).containsExactly("prepare", "image-build");
        assertThat(run.result("image-build").orElseThrow().outcome()).isEqualTo(StageOutcome.HARD_FAIL);
        assertThat(run.getOutcome()).isEqualTo(RunOutcome.FAILURE);
        assertThat(run.isFinished()).isTrue();
    }

    @Test
    void run_actionThrows_countsAsExitOne() {
        executor.configure(List.of(
                StageDescriptor.always("correlate", false, ctx -> { throw new IllegalStateException("boom"); }),
                StageDescriptor.always("after", false, exiting("after", 0))
        ), Map.of());

        PipelineRun run = executor.run();

        StageResult result = run.result("correlate").orElseThrow();
        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.outcome()).isEqualTo(StageOutcome.SOFT_FAIL);
        assertThat(result.detail()).contains("boom");
        assertThat(executed).containsExactly("after");
    }

    @Test
    void run_toolCannotLaunch_countsAsExit127() {
        executor.configure(List.of(
                StageDescriptor.always("prepare", true, ctx -> {
                    throw new ToolLaunchException("Could not launch 'bandit'", null);
                })
        ), Map.of());

        PipelineRun run = executor.run();

        assertThat(run.result("prepare").orElseThrow().exitCode()).isEqualTo(ToolLaunchException.EXIT_CODE);
        assertThat(run.getOutcome()).isEqualTo(RunOutcome.FAILURE);
    }

    // ------------------------------------------------------------------
    // Cleanups
    // ------------------------------------------------------------------

    @Test
    void run_cleanupRunsOnceAfterReleaseStage() {
        List<String> order = new ArrayList<>();
        executor.configure(List.of(
                StageDescriptor.toggled("dast-deploy", "dast-deploy", false, ctx -> {
                    order.add("deploy");
                    return ActionResult.ok();
                }).withCleanup(ctx -> order.add("release"), "dast-scan"),
                StageDescriptor.toggled("dast-scan", "dast-scan", false, ctx -> {
                    order.add("scan");
                    return ActionResult.ok();
                }),
                StageDescriptor.always("correlate", false, ctx -> {
                    order.add("correlate");
                    return ActionResult.ok();
                })
        ), Map.of("dast-deploy", true, "dast-scan", true));

        executor.run();

        assertThat(order).containsExactly("deploy", "scan", "release", "correlate");
    }

    @Test
    void run_releaseStageSkipped_cleanupStillRunsWhenPassed() {
        List<String> order = new ArrayList<>();
        executor.configure(List.of(
                StageDescriptor.toggled("dast-deploy", "dast-deploy", false, ctx -> ActionResult.ok())
                        .withCleanup(ctx -> order.add("release"), "dast-scan"),
                StageDescriptor.toggled("dast-scan", "dast-scan", false, ctx -> ActionResult.ok()),
                StageDescriptor.always("correlate", false, ctx -> {
                    order.add("correlate");
                    return ActionResult.ok();
                })
        ), Map.of("dast-deploy", true, "dast-scan", false));

        executor.run();

        assertThat(order).containsExactly("release", "correlate");
    }

    @Test
    void run_usingStageHardFails_resourceReleasedExactlyOnce() {
        AtomicInteger releases = new AtomicInteger();
        executor.configure(List.of(
                StageDescriptor.toggled("dast-deploy", "dast-deploy", false, exiting("dast-deploy", 0))
                        .withCleanup(ctx -> releases.incrementAndGet(), "dast-scan"),
                StageDescriptor.toggled("dast-scan", "dast-scan", true, exiting("dast-scan", 3)),
                StageDescriptor.always("correlate", false, exiting("correlate", 0))
        ), Map.of("dast-deploy", true, "dast-scan", true));

        PipelineRun run = executor.run();

        assertThat(releases).hasValue(1);
        assertThat(run.getOutcome()).isEqualTo(RunOutcome.FAILURE);
        assertThat(executed).doesNotContain("correlate");
    }

    @Test
    void run_hardFailBeforeReleaseStage_finaliserReleases() {
        AtomicInteger releases = new AtomicInteger();
        executor.configure(List.of(
                StageDescriptor.toggled("dast-deploy", "dast-deploy", false, exiting("dast-deploy", 0))
                        .withCleanup(ctx -> releases.incrementAndGet(), "dast-scan"),
                StageDescriptor.always("gate", true, exiting("gate", 1)),
                StageDescriptor.toggled("dast-scan", "dast-scan", false, exiting("dast-scan", 0))
        ), Map.of("dast-deploy", true, "dast-scan", true));

        executor.run();

        assertThat(releases).hasValue(1);
        assertThat(executed).containsExactly("dast-deploy", "gate");
    }

    @Test
    void run_failingCleanup_isLoggedAndOutcomeUnchanged() {
        executor.configure(List.of(
                StageDescriptor.always("prepare", false, exiting("prepare", 0))
                        .withCleanup(ctx -> { throw new IllegalStateException("docker gone"); }, "prepare"),
                StageDescriptor.always("correlate", false, exiting("correlate", 0))
        ), Map.of());

        PipelineRun run = executor.run();

        assertThat(run.getOutcome()).isEqualTo(RunOutcome.SUCCESS);
        assertThat(executed).containsExactly("prepare", "correlate");
    }

    @Test
    void run_pendingCleanups_runInReverseRegistrationOrder() {
        List<String> order = new ArrayList<>();
        executor.configure(List.of(
                StageDescriptor.always("a", false, ctx -> ActionResult.ok())
                        .withCleanup(ctx -> order.add("release-a"), "z"),
                StageDescriptor.always("b", false, ctx -> ActionResult.ok())
                        .withCleanup(ctx -> order.add("release-b"), "z"),
                StageDescriptor.always("stop", true, ctx -> ActionResult.failed(1, "stop")),
                StageDescriptor.always("z", false, ctx -> ActionResult.ok())
        ), Map.of());

        executor.run();

        assertThat(order).containsExactly("release-b", "release-a");
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    @Test
    void run_interruptedDuringStage_stopsAndStillReleases() {
        AtomicInteger releases = new AtomicInteger();
        executor.configure(List.of(
                StageDescriptor.toggled("dast-deploy", "dast-deploy", false, ctx -> ActionResult.ok())
                        .withCleanup(ctx -> releases.incrementAndGet(), "dast-scan"),
                StageDescriptor.toggled("dast-scan", "dast-scan", false, ctx -> {
                    throw new ToolInterruptedException("Interrupted while waiting for 'docker'", null);
                }),
                StageDescriptor.always("correlate", false, exiting("correlate", 0))
        ), Map.of("dast-deploy", true, "dast-scan", true));

        PipelineRun run = executor.run();

        assertThat(run.isCancelled()).isTrue();
        assertThat(run.getOutcome()).isEqualTo(RunOutcome.FAILURE);
        assertThat(releases).hasValue(1);
        assertThat(executed).doesNotContain("correlate");
    }

    @Test
    void run_interruptFlagSetBetweenStages_cancelsBeforeNextStage() {
        executor.configure(List.of(
                StageDescriptor.always("first", false, ctx -> {
                    executed.add("first");
                    Thread.currentThread().interrupt();
                    return ActionResult.ok();
                }),
                StageDescriptor.always("second", false, exiting("second", 0))
        ), Map.of());

        PipelineRun run = executor.run();

        assertThat(executed).containsExactly("first");
        assertThat(run.isCancelled()).isTrue();
        assertThat(run.getOutcome()).isEqualTo(RunOutcome.FAILURE);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    // ------------------------------------------------------------------
    // Shared context
    // ------------------------------------------------------------------

    @Test
    void stampVersion_computedOnceAndVisibleOnRun() {
        AtomicInteger computations = new AtomicInteger();
        StageAction stamp = ctx -> {
            ctx.stampVersion(() -> new VersionRecord(computations.incrementAndGet(), ReportStatus.PASS, Instant.EPOCH));
            return ActionResult.ok();
        };
        executor.configure(List.of(
                StageDescriptor.always("correlate", false, stamp),
                StageDescriptor.always("notification", false, stamp)
        ), Map.of());

        PipelineRun run = executor.run();

        assertThat(computations).hasValue(1);
        assertThat(run.getVersionRecord()).hasValueSatisfying(v -> assertThat(v.version()).isEqualTo(1));
    }

    // ------------------------------------------------------------------
    // configure() validation
    // ------------------------------------------------------------------

    @Test
    void configure_unknownToggle_isRejected() {
        assertThatThrownBy(() -> executor.configure(List.of(
                StageDescriptor.toggled("sast", "sast", false, exiting("sast", 0))
        ), Map.of("sats", true)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sats");
    }

    @Test
    void configure_duplicateStageName_isRejected() {
        assertThatThrownBy(() -> executor.configure(List.of(
                StageDescriptor.always("prepare", true, exiting("prepare", 0)),
                StageDescriptor.always("prepare", true, exiting("prepare", 0))
        ), Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    void configure_releaseAfterEarlierStage_isRejected() {
        assertThatThrownBy(() -> executor.configure(List.of(
                StageDescriptor.always("a", false, exiting("a", 0)),
                StageDescriptor.always("b", false, exiting("b", 0)).withCleanup(ctx -> { }, "a")
        ), Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("releases after 'a'");
    }

    @Test
    void run_beforeConfigure_isRejected() {
        assertThatThrownBy(() -> executor.run()).isInstanceOf(IllegalStateException.class);
    }

    // ------------------------------------------------------------------
    // Metrics
    // ------------------------------------------------------------------

    @Test
    void run_recordsDurationAndOutcomePerStage() {
        executor.configure(List.of(
                StageDescriptor.toggled("sast", "sast", false, exiting("sast", 1)),
                StageDescriptor.toggled("notification", "notification", false, exiting("notification", 0))
        ), Map.of("sast", true, "notification", false));

        executor.run();

        assertThat(meters.get("secpipe.stage.duration").tag("stage", "sast").timer().count()).isEqualTo(1);
        assertThat(meters.find("secpipe.stage.duration").tag("stage", "notification").timer()).isNull();
        assertThat(meters.get("secpipe.stage.outcomes")
                .tags("stage", "sast", "outcome", "soft_fail").counter().count()).isEqualTo(1.0);
        assertThat(meters.get("secpipe.stage.outcomes")
                .tags("stage", "notification", "outcome", "skipped").counter().count()).isEqualTo(1.0);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private StageAction exiting(String name, int exitCode) {
        return ctx -> {
            executed.add(name);
            return exitCode == 0 ? ActionResult.ok() : ActionResult.failed(exitCode, name + " exited " + exitCode);
        };
    }
}
