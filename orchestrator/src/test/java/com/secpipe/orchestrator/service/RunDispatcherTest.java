package com.secpipe.orchestrator.service;

import com.secpipe.orchestrator.artifact.ArtifactStore;
import com.secpipe.orchestrator.pipeline.ActionResult;
import com.secpipe.orchestrator.pipeline.PipelineRun;
import com.secpipe.orchestrator.pipeline.RunOutcome;
import com.secpipe.orchestrator.pipeline.StageAction;
import com.secpipe.orchestrator.pipeline.StageDescriptor;
import com.secpipe.orchestrator.stage.StandardStages;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RunDispatcher's bookkeeping around a run. The stage table
 * is a mock returning lambda stages.
 */
@ExtendWith(MockitoExtension.class)
class RunDispatcherTest {

    @Mock RunService     runService;
    @Mock StandardStages stages;

    @TempDir Path reports;

    RunDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new RunDispatcher(runService, stages, new ArtifactStore(reports),
                new SimpleMeterRegistry(), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        dispatcher.shutdown();
    }

    @Test
    void execute_marksRunningThenStoresFinishedRun() {
        UUID id = UUID.randomUUID();
        when(runService.toggles(id)).thenReturn(Map.of());
        when(stages.descriptors()).thenReturn(List.of(
                StageDescriptor.always("prepare", true, ctx -> ActionResult.ok())));

        PipelineRun run = dispatcher.execute(id);

        assertThat(run.getId()).isEqualTo(id);
        assertThat(run.getOutcome()).isEqualTo(RunOutcome.SUCCESS);
        var order = inOrder(runService);
        order.verify(runService).markRunning(id);
        order.verify(runService).complete(run);
        verify(runService, never()).markFailed(any(), anyBoolean());
        assertThat(dispatcher.isActive(id)).isFalse();
    }

    @Test
    void execute_hardFailure_stillStoredAsFinishedRun() {
        UUID id = UUID.randomUUID();
        when(runService.toggles(id)).thenReturn(Map.of());
        when(stages.descriptors()).thenReturn(List.of(
                StageDescriptor.always("prepare", true, ctx -> ActionResult.failed(2, "workspace missing"))));

        PipelineRun run = dispatcher.execute(id);

        assertThat(run.getOutcome()).isEqualTo(RunOutcome.FAILURE);
        verify(runService).complete(run);
    }

    @Test
    void execute_setupError_marksRunFailedAndRethrows() {
        UUID id = UUID.randomUUID();
        when(runService.toggles(id)).thenThrow(new IllegalStateException("Corrupt toggle map on run " + id));

        assertThatThrownBy(() -> dispatcher.execute(id))
                .isInstanceOf(IllegalStateException.class);

        verify(runService).markFailed(id, false);
        verify(runService, never()).complete(any());
    }

    // ------------------------------------------------------------------
    // cancel()
    // ------------------------------------------------------------------

    @Test
    void cancel_queuedRun_closedOnceAndNeverExecuted() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(runService.toggles(any())).thenReturn(Map.of());
        when(stages.descriptors()).thenReturn(List.of(
                StageDescriptor.always("prepare", true, blockUntil(entered, release))));

        UUID running = UUID.randomUUID();
        UUID queued  = UUID.randomUUID();
        dispatcher.dispatch(running);
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        dispatcher.dispatch(queued);

        assertThat(dispatcher.cancel(queued)).isTrue();
        verify(runService).markFailed(queued, true);

        // The worker picking the task up right after the cancel must not claim it.
        assertThat(dispatcher.execute(queued)).isNull();
        release.countDown();

        verify(runService, timeout(5000)).complete(any());
        verify(runService, never()).toggles(queued);
        verify(runService, never()).markRunning(queued);
        verify(runService, times(1)).markFailed(queued, true);
    }

    @Test
    void cancel_runAlreadyStarted_leftToTheExecutorToClose() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(runService.toggles(any())).thenReturn(Map.of());
        when(stages.descriptors()).thenReturn(List.of(
                StageDescriptor.always("prepare", false, blockUntil(entered, release)),
                StageDescriptor.always("correlate", false, ctx -> ActionResult.ok())));

        UUID id = UUID.randomUUID();
        dispatcher.dispatch(id);
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(dispatcher.phase(id)).isEqualTo(RunDispatcher.Phase.RUNNING);

        assertThat(dispatcher.cancel(id)).isTrue();

        verify(runService, timeout(5000)).complete(argThat(run ->
                run.isCancelled() && run.getOutcome() == RunOutcome.FAILURE));
        verify(runService, never()).markFailed(any(), anyBoolean());
    }

    @Test
    void cancel_unknownRun_returnsFalse() {
        assertThat(dispatcher.cancel(UUID.randomUUID())).isFalse();
        verifyNoInteractions(runService);
    }

    /** Stage action that signals it started, then waits for the release latch or an interrupt. */
    private static StageAction blockUntil(CountDownLatch entered, CountDownLatch release) {
        return ctx -> {
            entered.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ActionResult.failed(130, "interrupted");
            }
            return ActionResult.ok();
        };
    }
}
