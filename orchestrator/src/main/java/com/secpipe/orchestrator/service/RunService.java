package com.secpipe.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.secpipe.orchestrator.artifact.ArtifactRef;
import com.secpipe.orchestrator.config.PipelineProperties;
import com.secpipe.orchestrator.model.RunRecord;
import com.secpipe.orchestrator.model.RunState;
import com.secpipe.orchestrator.model.StageRecord;
import com.secpipe.orchestrator.pipeline.PipelineRun;
import com.secpipe.orchestrator.pipeline.RunOutcome;
import com.secpipe.orchestrator.pipeline.StageResult;
import com.secpipe.orchestrator.repository.RunRecordRepository;
import com.secpipe.orchestrator.repository.StageRecordRepository;
import com.secpipe.orchestrator.stage.StandardStages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Run history: creating run records, tracking their state and storing the
 * finished {@link PipelineRun} with its stage results.
 */
@Service
public class RunService {

    private static final Logger log = LoggerFactory.getLogger(RunService.class);

    private static final TypeReference<Map<String, Boolean>> TOGGLE_MAP = new TypeReference<>() {};

    private final RunRecordRepository   runRepo;
    private final StageRecordRepository stageRepo;
    private final PipelineProperties    props;
    private final ObjectMapper          objectMapper;
    private final Clock                 clock;

    public RunService(RunRecordRepository runRepo,
                      StageRecordRepository stageRepo,
                      PipelineProperties props,
                      ObjectMapper objectMapper,
                      Clock clock) {
        this.runRepo      = runRepo;
        this.stageRepo    = stageRepo;
        this.props        = props;
        this.objectMapper = objectMapper;
        this.clock        = clock;
    }

    // ------------------------------------------------------------------
    // Run creation
    // ------------------------------------------------------------------

    /**
     * Create a QUEUED run.
     *
     * @param overrides toggle values for this run only, may be {@code null}
     * @throws IllegalArgumentException if a toggle name is unknown
     */
    @Transactional
    public RunRecord create(Map<String, Boolean> overrides) {
        Map<String, Boolean> toggles = resolveToggles(overrides);
        RunRecord run = runRepo.save(new RunRecord(writeJson(toggles)));
        log.info("Run {} queued with toggles {}", run.getId(), toggles);
        return run;
    }

    /**
     * Full toggle map of a run: every known toggle off, then the configured
     * defaults, then the per-run overrides.
     */
    public Map<String, Boolean> resolveToggles(Map<String, Boolean> overrides) {
        Set<String> known = StandardStages.toggleNames();
        Map<String, Boolean> toggles = new LinkedHashMap<>();
        known.forEach(name -> toggles.put(name, false));
        merge(toggles, props.toggles(), known, "configured");
        merge(toggles, overrides, known, "requested");
        return toggles;
    }

    @Transactional(readOnly = true)
    public Map<String, Boolean> toggles(UUID runId) {
        RunRecord run = runRepo.findById(runId).orElseThrow(() -> notFound(runId));
        try {
            return objectMapper.readValue(run.getTogglesJson(), TOGGLE_MAP);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt toggle map on run " + runId, e);
        }
    }

    // ------------------------------------------------------------------
    // State transitions
    // ------------------------------------------------------------------

    @Transactional
    public void markRunning(UUID runId) {
        RunRecord run = runRepo.findById(runId).orElseThrow(() -> notFound(runId));
        run.setState(RunState.RUNNING);
        run.setStartedAt(clock.instant());
        runRepo.save(run);
    }

    /**
     * Store the finished run: final state, version, status, link and one
     * stage row per result in declaration order.
     */
    @Transactional
    public RunRecord complete(PipelineRun pipelineRun) {
        UUID runId = pipelineRun.getId();
        RunRecord run = runRepo.findById(runId).orElseThrow(() -> notFound(runId));

        run.setState(pipelineRun.getOutcome() == RunOutcome.SUCCESS ? RunState.SUCCESS : RunState.FAILURE);
        run.setCancelled(pipelineRun.isCancelled());
        run.setFinishedAt(pipelineRun.getFinishedAt());
        pipelineRun.getVersionRecord().ifPresent(v -> {
            run.setReportVersion(v.version());
            run.setReportStatus(v.status().name());
        });
        pipelineRun.getPublishedLink().ifPresent(link -> run.setReportLink(link.url()));

        List<StageResult> results = pipelineRun.getResults();
        for (int i = 0; i < results.size(); i++) {
            StageResult r = results.get(i);
            stageRepo.save(new StageRecord(run, i, r.name(), r.enabled(), r.exitCode(), r.outcome(),
                    r.detail(), writeJson(artifactView(r.artifacts())), r.startedAt(),
                    r.duration().toMillis()));
        }
        log.info("Run {} stored as {} ({} stages)", runId, run.getState(), results.size());
        return runRepo.save(run);
    }

    /** Close a run that never reached the executor's own bookkeeping. */
    @Transactional
    public void markFailed(UUID runId, boolean cancelled) {
        runRepo.findById(runId).ifPresent(run -> {
            if (run.getState().isTerminal()) return;
            run.setState(RunState.FAILURE);
            run.setCancelled(cancelled);
            run.setFinishedAt(clock.instant());
            runRepo.save(run);
            log.warn("Run {} marked FAILURE{}", runId, cancelled ? " (cancelled)" : "");
        });
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Optional<RunRecord> findById(UUID id) {
        return runRepo.findById(id);
    }

    @Transactional(readOnly = true)
    public List<StageRecord> getStages(UUID runId) {
        return stageRepo.findByRunIdOrderByPositionAsc(runId);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void merge(Map<String, Boolean> target, Map<String, Boolean> source,
                              Set<String> known, String origin) {
        if (source == null) return;
        source.forEach((name, enabled) -> {
            if (!known.contains(name)) {
                throw new IllegalArgumentException("Unknown " + origin + " toggle '" + name
                        + "', known toggles: " + known);
            }
            target.put(name, Boolean.TRUE.equals(enabled));
        });
    }

    private static List<Map<String, Object>> artifactView(List<ArtifactRef> artifacts) {
        return artifacts.stream()
                .map(a -> Map.<String, Object>of(
                        "name",   a.name(),
                        "kind",   a.kind().name(),
                        "exists", a.exists()))
                .toList();
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }

    private static IllegalStateException notFound(UUID runId) {
        return new IllegalStateException("Run not found: " + runId);
    }
}
