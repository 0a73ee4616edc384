package com.secpipe.orchestrator.pipeline;

import com.secpipe.orchestrator.correlate.VersionRecord;
import com.secpipe.orchestrator.publish.PublishedLink;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * One execution of the stage graph.
 *
 * Stage results are appended in declaration order while the run is live and
 * the outcome is set exactly once when it ends. Only the executor mutates it.
 */
public class PipelineRun {

    private final UUID                 id;
    private final Map<String, Boolean> toggles;
    private final Instant              startedAt;
    private final List<StageResult>    results = new ArrayList<>();

    private RunOutcome    outcome;
    private Instant       finishedAt;
    private boolean       cancelled;
    private VersionRecord versionRecord;
    private PublishedLink publishedLink;

    PipelineRun(UUID id, Map<String, Boolean> toggles, Instant startedAt) {
        this.id        = id;
        this.toggles   = Map.copyOf(toggles);
        this.startedAt = startedAt;
    }

    public UUID                 getId()          { return id; }
    public Map<String, Boolean> getToggles()     { return toggles; }
    public Instant              getStartedAt()   { return startedAt; }
    public Instant              getFinishedAt()  { return finishedAt; }
    public RunOutcome           getOutcome()     { return outcome; }
    public boolean              isCancelled()    { return cancelled; }
    public List<StageResult>    getResults()     { return Collections.unmodifiableList(results); }

    public Optional<VersionRecord> getVersionRecord() { return Optional.ofNullable(versionRecord); }
    public Optional<PublishedLink> getPublishedLink() { return Optional.ofNullable(publishedLink); }

    public boolean isFinished() {
        return outcome != null;
    }

    public boolean hasHardFailure() {
        return results.stream().anyMatch(r -> r.outcome() == StageOutcome.HARD_FAIL);
    }

    public Optional<StageResult> result(String stageName) {
        return results.stream().filter(r -> r.name().equals(stageName)).findFirst();
    }

    void append(StageResult result) {
        if (isFinished()) throw new IllegalStateException("Run " + id + " is already finished");
        results.add(result);
    }

    void markCancelled() {
        this.cancelled = true;
    }

    void finish(RunOutcome outcome, Instant at) {
        if (isFinished()) throw new IllegalStateException("Run " + id + " is already finished");
        this.outcome    = outcome;
        this.finishedAt = at;
    }

    void setVersionRecord(VersionRecord versionRecord) {
        this.versionRecord = versionRecord;
    }

    void setPublishedLink(PublishedLink publishedLink) {
        this.publishedLink = publishedLink;
    }
}
