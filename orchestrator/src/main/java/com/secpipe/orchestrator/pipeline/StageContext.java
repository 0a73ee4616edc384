package com.secpipe.orchestrator.pipeline;

import com.secpipe.orchestrator.artifact.ArtifactRef;
import com.secpipe.orchestrator.artifact.ArtifactStore;
import com.secpipe.orchestrator.correlate.VersionRecord;
import com.secpipe.orchestrator.publish.PublishedLink;
import com.secpipe.orchestrator.resource.EphemeralResource;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * State shared by the stages of one run.
 *
 * Stages hand results to later stages only through this object; nothing here
 * survives the run. A stage must not assume another stage's output is present.
 */
public class StageContext {

    private final PipelineRun   run;
    private final ArtifactStore artifacts;

    private String            testOutput;
    private EphemeralResource deployment;

    StageContext(PipelineRun run, ArtifactStore artifacts) {
        this.run       = run;
        this.artifacts = artifacts;
    }

    public UUID runId() {
        return run.getId();
    }

    public ArtifactStore artifacts() {
        return artifacts;
    }

    public Map<String, Boolean> toggles() {
        return run.getToggles();
    }

    /** Results of the stages finished so far, in declaration order. */
    public List<StageResult> results() {
        return run.getResults();
    }

    /** Existing artifacts produced by the stages finished so far, without duplicates. */
    public List<ArtifactRef> producedArtifacts() {
        return run.getResults().stream()
                .flatMap(r -> r.artifacts().stream())
                .filter(ArtifactRef::exists)
                .distinct()
                .toList();
    }

    // ------------------------------------------------------------------
    // Test output (written by the unit-test stage of this run)
    // ------------------------------------------------------------------

    public Optional<String> testOutput() {
        return Optional.ofNullable(testOutput);
    }

    public void recordTestOutput(String output) {
        this.testOutput = output;
    }

    // ------------------------------------------------------------------
    // Version record: computed once, reused by every later stage
    // ------------------------------------------------------------------

    public Optional<VersionRecord> versionRecord() {
        return run.getVersionRecord();
    }

    /** Return the run's version record, computing it with {@code compute} on first use only. */
    public VersionRecord stampVersion(Supplier<VersionRecord> compute) {
        return run.getVersionRecord().orElseGet(() -> {
            VersionRecord record = compute.get();
            run.setVersionRecord(record);
            return record;
        });
    }

    // ------------------------------------------------------------------
    // Published link
    // ------------------------------------------------------------------

    public Optional<PublishedLink> publishedLink() {
        return run.getPublishedLink();
    }

    public void recordPublishedLink(PublishedLink link) {
        run.setPublishedLink(link);
    }

    // ------------------------------------------------------------------
    // Ephemeral deployment for dynamic scanning
    // ------------------------------------------------------------------

    public Optional<EphemeralResource> deployment() {
        return Optional.ofNullable(deployment);
    }

    public void recordDeployment(EphemeralResource resource) {
        this.deployment = resource;
    }

    /** Forget and return the deployment, so it is released by exactly one caller. */
    public Optional<EphemeralResource> takeDeployment() {
        Optional<EphemeralResource> current = Optional.ofNullable(deployment);
        deployment = null;
        return current;
    }
}
