package com.secpipe.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Persisted history of one pipeline run.
 *
 * The row is created QUEUED when a run is requested; its id is the run id the
 * executor logs and tags metrics with. Version, status and link are filled
 * in when the run finishes.
 *
 * DB table: pipeline_runs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "pipeline_runs")
public class RunRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunState state = RunState.QUEUED;

    // Resolved toggle map as a JSON object, e.g. {"sast":true,"notification":false}.
    @Column(name = "toggles_json", nullable = false, columnDefinition = "TEXT")
    private String togglesJson;

    @Column(nullable = false)
    private boolean cancelled = false;

    @Column(name = "report_version")
    private Integer reportVersion;

    @Column(name = "report_status")
    private String reportStatus;

    @Column(name = "report_link", columnDefinition = "TEXT")
    private String reportLink;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @OneToMany(mappedBy = "run", cascade = CascadeType.ALL, fetch = FetchType.LAZY)
    @OrderBy("position ASC")
    private List<StageRecord> stages = new ArrayList<>();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected RunRecord() {}   // required by JPA

    public RunRecord(String togglesJson) {
        this.togglesJson = togglesJson;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID              getId()            { return id; }
    public RunState          getState()         { return state; }
    public String            getTogglesJson()   { return togglesJson; }
    public boolean           isCancelled()      { return cancelled; }
    public Integer           getReportVersion() { return reportVersion; }
    public String            getReportStatus()  { return reportStatus; }
    public String            getReportLink()    { return reportLink; }
    public Instant           getCreatedAt()     { return createdAt; }
    public Instant           getStartedAt()     { return startedAt; }
    public Instant           getFinishedAt()    { return finishedAt; }
    public Instant           getUpdatedAt()     { return updatedAt; }
    public List<StageRecord> getStages()        { return stages; }

    public void setState(RunState state)          { this.state = state; }
    public void setCancelled(boolean cancelled)   { this.cancelled = cancelled; }
    public void setReportVersion(Integer v)       { this.reportVersion = v; }
    public void setReportStatus(String v)         { this.reportStatus = v; }
    public void setReportLink(String v)           { this.reportLink = v; }
    public void setStartedAt(Instant t)           { this.startedAt = t; }
    public void setFinishedAt(Instant t)          { this.finishedAt = t; }
}
