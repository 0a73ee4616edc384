package com.secpipe.orchestrator.model;

import com.secpipe.orchestrator.pipeline.StageOutcome;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One stage result of a finished run, stored in declaration order.
 *
 * DB table: stage_results  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "stage_results")
public class StageRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "run_id", nullable = false)
    private RunRecord run;

    // Index in the stage table; skipped stages are stored too.
    @Column(nullable = false)
    private int position;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private boolean enabled;

    // Null for skipped stages.
    @Column(name = "exit_code")
    private Integer exitCode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StageOutcome outcome;

    @Column(columnDefinition = "TEXT")
    private String detail;

    // JSON array of {name, kind, exists}.
    @Column(name = "artifacts_json", columnDefinition = "TEXT")
    private String artifactsJson;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "duration_ms", nullable = false)
    private long durationMs;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected StageRecord() {}   // required by JPA

    public StageRecord(RunRecord run, int position, String name, boolean enabled, Integer exitCode,
                       StageOutcome outcome, String detail, String artifactsJson,
                       Instant startedAt, long durationMs) {
        this.run           = run;
        this.position      = position;
        this.name          = name;
        this.enabled       = enabled;
        this.exitCode      = exitCode;
        this.outcome       = outcome;
        this.detail        = detail;
        this.artifactsJson = artifactsJson;
        this.startedAt     = startedAt;
        this.durationMs    = durationMs;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID         getId()            { return id; }
    public RunRecord    getRun()           { return run; }
    public int          getPosition()      { return position; }
    public String       getName()          { return name; }
    public boolean      isEnabled()        { return enabled; }
    public Integer      getExitCode()      { return exitCode; }
    public StageOutcome getOutcome()       { return outcome; }
    public String       getDetail()        { return detail; }
    public String       getArtifactsJson() { return artifactsJson; }
    public Instant      getStartedAt()     { return startedAt; }
    public long         getDurationMs()    { return durationMs; }
}
