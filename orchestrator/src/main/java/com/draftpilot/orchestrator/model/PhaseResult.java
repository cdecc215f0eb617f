package com.draftpilot.orchestrator.model;

import jakarta.persistence.*;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Output and bookkeeping of one phase execution.
 *
 * Append-only: a retried or refined phase adds a new row, earlier rows stay
 * for audit and cost accounting. {@code content} is opaque to the
 * orchestrator; only the quality evaluator and the next phase read it.
 *
 * DB table: phase_results  (created by Flyway V1 migration)
 */
@Entity
@Immutable
@Table(name = "phase_results")
public class PhaseResult {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private PipelinePhase phase;

    // Draft round this result belongs to (1-based).
    @Column(nullable = false, updatable = false)
    private int round;

    // Backend id, or the local component name for phases that make no LLM call.
    @Column(updatable = false)
    private String backend;

    @Column(name = "cost_estimate", nullable = false, precision = 12, scale = 6, updatable = false)
    private BigDecimal costEstimate = BigDecimal.ZERO;

    @Column(name = "duration_ms", nullable = false, updatable = false)
    private long durationMs;

    @Column(nullable = false, updatable = false)
    private boolean succeeded;

    @Column(name = "error_detail", columnDefinition = "TEXT", updatable = false)
    private String errorDetail;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String content;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected PhaseResult() {}   // required by JPA

    private PhaseResult(UUID jobId, PipelinePhase phase, int round, String backend,
                        BigDecimal costEstimate, long durationMs, boolean succeeded,
                        String errorDetail, String content) {
        this.jobId        = jobId;
        this.phase        = phase;
        this.round        = round;
        this.backend      = backend;
        this.costEstimate = costEstimate == null ? BigDecimal.ZERO : costEstimate;
        this.durationMs   = durationMs;
        this.succeeded    = succeeded;
        this.errorDetail  = errorDetail;
        this.content      = content;
    }

    public static PhaseResult succeeded(UUID jobId, PipelinePhase phase, int round, String backend,
                                        BigDecimal cost, long durationMs, String content) {
        return new PhaseResult(jobId, phase, round, backend, cost, durationMs, true, null, content);
    }

    public static PhaseResult failed(UUID jobId, PipelinePhase phase, int round, String backend,
                                     long durationMs, String errorDetail) {
        return new PhaseResult(jobId, phase, round, backend, BigDecimal.ZERO, durationMs, false, errorDetail, null);
    }

    public UUID          getId()           { return id; }
    public UUID          getJobId()        { return jobId; }
    public PipelinePhase getPhase()        { return phase; }
    public int           getRound()        { return round; }
    public String        getBackend()      { return backend; }
    public BigDecimal    getCostEstimate() { return costEstimate; }
    public long          getDurationMs()   { return durationMs; }
    public boolean       isSucceeded()     { return succeeded; }
    public String        getErrorDetail()  { return errorDetail; }
    public String        getContent()      { return content; }
    public Instant       getCreatedAt()    { return createdAt; }
}
