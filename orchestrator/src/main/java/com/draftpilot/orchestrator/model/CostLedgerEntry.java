package com.draftpilot.orchestrator.model;

import jakarta.persistence.*;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One billed phase execution. Insert-only.
 *
 * {@code estimated} is true when the provider reported no token usage and the
 * static per-phase estimate was booked instead.
 *
 * DB table: cost_ledger  (created by Flyway V1 migration)
 */
@Entity
@Immutable
@Table(name = "cost_ledger")
public class CostLedgerEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(name = "phase_result_id", updatable = false)
    private UUID phaseResultId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private PipelinePhase phase;

    @Column(nullable = false, updatable = false)
    private String backend;

    @Column(nullable = false, updatable = false)
    private String provider;

    @Column(name = "input_tokens", updatable = false)
    private Integer inputTokens;

    @Column(name = "output_tokens", updatable = false)
    private Integer outputTokens;

    @Column(nullable = false, precision = 12, scale = 6, updatable = false)
    private BigDecimal cost;

    @Column(nullable = false, updatable = false)
    private boolean estimated;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected CostLedgerEntry() {}   // required by JPA

    public CostLedgerEntry(UUID jobId, PipelinePhase phase, String backend, String provider,
                           Integer inputTokens, Integer outputTokens, BigDecimal cost, boolean estimated) {
        this.jobId        = jobId;
        this.phase        = phase;
        this.backend      = backend;
        this.provider     = provider;
        this.inputTokens  = inputTokens;
        this.outputTokens = outputTokens;
        this.cost         = cost == null ? BigDecimal.ZERO : cost;
        this.estimated    = estimated;
    }

    /** Links the entry to the phase result it bills; set once, before insert. */
    public void linkTo(UUID phaseResultId) {
        if (this.id != null) {
            throw new IllegalStateException("Ledger entry " + id + " is already persisted");
        }
        this.phaseResultId = phaseResultId;
    }

    public int totalTokens() {
        return (inputTokens == null ? 0 : inputTokens) + (outputTokens == null ? 0 : outputTokens);
    }

    public UUID          getId()            { return id; }
    public UUID          getJobId()         { return jobId; }
    public UUID          getPhaseResultId() { return phaseResultId; }
    public PipelinePhase getPhase()         { return phase; }
    public String        getBackend()       { return backend; }
    public String        getProvider()      { return provider; }
    public Integer       getInputTokens()   { return inputTokens; }
    public Integer       getOutputTokens()  { return outputTokens; }
    public BigDecimal    getCost()          { return cost; }
    public boolean       isEstimated()      { return estimated; }
    public Instant       getCreatedAt()     { return createdAt; }
}
