package com.draftpilot.orchestrator.model;

import jakarta.persistence.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * The human decision taken at the approval gate.
 *
 * One record per visit to AWAITING_APPROVAL; {@code approvalRound} counts the
 * visits, so a job that was rejected and re-queued carries one REJECTED record
 * per earlier round and at most one APPROVED record.
 *
 * DB table: approval_records  (created by Flyway V1 migration)
 */
@Entity
@Immutable
@Table(name = "approval_records",
       uniqueConstraints = @UniqueConstraint(columnNames = {"job_id", "approval_round"}))
public class ApprovalRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(name = "approval_round", nullable = false, updatable = false)
    private int approvalRound;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private ApprovalDecision decision;

    @Column(nullable = false, updatable = false)
    private String reviewer;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String feedback;

    @Column(name = "decided_at", nullable = false, updatable = false)
    private Instant decidedAt = Instant.now();

    protected ApprovalRecord() {}   // required by JPA

    public ApprovalRecord(UUID jobId, int approvalRound, ApprovalDecision decision,
                          String reviewer, String feedback) {
        this.jobId         = jobId;
        this.approvalRound = approvalRound;
        this.decision      = decision;
        this.reviewer      = reviewer;
        this.feedback      = feedback;
    }

    public UUID             getId()            { return id; }
    public UUID             getJobId()         { return jobId; }
    public int              getApprovalRound() { return approvalRound; }
    public ApprovalDecision getDecision()      { return decision; }
    public String           getReviewer()      { return reviewer; }
    public String           getFeedback()      { return feedback; }
    public Instant          getDecidedAt()     { return decidedAt; }
}
