package com.draftpilot.orchestrator.service;

import com.draftpilot.orchestrator.model.ApprovalDecision;
import com.draftpilot.orchestrator.model.ApprovalRecord;
import com.draftpilot.orchestrator.model.CostLedgerEntry;
import com.draftpilot.orchestrator.model.Job;
import com.draftpilot.orchestrator.model.JobStatus;
import com.draftpilot.orchestrator.model.PhaseResult;
import com.draftpilot.orchestrator.model.PipelinePhase;
import com.draftpilot.orchestrator.model.QualityEvaluation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence seam between the pipeline/executor and the database.
 *
 * Every write that belongs to a run takes the run's claim token and is
 * rejected with {@link ClaimLostException} when the job is no longer claimed
 * by that token. Each method is one transaction.
 */
public interface JobStore {

    Job save(Job job);

    /** Live (not soft-deleted) job. */
    Optional<Job> find(UUID jobId);

    Optional<Job> findIncludingDeleted(UUID jobId);

    // ------------------------------------------------------------------
    // Executor
    // ------------------------------------------------------------------

    /**
     * Claim up to {@code limit} dispatchable jobs, oldest first. Each returned
     * job carries a fresh claim token in {@link Job#getClaimedBy()}.
     */
    List<Job> claimDispatchable(int limit);

    /** Release the claim if {@code claimToken} still holds it; no-op otherwise. */
    void releaseClaim(UUID jobId, String claimToken);

    /**
     * Deadline hit: append a failed phase result, move to TIMED_OUT and release
     * the claim.
     *
     * @return false when the run had already lost the claim or the job was already terminal
     */
    boolean markTimedOut(UUID jobId, String claimToken, long durationMs, String detail);

    /** Release claims taken before {@code cutoff}. Returns how many were released. */
    int releaseStaleClaims(Instant cutoff);

    // ------------------------------------------------------------------
    // Pipeline
    // ------------------------------------------------------------------

    /** Status-only move, e.g. PENDING to RESEARCHING when a run starts. */
    Job transition(UUID jobId, String claimToken, JobStatus from, JobStatus to);

    /** Commit a successful phase: result, ledger row, evaluation and next status. */
    Job recordPhase(UUID jobId, String claimToken, PhaseCompletion completion);

    /** Append the failed phase result and move the job to FAILED. */
    Job recordFailure(UUID jobId, String claimToken, PhaseResult failure, String errorDetail);

    // ------------------------------------------------------------------
    // Approval / admin
    // ------------------------------------------------------------------

    /**
     * Record a human decision on a job in AWAITING_APPROVAL and apply the
     * resulting transition.
     *
     * @throws JobNotFoundException           if the job is missing or deleted
     * @throws com.draftpilot.orchestrator.pipeline.IllegalTransitionException
     *                                        if the job is not awaiting approval
     */
    Job recordDecision(UUID jobId, ApprovalDecision decision, String reviewer, String feedback,
                       boolean requeueOnRejection, int maxRejectionRequeues);

    /** @throws JobNotFoundException if the job is missing or already deleted */
    Job softDelete(UUID jobId);

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    List<PhaseResult> phaseResults(UUID jobId);

    Optional<PhaseResult> latestSuccessful(UUID jobId, PipelinePhase phase);

    List<QualityEvaluation> evaluations(UUID jobId);

    List<ApprovalRecord> approvals(UUID jobId);

    List<CostLedgerEntry> ledger(UUID jobId);
}
