package com.draftpilot.orchestrator.service;

import com.draftpilot.orchestrator.model.*;
import com.draftpilot.orchestrator.pipeline.IllegalTransitionException;
import com.draftpilot.orchestrator.pipeline.JobStateMachine;
import com.draftpilot.orchestrator.repository.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * {@link JobStore} on Spring Data JPA.
 *
 * Guarded writes lock the job row first ({@code SELECT ... FOR UPDATE}), so a
 * deadline or reaper releasing the claim and a late write from the run are
 * serialised; whichever commits second sees the other's result.
 */
@Service
public class JpaJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(JpaJobStore.class);

    private final JobRepository               jobRepo;
    private final PhaseResultRepository       phaseRepo;
    private final QualityEvaluationRepository evaluationRepo;
    private final ApprovalRecordRepository    approvalRepo;
    private final CostLedgerRepository        ledgerRepo;
    private final Clock                       clock;

    public JpaJobStore(JobRepository jobRepo,
                       PhaseResultRepository phaseRepo,
                       QualityEvaluationRepository evaluationRepo,
                       ApprovalRecordRepository approvalRepo,
                       CostLedgerRepository ledgerRepo,
                       Clock clock) {
        this.jobRepo        = jobRepo;
        this.phaseRepo      = phaseRepo;
        this.evaluationRepo = evaluationRepo;
        this.approvalRepo   = approvalRepo;
        this.ledgerRepo     = ledgerRepo;
        this.clock          = clock;
    }

    @Override
    @Transactional
    public Job save(Job job) {
        return jobRepo.save(job);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Job> find(UUID jobId) {
        return jobRepo.findByIdAndDeletedAtIsNull(jobId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Job> findIncludingDeleted(UUID jobId) {
        return jobRepo.findById(jobId);
    }

    // ------------------------------------------------------------------
    // Executor
    // ------------------------------------------------------------------

    /**
     * SELECT ... FOR UPDATE SKIP LOCKED, then stamp the claim token; both in
     * this transaction, so two overlapping cycles never claim the same row.
     */
    @Override
    @Transactional
    public List<Job> claimDispatchable(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<String> statuses = JobStatus.dispatchable().stream()
                .map(Enum::name)
                .collect(Collectors.toList());
        List<Job> jobs = jobRepo.lockClaimable(statuses, limit);
        Instant now = clock.instant();
        for (Job job : jobs) {
            job.claim(UUID.randomUUID().toString(), now);
        }
        return jobRepo.saveAll(jobs);
    }

    @Override
    @Transactional
    public void releaseClaim(UUID jobId, String claimToken) {
        jobRepo.findByIdForUpdate(jobId)
                .filter(job -> job.isClaimedBy(claimToken))
                .ifPresent(Job::releaseClaim);
    }

    @Override
    @Transactional
    public boolean markTimedOut(UUID jobId, String claimToken, long durationMs, String detail) {
        Optional<Job> locked = jobRepo.findByIdForUpdate(jobId);
        if (locked.isEmpty() || !locked.get().isClaimedBy(claimToken) || locked.get().getStatus().isTerminal()) {
            return false;
        }
        Job job = locked.get();
        if (!JobStateMachine.canTransition(job.getStatus(), JobStatus.TIMED_OUT)) {
            // Run already parked the job at the approval gate.
            job.releaseClaim();
            return false;
        }
        JobStateMachine.phaseFor(job.getStatus()).ifPresent(phase ->
                phaseRepo.save(PhaseResult.failed(jobId, phase, job.currentRound(), null, durationMs, detail)));
        job.moveTo(JobStatus.TIMED_OUT);
        job.setErrorDetail(detail);
        job.releaseClaim();
        return true;
    }

    @Override
    @Transactional
    public int releaseStaleClaims(Instant cutoff) {
        List<Job> stale = jobRepo.findByClaimedByIsNotNullAndClaimedAtBefore(cutoff);
        for (Job job : stale) {
            log.warn("Releasing stale claim on job {} (status={}, claimedAt={})",
                    job.getId(), job.getStatus(), job.getClaimedAt());
            job.releaseClaim();
        }
        return stale.size();
    }

    // ------------------------------------------------------------------
    // Pipeline
    // ------------------------------------------------------------------

    @Override
    @Transactional
    public Job transition(UUID jobId, String claimToken, JobStatus from, JobStatus to) {
        Job job = lockOwned(jobId, claimToken, from);
        JobStateMachine.requireTransition(from, to);
        job.moveTo(to);
        return job;
    }

    @Override
    @Transactional
    public Job recordPhase(UUID jobId, String claimToken, PhaseCompletion completion) {
        Job job = lockOwned(jobId, claimToken, completion.expectedStatus());
        JobStateMachine.requireTransition(job.getStatus(), completion.nextStatus());

        PhaseResult result = phaseRepo.save(completion.result());
        if (completion.ledgerEntry() != null) {
            CostLedgerEntry entry = completion.ledgerEntry();
            entry.linkTo(result.getId());
            ledgerRepo.save(entry);
        }
        if (completion.evaluation() != null) {
            evaluationRepo.save(completion.evaluation());
        }
        job.setRefinementRound(completion.refinementRound());
        job.moveTo(completion.nextStatus());
        return job;
    }

    @Override
    @Transactional
    public Job recordFailure(UUID jobId, String claimToken, PhaseResult failure, String errorDetail) {
        Job job = lockOwned(jobId, claimToken, null);
        JobStateMachine.requireTransition(job.getStatus(), JobStatus.FAILED);
        if (failure != null) {
            phaseRepo.save(failure);
        }
        job.setErrorDetail(errorDetail);
        job.moveTo(JobStatus.FAILED);
        return job;
    }

    // ------------------------------------------------------------------
    // Approval / admin
    // ------------------------------------------------------------------

    @Override
    @Transactional
    public Job recordDecision(UUID jobId, ApprovalDecision decision, String reviewer, String feedback,
                              boolean requeueOnRejection, int maxRejectionRequeues) {
        Job job = jobRepo.findByIdForUpdate(jobId)
                .filter(j -> !j.isDeleted())
                .orElseThrow(() -> new JobNotFoundException(jobId));

        JobStatus next = JobStateMachine.afterDecision(
                decision, job.getRejectionCount(), requeueOnRejection, maxRejectionRequeues);
        if (job.getStatus() != JobStatus.AWAITING_APPROVAL) {
            throw new IllegalTransitionException(job.getStatus(), next);
        }
        JobStateMachine.requireTransition(job.getStatus(), next);

        int round = approvalRepo.findByJobIdOrderByApprovalRoundAsc(jobId).size() + 1;
        approvalRepo.save(new ApprovalRecord(jobId, round, decision, reviewer, feedback));

        if (next == JobStatus.REFINING) {
            // The re-queued draft gets a fresh round so its evaluation does not collide.
            job.incrementRejectionCount();
            job.setRefinementRound(job.getRefinementRound() + 1);
        }
        job.moveTo(next);
        return job;
    }

    @Override
    @Transactional
    public Job softDelete(UUID jobId) {
        Job job = jobRepo.findByIdForUpdate(jobId)
                .filter(j -> !j.isDeleted())
                .orElseThrow(() -> new JobNotFoundException(jobId));
        job.setDeletedAt(clock.instant());
        return job;
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @Override
    @Transactional(readOnly = true)
    public List<PhaseResult> phaseResults(UUID jobId) {
        return phaseRepo.findByJobIdOrderByCreatedAtAsc(jobId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<PhaseResult> latestSuccessful(UUID jobId, PipelinePhase phase) {
        return phaseRepo.findFirstByJobIdAndPhaseAndSucceededTrueOrderByCreatedAtDesc(jobId, phase);
    }

    @Override
    @Transactional(readOnly = true)
    public List<QualityEvaluation> evaluations(UUID jobId) {
        return evaluationRepo.findByJobIdOrderByRoundAsc(jobId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ApprovalRecord> approvals(UUID jobId) {
        return approvalRepo.findByJobIdOrderByApprovalRoundAsc(jobId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<CostLedgerEntry> ledger(UUID jobId) {
        return ledgerRepo.findByJobIdOrderByCreatedAtAsc(jobId);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Lock the job and check the run still owns it.
     *
     * @param expectedStatus status the job must be in; null to skip the check
     */
    private Job lockOwned(UUID jobId, String claimToken, JobStatus expectedStatus) {
        Job job = jobRepo.findByIdForUpdate(jobId)
                .orElseThrow(() -> new JobNotFoundException(jobId));
        if (!job.isClaimedBy(claimToken)) {
            throw new ClaimLostException(jobId, "claimed by " + job.getClaimedBy());
        }
        if (job.isDeleted()) {
            throw new ClaimLostException(jobId, "job was deleted");
        }
        if (expectedStatus != null && job.getStatus() != expectedStatus) {
            throw new ClaimLostException(jobId, "status is " + job.getStatus() + ", expected " + expectedStatus);
        }
        return job;
    }
}
