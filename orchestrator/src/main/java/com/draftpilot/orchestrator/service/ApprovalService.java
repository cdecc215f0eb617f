package com.draftpilot.orchestrator.service;

import com.draftpilot.orchestrator.config.PipelineProperties;
import com.draftpilot.orchestrator.model.ApprovalDecision;
import com.draftpilot.orchestrator.model.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * The human gate. Only writer of approval records and of the transitions out
 * of AWAITING_APPROVAL.
 *
 * Approve moves the job to APPROVED; the executor then publishes it. Reject
 * archives the job as REJECTED, or sends it back to REFINING when re-queueing
 * is enabled and the job has re-queues left.
 */
@Service
public class ApprovalService {

    private static final Logger log = LoggerFactory.getLogger(ApprovalService.class);

    private final JobStore           store;
    private final PipelineProperties properties;

    public ApprovalService(JobStore store, PipelineProperties properties) {
        this.store      = store;
        this.properties = properties;
    }

    public Job approve(UUID jobId, String reviewer, String feedback) {
        return decide(jobId, ApprovalDecision.APPROVED, reviewer, feedback);
    }

    public Job reject(UUID jobId, String reviewer, String feedback) {
        return decide(jobId, ApprovalDecision.REJECTED, reviewer, feedback);
    }

    /**
     * @throws JobNotFoundException if the job does not exist or was deleted
     * @throws com.draftpilot.orchestrator.pipeline.IllegalTransitionException
     *         if the job is not awaiting approval
     */
    public Job decide(UUID jobId, ApprovalDecision decision, String reviewer, String feedback) {
        if (reviewer == null || reviewer.isBlank()) {
            throw new IllegalArgumentException("reviewer must not be blank");
        }
        Job job = store.recordDecision(jobId, decision, reviewer, feedback,
                properties.requeueOnRejection(), properties.maxRejectionRequeues());
        log.info("Job {} {} by {} -> {}", jobId, decision, reviewer, job.getStatus());
        return job;
    }
}
