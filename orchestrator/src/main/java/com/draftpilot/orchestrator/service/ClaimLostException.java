package com.draftpilot.orchestrator.service;

import java.util.UUID;

/**
 * A run tried to write to a job it no longer owns: the deadline fired, the
 * claim was reaped as stale, or the job was deleted underneath it. The write
 * is discarded.
 */
public class ClaimLostException extends RuntimeException {

    private final UUID jobId;

    public ClaimLostException(UUID jobId, String reason) {
        super("Claim on job " + jobId + " lost: " + reason);
        this.jobId = jobId;
    }

    public UUID jobId() { return jobId; }
}
