package com.draftpilot.orchestrator.pipeline;

import com.draftpilot.orchestrator.model.JobStatus;

/**
 * A status change the transition table does not allow, e.g. approving a job
 * that is not awaiting approval or moving a terminal job.
 */
public class IllegalTransitionException extends RuntimeException {

    private final JobStatus from;
    private final JobStatus to;

    public IllegalTransitionException(JobStatus from, JobStatus to) {
        super("Illegal transition " + from + " -> " + to);
        this.from = from;
        this.to   = to;
    }

    public JobStatus from() { return from; }
    public JobStatus to()   { return to; }
}
