package com.draftpilot.orchestrator.pipeline;

import com.draftpilot.orchestrator.model.ApprovalDecision;
import com.draftpilot.orchestrator.model.JobStatus;
import com.draftpilot.orchestrator.model.PipelinePhase;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.draftpilot.orchestrator.model.JobStatus.*;

/**
 * Authoritative transition table for {@link JobStatus}.
 *
 * <pre>
 * PENDING           → RESEARCHING
 * RESEARCHING       → DRAFTING
 * DRAFTING          → QUALITY_CHECKING
 * QUALITY_CHECKING  → REFINING | FORMATTING
 * REFINING          → QUALITY_CHECKING
 * FORMATTING        → AWAITING_APPROVAL
 * AWAITING_APPROVAL → APPROVED | REFINING | REJECTED     (approval action only)
 * APPROVED          → PUBLISHED
 * </pre>
 * Every non-terminal status may also go to FAILED; every status the executor
 * runs may go to TIMED_OUT. Terminal statuses go nowhere.
 */
public final class JobStateMachine {

    private static final Map<JobStatus, Set<JobStatus>> TRANSITIONS = new EnumMap<>(JobStatus.class);

    static {
        TRANSITIONS.put(PENDING,           EnumSet.of(RESEARCHING, FAILED, TIMED_OUT));
        TRANSITIONS.put(RESEARCHING,       EnumSet.of(DRAFTING, FAILED, TIMED_OUT));
        TRANSITIONS.put(DRAFTING,          EnumSet.of(QUALITY_CHECKING, FAILED, TIMED_OUT));
        TRANSITIONS.put(QUALITY_CHECKING,  EnumSet.of(REFINING, FORMATTING, FAILED, TIMED_OUT));
        TRANSITIONS.put(REFINING,          EnumSet.of(QUALITY_CHECKING, FAILED, TIMED_OUT));
        TRANSITIONS.put(FORMATTING,        EnumSet.of(AWAITING_APPROVAL, FAILED, TIMED_OUT));
        TRANSITIONS.put(AWAITING_APPROVAL, EnumSet.of(APPROVED, REFINING, REJECTED, FAILED));
        TRANSITIONS.put(APPROVED,          EnumSet.of(PUBLISHED, FAILED, TIMED_OUT));
        TRANSITIONS.put(PUBLISHED,         EnumSet.noneOf(JobStatus.class));
        TRANSITIONS.put(REJECTED,          EnumSet.noneOf(JobStatus.class));
        TRANSITIONS.put(FAILED,            EnumSet.noneOf(JobStatus.class));
        TRANSITIONS.put(TIMED_OUT,         EnumSet.noneOf(JobStatus.class));
    }

    private JobStateMachine() {}

    public static boolean canTransition(JobStatus from, JobStatus to) {
        return TRANSITIONS.get(from).contains(to);
    }

    /** @throws IllegalTransitionException if the table has no such edge */
    public static void requireTransition(JobStatus from, JobStatus to) {
        if (!canTransition(from, to)) {
            throw new IllegalTransitionException(from, to);
        }
    }

    /**
     * Phase the executor runs next for a job in {@code status}; empty when the
     * job is waiting on a human or finished.
     */
    public static Optional<PipelinePhase> phaseFor(JobStatus status) {
        return switch (status) {
            case PENDING, RESEARCHING -> Optional.of(PipelinePhase.RESEARCH);
            case DRAFTING, REFINING   -> Optional.of(PipelinePhase.DRAFT);
            case QUALITY_CHECKING     -> Optional.of(PipelinePhase.QUALITY_CHECK);
            case FORMATTING           -> Optional.of(PipelinePhase.FORMAT);
            case APPROVED             -> Optional.of(PipelinePhase.PUBLISH);
            default                   -> Optional.empty();
        };
    }

    /** Status after a successful phase that does not branch. */
    public static JobStatus afterPhase(PipelinePhase phase) {
        return switch (phase) {
            case RESEARCH      -> DRAFTING;
            case DRAFT         -> QUALITY_CHECKING;
            case FORMAT        -> AWAITING_APPROVAL;
            case PUBLISH       -> PUBLISHED;
            case QUALITY_CHECK -> throw new IllegalArgumentException("QUALITY_CHECK branches, use afterQualityCheck");
        };
    }

    /**
     * Refine while the draft fails and rounds remain; otherwise move on with
     * the best-effort draft.
     */
    public static JobStatus afterQualityCheck(boolean passing, int refinementRound, int maxRefinementRounds) {
        if (!passing && refinementRound < maxRefinementRounds) {
            return REFINING;
        }
        return FORMATTING;
    }

    /**
     * Status after a human decision at the approval gate.
     *
     * @param rejectionCount rejections already re-queued for this job
     */
    public static JobStatus afterDecision(ApprovalDecision decision, int rejectionCount,
                                          boolean requeueOnRejection, int maxRejectionRequeues) {
        if (decision == ApprovalDecision.APPROVED) {
            return APPROVED;
        }
        if (requeueOnRejection && rejectionCount < maxRejectionRequeues) {
            return REFINING;
        }
        return REJECTED;
    }
}
