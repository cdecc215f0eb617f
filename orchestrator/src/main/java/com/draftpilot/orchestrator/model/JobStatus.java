package com.draftpilot.orchestrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status of a content job.
 *
 * Happy path:
 * <pre>
 * PENDING → RESEARCHING → DRAFTING → QUALITY_CHECKING ⇄ REFINING → FORMATTING
 *         → AWAITING_APPROVAL → APPROVED → PUBLISHED
 * </pre>
 *
 * {@code AWAITING_APPROVAL} is the human gate: it only moves on through the
 * approval service. PUBLISHED, REJECTED, FAILED and TIMED_OUT are terminal.
 * The legal moves live in {@code JobStateMachine}.
 *
 * Each status carries the progress percentage reported to callers.
 */
public enum JobStatus {
    PENDING(0),
    RESEARCHING(10),
    DRAFTING(30),
    QUALITY_CHECKING(50),
    REFINING(55),
    FORMATTING(75),
    AWAITING_APPROVAL(90),
    APPROVED(95),
    PUBLISHED(100),
    REJECTED(100),
    FAILED(100),
    TIMED_OUT(100);

    private static final Set<JobStatus> TERMINAL =
            EnumSet.of(PUBLISHED, REJECTED, FAILED, TIMED_OUT);

    // Statuses the executor may claim. AWAITING_APPROVAL is deliberately absent.
    private static final Set<JobStatus> DISPATCHABLE =
            EnumSet.of(PENDING, RESEARCHING, DRAFTING, QUALITY_CHECKING, REFINING, FORMATTING, APPROVED);

    private final int progress;

    JobStatus(int progress) {
        this.progress = progress;
    }

    public int progress() { return progress; }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean isDispatchable() {
        return DISPATCHABLE.contains(this);
    }

    public static Set<JobStatus> dispatchable() {
        return EnumSet.copyOf(DISPATCHABLE);
    }
}
