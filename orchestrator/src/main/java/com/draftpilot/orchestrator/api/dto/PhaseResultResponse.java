package com.draftpilot.orchestrator.api.dto;

import com.draftpilot.orchestrator.model.PhaseResult;
import com.draftpilot.orchestrator.model.PipelinePhase;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of a phase result returned by GET /jobs/{id}/phases.
 */
public record PhaseResultResponse(
        UUID          id,
        PipelinePhase phase,
        int           round,
        String        backend,
        BigDecimal    costEstimate,
        long          durationMs,
        boolean       succeeded,
        String        errorDetail,
        String        content,
        Instant       createdAt
) {
    public static PhaseResultResponse from(PhaseResult r) {
        return new PhaseResultResponse(
                r.getId(),
                r.getPhase(),
                r.getRound(),
                r.getBackend(),
                r.getCostEstimate(),
                r.getDurationMs(),
                r.isSucceeded(),
                r.getErrorDetail(),
                r.getContent(),
                r.getCreatedAt()
        );
    }
}
