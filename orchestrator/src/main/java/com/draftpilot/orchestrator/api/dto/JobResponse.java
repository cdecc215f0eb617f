package com.draftpilot.orchestrator.api.dto;

import com.draftpilot.orchestrator.model.Job;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Response body for POST /jobs and GET /jobs/{id}.
 */
public record JobResponse(
        UUID                id,
        String              status,
        int                 progress,
        String              topic,
        String              style,
        String              tone,
        int                 targetLength,
        String              quality,
        Map<String, String> modelsByPhase,
        int                 refinementRound,
        int                 rejectionCount,
        String              errorDetail,
        Instant             createdAt,
        Instant             updatedAt
) {
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.getId(),
                job.getStatus().name(),
                job.getProgress(),
                job.getTopic(),
                job.getStyle(),
                job.getTone(),
                job.getTargetLength(),
                job.getQualityPreference().name(),
                Map.copyOf(job.getModelsByPhase()),
                job.getRefinementRound(),
                job.getRejectionCount(),
                job.getErrorDetail(),
                job.getCreatedAt(),
                job.getUpdatedAt()
        );
    }
}
