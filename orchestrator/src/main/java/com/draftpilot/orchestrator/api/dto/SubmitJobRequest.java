package com.draftpilot.orchestrator.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

import java.util.Map;

/**
 * Request body for POST /jobs.
 *
 * Required: topic
 * Optional: style, tone, targetLength (words, default 1000),
 *   quality ("fast" | "balanced" | "quality", default balanced),
 *   modelsByPhase (phase name to backend id, e.g. {"DRAFT": "claude-3-opus"}).
 */
public record SubmitJobRequest(
        @NotBlank String              topic,
        String                        style,
        String                        tone,
        @Positive Integer             targetLength,
        String                        quality,
        Map<String, String>           modelsByPhase
) {}
