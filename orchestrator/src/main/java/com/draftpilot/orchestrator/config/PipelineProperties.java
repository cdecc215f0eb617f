package com.draftpilot.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Pipeline policy ({@code draftpilot.pipeline.*}).
 *
 * @param maxRefinementRounds  quality-check failures that may send a draft back for refinement;
 *                             once reached, the best-effort draft moves on to formatting
 * @param qualityThreshold     score (0-100) a draft needs to pass the quality check
 * @param requeueOnRejection   whether a rejected job goes back to refinement instead of being archived
 * @param maxRejectionRequeues how many rejections may be re-queued per job
 * @param maxOutputTokens      token cap passed to every generation call
 */
@ConfigurationProperties(prefix = "draftpilot.pipeline")
public record PipelineProperties(
        @DefaultValue("2")     int     maxRefinementRounds,
        @DefaultValue("70")    double  qualityThreshold,
        @DefaultValue("false") boolean requeueOnRejection,
        @DefaultValue("1")     int     maxRejectionRequeues,
        @DefaultValue("4096")  int     maxOutputTokens
) {}
