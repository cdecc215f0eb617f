package com.draftpilot.orchestrator.quality;

/**
 * Scores a draft. Implementations must be side-effect free; the pipeline
 * persists the verdict itself.
 */
public interface QualityEvaluator {

    QualityVerdict evaluate(String content, StyleProfile profile);
}
