package com.draftpilot.orchestrator.quality;

import java.util.List;

/**
 * Result of one quality evaluation.
 *
 * @param score   0-100
 * @param passing whether {@code score} reached the configured threshold
 * @param issues  human-readable problems; fed back into the next refinement round
 */
public record QualityVerdict(double score, boolean passing, List<String> issues) {

    public QualityVerdict {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("score must be within 0-100 (was " + score + ")");
        }
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
