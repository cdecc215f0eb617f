package com.draftpilot.orchestrator.api.dto;

import com.draftpilot.orchestrator.model.QualityEvaluation;

import java.time.Instant;
import java.util.List;

public record EvaluationResponse(int round, double score, boolean passing, List<String> issues, Instant createdAt) {

    public static EvaluationResponse from(QualityEvaluation e) {
        return new EvaluationResponse(e.getRound(), e.getScore(), e.isPassing(), e.getIssues(), e.getCreatedAt());
    }
}
