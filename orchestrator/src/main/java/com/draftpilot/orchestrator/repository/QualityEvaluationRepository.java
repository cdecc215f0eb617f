package com.draftpilot.orchestrator.repository;

import com.draftpilot.orchestrator.model.QualityEvaluation;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface QualityEvaluationRepository extends JpaRepository<QualityEvaluation, UUID> {

    List<QualityEvaluation> findByJobIdOrderByRoundAsc(UUID jobId);
}
