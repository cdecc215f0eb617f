package com.draftpilot.orchestrator.repository;

import com.draftpilot.orchestrator.model.PhaseResult;
import com.draftpilot.orchestrator.model.PipelinePhase;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface PhaseResultRepository extends JpaRepository<PhaseResult, UUID> {

    /** Full trail for a job, in the order phases finished. */
    List<PhaseResult> findByJobIdOrderByCreatedAtAsc(UUID jobId);

    /** Latest successful output of a phase, e.g. the newest draft. */
    Optional<PhaseResult> findFirstByJobIdAndPhaseAndSucceededTrueOrderByCreatedAtDesc(UUID jobId, PipelinePhase phase);
}
