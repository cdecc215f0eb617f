package com.draftpilot.orchestrator.service;

import com.draftpilot.orchestrator.model.*;
import com.draftpilot.orchestrator.provider.Backend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Job submission and the read side used by the REST API.
 *
 * Submission only writes a PENDING row; the executor picks it up on its next
 * poll cycle.
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    static final int DEFAULT_TARGET_LENGTH = 1000;

    private final JobStore store;

    public JobService(JobStore store) {
        this.store = store;
    }

    // ------------------------------------------------------------------
    // Job submission
    // ------------------------------------------------------------------

    /**
     * Create a PENDING job.
     *
     * @param targetLength  target words; {@value #DEFAULT_TARGET_LENGTH} when null
     * @param modelsByPhase optional phase name to backend id overrides
     * @throws IllegalArgumentException on an unknown phase or backend id
     */
    public Job submit(String topic, String style, String tone, Integer targetLength,
                      QualityPreference preference, Map<String, String> modelsByPhase) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic must not be blank");
        }
        int length = targetLength == null ? DEFAULT_TARGET_LENGTH : targetLength;
        if (length <= 0) {
            throw new IllegalArgumentException("targetLength must be positive (was " + length + ")");
        }

        Job job = store.save(new Job(topic.trim(), style, tone, length, preference, normalise(modelsByPhase)));
        log.info("Job {} submitted: topic='{}', quality={}, models={}",
                job.getId(), job.getTopic(), job.getQualityPreference(), job.getModelsByPhase());
        return job;
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    public Optional<Job> findById(UUID id) {
        return store.find(id);
    }

    public List<PhaseResult> getPhases(UUID jobId) {
        requireLive(jobId);
        return store.phaseResults(jobId);
    }

    public List<QualityEvaluation> getEvaluations(UUID jobId) {
        requireLive(jobId);
        return store.evaluations(jobId);
    }

    public List<ApprovalRecord> getApprovals(UUID jobId) {
        requireLive(jobId);
        return store.approvals(jobId);
    }

    // ------------------------------------------------------------------
    // Admin
    // ------------------------------------------------------------------

    /** Hide the job and stop further dispatch; its history and costs stay. */
    public Job softDelete(UUID jobId) {
        Job job = store.softDelete(jobId);
        log.info("Job {} soft-deleted at status {}", jobId, job.getStatus());
        return job;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void requireLive(UUID jobId) {
        if (store.find(jobId).isEmpty()) {
            throw new JobNotFoundException(jobId);
        }
    }

    /** Upper-cases phase keys and checks both sides against the known phases and backends. */
    static Map<String, String> normalise(Map<String, String> modelsByPhase) {
        Map<String, String> result = new LinkedHashMap<>();
        if (modelsByPhase == null) {
            return result;
        }
        modelsByPhase.forEach((phaseName, backendId) -> {
            PipelinePhase phase;
            try {
                phase = PipelinePhase.valueOf(phaseName.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown phase '" + phaseName + "'", e);
            }
            Backend backend = Backend.fromId(backendId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown backend '" + backendId + "'"));
            result.put(phase.name(), backend.id());
        });
        return result;
    }
}
