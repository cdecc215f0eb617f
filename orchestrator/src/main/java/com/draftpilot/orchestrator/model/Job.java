package com.draftpilot.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * One content-generation job: the aggregate root.
 *
 * Phase results, quality evaluations, approval records and cost ledger rows
 * all reference a Job by id and are removed with it by the database cascade.
 * Soft delete only stamps {@code deletedAt}; everything stays in place for
 * billing.
 *
 * DB table: jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "jobs")
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String topic;

    private String style;

    private String tone;

    // Target article length in words.
    @Column(name = "target_length", nullable = false)
    private int targetLength;

    // Phase name -> backend id, e.g. {"DRAFT": "claude-3-opus"}. May be empty.
    @Convert(converter = StringMapConverter.class)
    @Column(name = "models_by_phase", nullable = false, columnDefinition = "TEXT")
    private Map<String, String> modelsByPhase = new LinkedHashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "quality_preference", nullable = false)
    private QualityPreference qualityPreference = QualityPreference.BALANCED;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.PENDING;

    @Column(nullable = false)
    private int progress = 0;

    // Refinement rounds completed so far; the current draft round is this + 1.
    @Column(name = "refinement_round", nullable = false)
    private int refinementRound = 0;

    // Rejections that were re-queued for another refinement.
    @Column(name = "rejection_count", nullable = false)
    private int rejectionCount = 0;

    // Claim token of the run currently executing this job; null when unclaimed.
    @Column(name = "claimed_by")
    private String claimedBy;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    @Column(name = "error_detail", columnDefinition = "TEXT")
    private String errorDetail;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Job() {}   // required by JPA

    public Job(String topic, String style, String tone, int targetLength,
               QualityPreference qualityPreference, Map<String, String> modelsByPhase) {
        this.topic             = topic;
        this.style             = style;
        this.tone              = tone;
        this.targetLength      = targetLength;
        this.qualityPreference = qualityPreference == null ? QualityPreference.BALANCED : qualityPreference;
        if (modelsByPhase != null) {
            this.modelsByPhase.putAll(modelsByPhase);
        }
    }

    // ------------------------------------------------------------------
    // Behaviour
    // ------------------------------------------------------------------

    /** Explicit backend id requested for a phase, if any. */
    public Optional<String> preferredBackend(PipelinePhase phase) {
        return Optional.ofNullable(modelsByPhase.get(phase.name()));
    }

    /** Moves to {@code next} and keeps the progress figure in step. */
    public void moveTo(JobStatus next) {
        this.status   = next;
        this.progress = next.progress();
    }

    public void claim(String token, Instant at) {
        this.claimedBy = token;
        this.claimedAt = at;
    }

    public void releaseClaim() {
        this.claimedBy = null;
        this.claimedAt = null;
    }

    public boolean isClaimedBy(String token) {
        return token != null && token.equals(claimedBy);
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    /** Draft round the job is working on (1-based). */
    public int currentRound() {
        return refinementRound + 1;
    }

    /** Refinement rounds started by failed quality checks; re-queued rejections don't count. */
    public int qualityRefinements() {
        return refinementRound - rejectionCount;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID              getId()                { return id; }
    public String            getTopic()             { return topic; }
    public String            getStyle()             { return style; }
    public String            getTone()              { return tone; }
    public int               getTargetLength()      { return targetLength; }
    public Map<String, String> getModelsByPhase()   { return modelsByPhase; }
    public QualityPreference getQualityPreference() { return qualityPreference; }
    public JobStatus         getStatus()            { return status; }
    public int               getProgress()          { return progress; }
    public int               getRefinementRound()   { return refinementRound; }
    public int               getRejectionCount()    { return rejectionCount; }
    public String            getClaimedBy()         { return claimedBy; }
    public Instant           getClaimedAt()         { return claimedAt; }
    public String            getErrorDetail()       { return errorDetail; }
    public Instant           getDeletedAt()         { return deletedAt; }
    public Instant           getCreatedAt()         { return createdAt; }
    public Instant           getUpdatedAt()         { return updatedAt; }

    public void setRefinementRound(int v)           { this.refinementRound = v; }
    public void setErrorDetail(String v)            { this.errorDetail = v; }
    public void setDeletedAt(Instant v)             { this.deletedAt = v; }
    public void incrementRejectionCount()           { this.rejectionCount++; }
}
