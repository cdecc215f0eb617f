package com.draftpilot.orchestrator.model;

import jakarta.persistence.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Score and verdict of one quality-check round. Written once, never changed.
 *
 * DB table: quality_evaluations  (created by Flyway V1 migration)
 */
@Entity
@Immutable
@Table(name = "quality_evaluations",
       uniqueConstraints = @UniqueConstraint(columnNames = {"job_id", "round"}))
public class QualityEvaluation {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(nullable = false, updatable = false)
    private int round;

    // 0-100
    @Column(nullable = false, updatable = false)
    private double score;

    @Column(nullable = false, updatable = false)
    private boolean passing;

    @Convert(converter = StringListConverter.class)
    @Column(nullable = false, columnDefinition = "TEXT", updatable = false)
    private List<String> issues = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected QualityEvaluation() {}   // required by JPA

    public QualityEvaluation(UUID jobId, int round, double score, boolean passing, List<String> issues) {
        this.jobId   = jobId;
        this.round   = round;
        this.score   = score;
        this.passing = passing;
        if (issues != null) {
            this.issues.addAll(issues);
        }
    }

    public UUID         getId()        { return id; }
    public UUID         getJobId()     { return jobId; }
    public int          getRound()     { return round; }
    public double       getScore()     { return score; }
    public boolean      isPassing()    { return passing; }
    public List<String> getIssues()    { return issues; }
    public Instant      getCreatedAt() { return createdAt; }
}
