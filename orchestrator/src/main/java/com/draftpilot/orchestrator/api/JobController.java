package com.draftpilot.orchestrator.api;

import com.draftpilot.orchestrator.api.dto.*;
import com.draftpilot.orchestrator.model.ApprovalDecision;
import com.draftpilot.orchestrator.model.Job;
import com.draftpilot.orchestrator.model.QualityPreference;
import com.draftpilot.orchestrator.service.*;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * REST API for job lifecycle.
 *
 * POST   /jobs                    submit a new content job
 * GET    /jobs/{id}               current status and progress
 * GET    /jobs/{id}/phases        every phase result, in order
 * GET    /jobs/{id}/evaluations   quality evaluations per round
 * GET    /jobs/{id}/cost          cost breakdown from the ledger
 * POST   /jobs/{id}/approval      approve or reject a job awaiting approval
 * DELETE /jobs/{id}               soft delete
 * GET    /jobs/cost-estimate      up-front estimate for a quality preference
 */
@RestController
@RequestMapping("/jobs")
public class JobController {

    private final JobService        jobService;
    private final ApprovalService   approvalService;
    private final CostReportService costReportService;

    public JobController(JobService jobService,
                         ApprovalService approvalService,
                         CostReportService costReportService) {
        this.jobService        = jobService;
        this.approvalService   = approvalService;
        this.costReportService = costReportService;
    }

    /**
     * Submit a new content job.
     *
     * Example:
     *   curl -X POST http://localhost:8080/jobs \
     *     -H "Content-Type: application/json" \
     *     -d '{"topic":"Connection pooling in practice","quality":"balanced","targetLength":1200}'
     */
    @PostMapping
    public ResponseEntity<JobResponse> submit(@Valid @RequestBody SubmitJobRequest req) {
        Job job = jobService.submit(req.topic(), req.style(), req.tone(), req.targetLength(),
                QualityPreference.fromValue(req.quality()), req.modelsByPhase());
        return ResponseEntity.status(HttpStatus.CREATED).body(JobResponse.from(job));
    }

    @GetMapping("/{id}")
    public JobResponse getJob(@PathVariable UUID id) {
        return jobService.findById(id)
                .map(JobResponse::from)
                .orElseThrow(() -> new JobNotFoundException(id));
    }

    @GetMapping("/{id}/phases")
    public List<PhaseResultResponse> getPhases(@PathVariable UUID id) {
        return jobService.getPhases(id).stream()
                .map(PhaseResultResponse::from)
                .toList();
    }

    @GetMapping("/{id}/evaluations")
    public List<EvaluationResponse> getEvaluations(@PathVariable UUID id) {
        return jobService.getEvaluations(id).stream()
                .map(EvaluationResponse::from)
                .toList();
    }

    /** Includes soft-deleted jobs: their spend is still billable. */
    @GetMapping("/{id}/cost")
    public CostBreakdown getCost(@PathVariable UUID id) {
        return costReportService.breakdown(id);
    }

    /**
     * HTTP 200 with the job after the decision
     * HTTP 404 unknown or deleted job
     * HTTP 409 job is not awaiting approval
     */
    @PostMapping("/{id}/approval")
    public JobResponse decide(@PathVariable UUID id, @Valid @RequestBody ApprovalRequest req) {
        ApprovalDecision decision = parseDecision(req.decision());
        Job job = approvalService.decide(id, decision, req.reviewer(), req.feedback());
        return JobResponse.from(job);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        jobService.softDelete(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/cost-estimate")
    public CostEstimate estimate(@RequestParam(name = "quality", required = false) String quality) {
        return costReportService.estimate(QualityPreference.fromValue(quality));
    }

    private static ApprovalDecision parseDecision(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "approve", "approved"  -> ApprovalDecision.APPROVED;
            case "reject", "rejected"   -> ApprovalDecision.REJECTED;
            default -> throw new IllegalArgumentException("decision must be 'approved' or 'rejected'");
        };
    }
}
