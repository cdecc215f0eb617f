package com.draftpilot.orchestrator.pipeline;

import com.draftpilot.orchestrator.config.PipelineProperties;
import com.draftpilot.orchestrator.model.*;
import com.draftpilot.orchestrator.provider.*;
import com.draftpilot.orchestrator.publishing.PublishPayload;
import com.draftpilot.orchestrator.publishing.PublishReceipt;
import com.draftpilot.orchestrator.publishing.PublishingTarget;
import com.draftpilot.orchestrator.quality.QualityEvaluator;
import com.draftpilot.orchestrator.quality.QualityVerdict;
import com.draftpilot.orchestrator.quality.StyleProfile;
import com.draftpilot.orchestrator.resilience.OperationCancelledException;
import com.draftpilot.orchestrator.resilience.RetryExecutor;
import com.draftpilot.orchestrator.resilience.RetryPolicy;
import com.draftpilot.orchestrator.resilience.ServiceCircuitBreakers;
import com.draftpilot.orchestrator.service.ClaimLostException;
import com.draftpilot.orchestrator.service.JobStore;
import com.draftpilot.orchestrator.service.PhaseCompletion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

/**
 * Drives one claimed job through its phases until it reaches the approval
 * gate or a terminal status.
 *
 * The job's status says which phase runs next ({@link JobStateMachine#phaseFor}).
 * A phase's result, ledger row, evaluation and the next status are committed
 * together, so a run that dies between phases resumes at the next one and
 * never repeats a persisted phase.
 *
 * Failure handling:
 * <pre>
 *   handler throws           → failed PhaseResult + FAILED
 *   ClaimLostException       → propagated; the run no longer owns the job
 *   interrupt / cancellation → propagated; the executor records TIMED_OUT
 * </pre>
 */
@Component
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    static final String EVALUATOR_NAME = "quality-evaluator";
    static final String CMS_SERVICE    = "cms";

    private final Map<PipelinePhase, PhaseHandler> handlers = new EnumMap<>(PipelinePhase.class);

    private final JobStore               store;
    private final ProviderRouter         router;
    private final QualityEvaluator       evaluator;
    private final PublishingTarget       publishingTarget;
    private final RetryExecutor          retryExecutor;
    private final ServiceCircuitBreakers breakers;
    private final RetryPolicy            publishingRetryPolicy;
    private final RetryPolicy            databaseRetryPolicy;
    private final PipelineProperties     properties;

    public PipelineOrchestrator(JobStore store,
                                ProviderRouter router,
                                QualityEvaluator evaluator,
                                PublishingTarget publishingTarget,
                                RetryExecutor retryExecutor,
                                ServiceCircuitBreakers breakers,
                                @Qualifier("publishingRetryPolicy") RetryPolicy publishingRetryPolicy,
                                @Qualifier("databaseRetryPolicy") RetryPolicy databaseRetryPolicy,
                                PipelineProperties properties) {
        this.store                 = store;
        this.router                = router;
        this.evaluator             = evaluator;
        this.publishingTarget      = publishingTarget;
        this.retryExecutor         = retryExecutor;
        this.breakers              = breakers;
        this.publishingRetryPolicy = publishingRetryPolicy;
        this.databaseRetryPolicy   = databaseRetryPolicy;
        this.properties            = properties;

        handlers.put(PipelinePhase.RESEARCH,      this::research);
        handlers.put(PipelinePhase.DRAFT,         this::draft);
        handlers.put(PipelinePhase.QUALITY_CHECK, this::qualityCheck);
        handlers.put(PipelinePhase.FORMAT,        this::format);
        handlers.put(PipelinePhase.PUBLISH,       this::publish);
    }

    // ------------------------------------------------------------------
    // Run loop
    // ------------------------------------------------------------------

    /**
     * Run {@code job} from its current status. The job must carry the run's
     * claim token in {@link Job#getClaimedBy()}.
     *
     * @return the job as last persisted
     */
    public Job run(Job job) {
        String claimToken = job.getClaimedBy();
        UUID   jobId      = job.getId();
        MDC.put("jobId", jobId.toString());
        try {
            Job current = job;
            if (current.getStatus() == JobStatus.PENDING) {
                current = write("transition", () ->
                        store.transition(jobId, claimToken, JobStatus.PENDING, JobStatus.RESEARCHING));
            }

            Optional<PipelinePhase> next = JobStateMachine.phaseFor(current.getStatus());
            while (next.isPresent()) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new OperationCancelledException("job " + jobId);
                }
                MDC.put("status", current.getStatus().name());
                current = runPhase(current, claimToken, next.get());
                next = JobStateMachine.phaseFor(current.getStatus());
            }

            log.info("Job {} stopped at {} (progress {}%)", jobId, current.getStatus(), current.getProgress());
            return current;
        } finally {
            MDC.remove("status");
            MDC.remove("jobId");
        }
    }

    private Job runPhase(Job job, String claimToken, PipelinePhase phase) {
        int   round   = job.currentRound();
        long  started = System.nanoTime();
        log.info("Job {}: {} round {} starting", job.getId(), phase, round);

        PhaseOutput output;
        try {
            output = handlers.get(phase).run(job);
        } catch (ClaimLostException | CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new OperationCancelledException("job " + job.getId(), e);
            }
            long durationMs = elapsedMs(started);
            String backend = e instanceof FatalProviderException fatal ? fatal.backend().id() : null;
            log.error("Job {}: {} round {} failed after {} ms: {}",
                    job.getId(), phase, round, durationMs, e.getMessage(), e);
            PhaseResult failure = PhaseResult.failed(job.getId(), phase, round, backend, durationMs, e.getMessage());
            return write("recordFailure", () ->
                    store.recordFailure(job.getId(), claimToken, failure, phase + " failed: " + e.getMessage()));
        }

        long durationMs = elapsedMs(started);
        PhaseCompletion completion = completionOf(job, phase, round, output, durationMs);
        Job saved = write("recordPhase", () -> store.recordPhase(job.getId(), claimToken, completion));
        log.info("Job {}: {} round {} done in {} ms via {} (cost {}), now {}",
                job.getId(), phase, round, durationMs, output.backend(), output.cost(), saved.getStatus());
        return saved;
    }

    private PhaseCompletion completionOf(Job job, PipelinePhase phase, int round,
                                         PhaseOutput output, long durationMs) {
        PhaseResult result = PhaseResult.succeeded(job.getId(), phase, round, output.backend(),
                output.cost(), durationMs, output.content());

        CostLedgerEntry ledger = null;
        if (output.generation() != null) {
            RoutedGeneration g = output.generation();
            TokenUsage usage = g.generation().usage();
            ledger = new CostLedgerEntry(job.getId(), phase, g.backend().id(),
                    g.backend().vendor().name().toLowerCase(),
                    usage == null ? null : usage.inputTokens(),
                    usage == null ? null : usage.outputTokens(),
                    g.cost(), g.estimated());
        }

        QualityEvaluation evaluation = null;
        JobStatus nextStatus;
        int refinementRound = job.getRefinementRound();
        if (phase == PipelinePhase.QUALITY_CHECK) {
            QualityVerdict verdict = output.verdict();
            evaluation = new QualityEvaluation(job.getId(), round, verdict.score(), verdict.passing(), verdict.issues());
            nextStatus = JobStateMachine.afterQualityCheck(
                    verdict.passing(), job.qualityRefinements(), properties.maxRefinementRounds());
            if (nextStatus == JobStatus.REFINING) {
                refinementRound++;
            } else if (!verdict.passing()) {
                log.warn("Job {}: refinement bound {} reached at score {}, formatting best-effort draft",
                        job.getId(), properties.maxRefinementRounds(), verdict.score());
            }
        } else {
            nextStatus = JobStateMachine.afterPhase(phase);
        }
        return new PhaseCompletion(job.getStatus(), result, ledger, evaluation, nextStatus, refinementRound);
    }

    // ------------------------------------------------------------------
    // Phase handlers
    // ------------------------------------------------------------------

    private PhaseOutput research(Job job) {
        return PhaseOutput.generated(generate(job, PipelinePhase.RESEARCH, PromptTemplates.research(job)));
    }

    private PhaseOutput draft(Job job) {
        String notes = latestContent(job, PipelinePhase.RESEARCH).orElse(null);
        if (job.getStatus() != JobStatus.REFINING) {
            return PhaseOutput.generated(generate(job, PipelinePhase.DRAFT, PromptTemplates.draft(job, notes)));
        }

        Optional<String> previous = latestContent(job, PipelinePhase.DRAFT);
        if (previous.isEmpty()) {
            return PhaseOutput.generated(generate(job, PipelinePhase.DRAFT, PromptTemplates.draft(job, notes)));
        }
        List<QualityEvaluation> evaluations = store.evaluations(job.getId());
        List<String> issues = evaluations.isEmpty() ? List.of() : evaluations.get(evaluations.size() - 1).getIssues();
        String reviewerFeedback = store.approvals(job.getId()).stream()
                .filter(a -> a.getDecision() == ApprovalDecision.REJECTED)
                .reduce((first, second) -> second)
                .map(ApprovalRecord::getFeedback)
                .orElse(null);
        return PhaseOutput.generated(generate(job, PipelinePhase.DRAFT,
                PromptTemplates.refine(job, previous.get(), issues, reviewerFeedback)));
    }

    private PhaseOutput qualityCheck(Job job) {
        String draft = latestContent(job, PipelinePhase.DRAFT)
                .orElseThrow(() -> new IllegalStateException("No draft to evaluate for job " + job.getId()));
        QualityVerdict verdict = evaluator.evaluate(draft,
                new StyleProfile(job.getStyle(), job.getTone(), job.getTargetLength()));
        log.info("Job {}: quality round {} scored {} ({})", job.getId(), job.currentRound(),
                verdict.score(), verdict.passing() ? "pass" : "fail");
        return PhaseOutput.evaluated(EVALUATOR_NAME, verdict);
    }

    private PhaseOutput format(Job job) {
        String draft = latestContent(job, PipelinePhase.DRAFT)
                .orElseThrow(() -> new IllegalStateException("No draft to format for job " + job.getId()));
        return PhaseOutput.generated(generate(job, PipelinePhase.FORMAT, PromptTemplates.format(job, draft)));
    }

    private PhaseOutput publish(Job job) {
        List<ApprovalRecord> approvals = store.approvals(job.getId()).stream()
                .filter(a -> a.getDecision() == ApprovalDecision.APPROVED)
                .toList();
        if (approvals.size() != 1) {
            throw new IllegalStateException("Publishing needs exactly one approval, job "
                    + job.getId() + " has " + approvals.size());
        }
        String article = latestContent(job, PipelinePhase.FORMAT)
                .orElseThrow(() -> new IllegalStateException("No formatted article for job " + job.getId()));

        PublishPayload payload = new PublishPayload(job.getId(), PromptTemplates.titleOf(article, job.getTopic()),
                article, job.getStyle(), job.getTone(), approvals.get(0).getReviewer());
        PublishReceipt receipt = retryExecutor.execute("publish", publishingRetryPolicy,
                () -> breakers.execute(CMS_SERVICE, () -> publishingTarget.publish(payload)));
        log.info("Job {} published as CMS entry {}", job.getId(), receipt.externalId());
        return PhaseOutput.published(CMS_SERVICE, receipt);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private RoutedGeneration generate(Job job, PipelinePhase phase, Prompt prompt) {
        List<Backend> candidates = router.select(phase,
                job.preferredBackend(phase).orElse(null), job.getQualityPreference());
        return router.execute(phase, candidates, prompt,
                GenerationParams.defaults(properties.maxOutputTokens()));
    }

    private Optional<String> latestContent(Job job, PipelinePhase phase) {
        return store.latestSuccessful(job.getId(), phase).map(PhaseResult::getContent);
    }

    /** Store writes are retried on transient database errors only. */
    private <T> T write(String operation, Supplier<T> call) {
        return retryExecutor.execute("db:" + operation, databaseRetryPolicy, call::get);
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
