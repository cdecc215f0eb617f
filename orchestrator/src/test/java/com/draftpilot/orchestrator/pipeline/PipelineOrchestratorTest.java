package com.draftpilot.orchestrator.pipeline;

import com.draftpilot.orchestrator.config.PipelineProperties;
import com.draftpilot.orchestrator.model.*;
import com.draftpilot.orchestrator.provider.*;
import com.draftpilot.orchestrator.publishing.PublishReceipt;
import com.draftpilot.orchestrator.publishing.PublishingException;
import com.draftpilot.orchestrator.publishing.PublishingTarget;
import com.draftpilot.orchestrator.quality.QualityEvaluator;
import com.draftpilot.orchestrator.quality.QualityVerdict;
import com.draftpilot.orchestrator.resilience.OperationCancelledException;
import com.draftpilot.orchestrator.resilience.RetryPolicy;
import com.draftpilot.orchestrator.resilience.ServiceCircuitBreakers;
import com.draftpilot.orchestrator.service.ClaimLostException;
import com.draftpilot.orchestrator.support.InMemoryJobStore;
import com.draftpilot.orchestrator.support.MutableClock;
import com.draftpilot.orchestrator.support.ScriptedProviderClient;
import com.draftpilot.orchestrator.support.TestJobs;
import com.draftpilot.orchestrator.support.TestRouters;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class PipelineOrchestratorTest {

    private InMemoryJobStore       store;
    private ScriptedProviderClient openai;
    private ScriptedProviderClient anthropic;
    private Deque<Object>          verdicts;
    private PublishingTarget       publishingTarget;
    private SimpleMeterRegistry    meters;
    private ServiceCircuitBreakers breakers;
    private ProviderRouter         router;
    private QualityEvaluator       evaluator;
    private PipelineOrchestrator   orchestrator;

    private static final QualityVerdict PASS = new QualityVerdict(85, true, List.of());
    private static final QualityVerdict FAIL = new QualityVerdict(40, false, List.of("No section headings"));

    @BeforeEach
    void setUp() {
        meters    = new SimpleMeterRegistry();
        store     = new InMemoryJobStore();
        openai    = new ScriptedProviderClient(Vendor.OPENAI);
        anthropic = new ScriptedProviderClient(Vendor.ANTHROPIC);
        verdicts  = new ArrayDeque<>();
        publishingTarget = mock(PublishingTarget.class);
        breakers  = TestRouters.breakers(MutableClock.atEpochPlus(Duration.ZERO), meters, 5);

        // BALANCED: research on gpt-3.5-turbo, draft and format on gpt-4
        openai.respondText(Backend.GPT_35_TURBO, "- fact one\n- fact two");
        openai.respond(Backend.GPT_4, prompt -> {
            if (prompt.user().startsWith("Polish")) {
                return new Generation("# Final article\n\nBody.", new TokenUsage(300, 700));
            }
            if (prompt.user().startsWith("Revise")) {
                return new Generation("# Revised draft\n\nBetter body.", new TokenUsage(900, 2100));
            }
            return new Generation("First draft body.", new TokenUsage(1000, 2000));
        });

        evaluator = (content, profile) -> {
            Object next = verdicts.poll();
            if (next instanceof RuntimeException e) {
                throw e;
            }
            return next == null ? PASS : (QualityVerdict) next;
        };

        router       = TestRouters.router(List.of(openai, anthropic), breakers, meters);
        orchestrator = orchestrator(new PipelineProperties(2, 70, false, 1, 1024));
    }

    private PipelineOrchestrator orchestrator(PipelineProperties properties) {
        RetryPolicy publishing = new RetryPolicy(3, Duration.ZERO, 1.0, 0.0, Duration.ZERO,
                e -> e instanceof PublishingException pe && pe.isRetryable());
        return new PipelineOrchestrator(store, router, evaluator, publishingTarget,
                TestRouters.retryExecutor(meters), breakers, publishing, RetryPolicy.noRetry(), properties);
    }

    /** Saves the job and claims it the way the executor would. */
    private Job claimed(Job job) {
        store.save(job);
        return store.claimDispatchable(1).get(0);
    }

    // -------------------------------------------------------------------------
    // Happy path and refinement
    // -------------------------------------------------------------------------

    @Test
    void run_failThenPass_refinesOnceAndStopsAtApprovalGate() {
        verdicts.add(FAIL);
        verdicts.add(PASS);
        Job job = claimed(TestJobs.job());

        Job result = orchestrator.run(job);

        assertThat(result.getStatus()).isEqualTo(JobStatus.AWAITING_APPROVAL);
        assertThat(result.getProgress()).isEqualTo(90);
        assertThat(result.getRefinementRound()).isEqualTo(1);

        List<QualityEvaluation> evaluations = store.evaluations(job.getId());
        assertThat(evaluations).extracting(QualityEvaluation::getRound).containsExactly(1, 2);
        assertThat(evaluations).extracting(QualityEvaluation::isPassing).containsExactly(false, true);

        List<PhaseResult> drafts = store.results(job.getId(), PipelinePhase.DRAFT);
        assertThat(drafts).extracting(PhaseResult::getRound).containsExactly(1, 2);
        assertThat(drafts.get(1).getContent()).startsWith("# Revised draft");

        assertThat(store.phaseResults(job.getId())).extracting(PhaseResult::getPhase).containsExactly(
                PipelinePhase.RESEARCH, PipelinePhase.DRAFT, PipelinePhase.QUALITY_CHECK,
                PipelinePhase.DRAFT, PipelinePhase.QUALITY_CHECK, PipelinePhase.FORMAT);
        verifyNoInteractions(publishingTarget);
    }

    @Test
    void run_refinementPrompt_carriesEvaluationIssues() {
        verdicts.add(FAIL);
        verdicts.add(PASS);

        orchestrator.run(claimed(TestJobs.job()));

        assertThat(openai.prompts()).filteredOn(p -> p.user().startsWith("Revise"))
                .singleElement()
                .satisfies(p -> assertThat(p.user()).contains("- No section headings", "First draft body."));
    }

    @Test
    void run_neverPasses_formatsBestEffortAfterRefinementBound() {
        verdicts.add(FAIL);
        verdicts.add(FAIL);
        verdicts.add(FAIL);
        Job job = claimed(TestJobs.job());

        Job result = orchestrator.run(job);

        assertThat(result.getStatus()).isEqualTo(JobStatus.AWAITING_APPROVAL);
        assertThat(store.evaluations(job.getId())).hasSize(3);
        assertThat(store.results(job.getId(), PipelinePhase.DRAFT)).hasSize(3);
        assertThat(store.results(job.getId(), PipelinePhase.FORMAT)).hasSize(1);
    }

    @Test
    void run_requeuedRejection_keepsQualityRefinementBudget() {
        PipelineOrchestrator oneRefinement = orchestrator(new PipelineProperties(1, 70, true, 1, 1024));
        verdicts.add(PASS);
        verdicts.add(FAIL);
        verdicts.add(PASS);
        Job job = claimed(TestJobs.job());
        oneRefinement.run(job);
        store.releaseClaim(job.getId(), job.getClaimedBy());
        store.recordDecision(job.getId(), ApprovalDecision.REJECTED, "editor@example.com", "Too dry", true, 1);
        assertThat(store.get(job.getId()).getStatus()).isEqualTo(JobStatus.REFINING);

        Job result = oneRefinement.run(store.claimDispatchable(1).get(0));

        assertThat(result.getStatus()).isEqualTo(JobStatus.AWAITING_APPROVAL);
        assertThat(result.getRejectionCount()).isEqualTo(1);
        assertThat(result.getRefinementRound()).isEqualTo(2);
        assertThat(result.qualityRefinements()).isEqualTo(1);
        assertThat(store.evaluations(job.getId())).extracting(QualityEvaluation::isPassing)
                .containsExactly(true, false, true);
        assertThat(store.results(job.getId(), PipelinePhase.DRAFT)).extracting(PhaseResult::getRound)
                .containsExactly(1, 2, 3);
        assertThat(store.results(job.getId(), PipelinePhase.FORMAT)).hasSize(2);
    }

    @Test
    void run_recordsLedgerForEveryGeneratingPhase() {
        Job job = claimed(TestJobs.job());

        orchestrator.run(job);

        List<CostLedgerEntry> ledger = store.ledger(job.getId());
        assertThat(ledger).extracting(CostLedgerEntry::getPhase)
                .containsExactly(PipelinePhase.RESEARCH, PipelinePhase.DRAFT, PipelinePhase.FORMAT);
        assertThat(ledger).allSatisfy(e -> {
            assertThat(e.getPhaseResultId()).isNotNull();
            assertThat(e.isEstimated()).isFalse();
        });
        // gpt-4 draft: 3000 tokens at 0.003 per 1K
        assertThat(ledger.get(1).getBackend()).isEqualTo("gpt-4");
        assertThat(ledger.get(1).getProvider()).isEqualTo("openai");
        assertThat(ledger.get(1).getCost()).isEqualByComparingTo(new BigDecimal("0.009000"));

        PhaseResult check = store.results(job.getId(), PipelinePhase.QUALITY_CHECK).get(0);
        assertThat(check.getBackend()).isEqualTo(PipelineOrchestrator.EVALUATOR_NAME);
        assertThat(check.getCostEstimate()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void run_explicitBackendForPhase_usedFirst() {
        anthropic.respondText(Backend.CLAUDE_3_HAIKU, "haiku research");
        Job job = claimed(TestJobs.job(QualityPreference.BALANCED, Map.of("RESEARCH", "claude-3-haiku")));

        orchestrator.run(job);

        assertThat(store.results(job.getId(), PipelinePhase.RESEARCH).get(0).getBackend())
                .isEqualTo("claude-3-haiku");
        assertThat(openai.calls(Backend.GPT_35_TURBO)).isZero();
    }

    // -------------------------------------------------------------------------
    // Failure and resume
    // -------------------------------------------------------------------------

    @Test
    void run_allDraftBackendsDown_failsJobWithPhaseResult() {
        openai.alwaysFail(Backend.GPT_4, ProviderException.Kind.SERVER_ERROR);
        openai.alwaysFail(Backend.GPT_35_TURBO, ProviderException.Kind.SERVER_ERROR);
        anthropic.alwaysFail(Backend.CLAUDE_3_SONNET, ProviderException.Kind.CONNECTION);
        anthropic.alwaysFail(Backend.CLAUDE_3_OPUS, ProviderException.Kind.CONNECTION);
        Job job = claimed(TestJobs.jobIn(JobStatus.DRAFTING));

        Job result = orchestrator.run(job);

        assertThat(result.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(result.getErrorDetail()).startsWith("DRAFT failed: No backend available for DRAFT");
        assertThat(store.results(job.getId(), PipelinePhase.DRAFT)).singleElement()
                .satisfies(r -> assertThat(r.isSucceeded()).isFalse());
    }

    @Test
    void run_fatalProviderError_recordsFailingBackend() {
        openai.alwaysFail(Backend.GPT_35_TURBO, ProviderException.Kind.AUTH);
        Job job = claimed(TestJobs.job());

        Job result = orchestrator.run(job);

        assertThat(result.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(store.results(job.getId(), PipelinePhase.RESEARCH)).singleElement()
                .satisfies(r -> assertThat(r.getBackend()).isEqualTo("gpt-3.5-turbo"));
        assertThat(openai.calls(Backend.GPT_35_TURBO)).isEqualTo(1);
    }

    @Test
    void run_afterCrash_resumesWithoutRepeatingPersistedPhases() {
        verdicts.add(new OperationCancelledException("worker stopped"));
        Job job = claimed(TestJobs.job());

        assertThatThrownBy(() -> orchestrator.run(job)).isInstanceOf(OperationCancelledException.class);
        assertThat(store.get(job.getId()).getStatus()).isEqualTo(JobStatus.QUALITY_CHECKING);

        store.releaseClaim(job.getId(), job.getClaimedBy());
        Job result = orchestrator.run(store.claimDispatchable(1).get(0));

        assertThat(result.getStatus()).isEqualTo(JobStatus.AWAITING_APPROVAL);
        assertThat(openai.calls(Backend.GPT_35_TURBO)).isEqualTo(1);
        assertThat(store.results(job.getId(), PipelinePhase.RESEARCH)).hasSize(1);
        assertThat(store.results(job.getId(), PipelinePhase.DRAFT)).hasSize(1);
    }

    @Test
    void run_claimLostMidRun_stopsWithoutWriting() {
        Job job = claimed(TestJobs.job());
        openai.respond(Backend.GPT_35_TURBO, p -> {
            store.releaseClaim(job.getId(), job.getClaimedBy());
            return new Generation("notes", new TokenUsage(10, 10));
        });

        assertThatThrownBy(() -> orchestrator.run(job)).isInstanceOf(ClaimLostException.class);

        assertThat(store.phaseResults(job.getId())).isEmpty();
        assertThat(store.get(job.getId()).getStatus()).isEqualTo(JobStatus.RESEARCHING);
    }

    // -------------------------------------------------------------------------
    // Publish
    // -------------------------------------------------------------------------

    private Job approvedJob() {
        Job job = claimed(TestJobs.job());
        orchestrator.run(job);
        store.releaseClaim(job.getId(), job.getClaimedBy());
        store.recordDecision(job.getId(), ApprovalDecision.APPROVED, "editor@example.com", null, false, 1);
        return store.claimDispatchable(1).get(0);
    }

    @Test
    void run_approvedJob_publishesFormattedArticle() {
        when(publishingTarget.publish(any())).thenReturn(new PublishReceipt("cms-42", "https://cms/a/42"));
        Job job = approvedJob();

        Job result = orchestrator.run(job);

        assertThat(result.getStatus()).isEqualTo(JobStatus.PUBLISHED);
        assertThat(result.getProgress()).isEqualTo(100);
        verify(publishingTarget).publish(argThat(p ->
                p.title().equals("Final article")
                        && p.content().startsWith("# Final article")
                        && p.approvedBy().equals("editor@example.com")));
        assertThat(store.results(job.getId(), PipelinePhase.PUBLISH)).singleElement()
                .satisfies(r -> assertThat(r.getContent()).isEqualTo("https://cms/a/42"));
    }

    @Test
    void run_publishTransientFailure_retried() {
        when(publishingTarget.publish(any()))
                .thenThrow(new PublishingException("503", true))
                .thenReturn(new PublishReceipt("cms-7", null));
        Job job = approvedJob();

        assertThat(orchestrator.run(job).getStatus()).isEqualTo(JobStatus.PUBLISHED);
        verify(publishingTarget, times(2)).publish(any());
    }

    @Test
    void run_publishRejected_failsJob() {
        when(publishingTarget.publish(any())).thenThrow(new PublishingException("422 invalid", false));
        Job job = approvedJob();

        Job result = orchestrator.run(job);

        assertThat(result.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(result.getErrorDetail()).contains("422 invalid");
        verify(publishingTarget, times(1)).publish(any());
    }

    @Test
    void run_approvedWithoutApprovalRecord_neverPublishes() {
        Job job = claimed(TestJobs.jobIn(JobStatus.APPROVED));

        Job result = orchestrator.run(job);

        assertThat(result.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(result.getErrorDetail()).contains("exactly one approval");
        verifyNoInteractions(publishingTarget);
    }
}
