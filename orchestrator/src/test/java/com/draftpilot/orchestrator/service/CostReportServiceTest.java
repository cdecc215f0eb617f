package com.draftpilot.orchestrator.service;

import com.draftpilot.orchestrator.model.*;
import com.draftpilot.orchestrator.provider.ProviderRouter;
import com.draftpilot.orchestrator.support.InMemoryJobStore;
import com.draftpilot.orchestrator.support.MutableClock;
import com.draftpilot.orchestrator.support.TestJobs;
import com.draftpilot.orchestrator.support.TestRouters;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class CostReportServiceTest {

    private InMemoryJobStore  store;
    private CostReportService costs;

    @BeforeEach
    void setUp() {
        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        store = new InMemoryJobStore();
        ProviderRouter router = TestRouters.router(List.of(),
                TestRouters.breakers(MutableClock.atEpochPlus(Duration.ZERO), meters, 5), meters);
        costs = new CostReportService(store, router);
    }

    private void bill(Job job, JobStatus from, JobStatus to, PipelinePhase phase, String backend,
                      Integer in, Integer out, String cost, boolean estimated) {
        PhaseResult result = PhaseResult.succeeded(job.getId(), phase, 1, backend, new BigDecimal(cost), 10, "text");
        CostLedgerEntry entry = new CostLedgerEntry(job.getId(), phase, backend, "openai", in, out,
                new BigDecimal(cost), estimated);
        store.recordPhase(job.getId(), "run-1", new PhaseCompletion(from, result, entry, null, to, 0));
    }

    @Test
    void breakdown_sumsLedgerByPhaseAndBackend() {
        Job job = store.save(TestJobs.claimedJobIn(JobStatus.RESEARCHING, "run-1"));
        bill(job, JobStatus.RESEARCHING, JobStatus.DRAFTING, PipelinePhase.RESEARCH, "gpt-3.5-turbo",
                500, 1500, "0.001000", false);
        bill(job, JobStatus.DRAFTING, JobStatus.QUALITY_CHECKING, PipelinePhase.DRAFT, "gpt-4",
                null, null, "0.009000", true);

        CostBreakdown breakdown = costs.breakdown(job.getId());

        assertThat(breakdown.total()).isEqualByComparingTo("0.010000");
        assertThat(breakdown.byPhase()).containsOnlyKeys("RESEARCH", "DRAFT");
        assertThat(breakdown.byBackend().get("gpt-4")).isEqualByComparingTo("0.009000");
        assertThat(breakdown.totalTokens()).isEqualTo(2000);
        assertThat(breakdown.entries()).isEqualTo(2);
        assertThat(breakdown.estimatedEntries()).isEqualTo(1);
    }

    @Test
    void breakdown_softDeletedJob_stillReported() {
        Job job = store.save(TestJobs.claimedJobIn(JobStatus.RESEARCHING, "run-1"));
        bill(job, JobStatus.RESEARCHING, JobStatus.DRAFTING, PipelinePhase.RESEARCH, "gpt-3.5-turbo",
                100, 100, "0.000100", false);
        store.softDelete(job.getId());

        assertThat(costs.breakdown(job.getId()).total()).isEqualByComparingTo("0.000100");
    }

    @Test
    void breakdown_noLedger_zeroTotal() {
        Job job = store.save(TestJobs.job());

        CostBreakdown breakdown = costs.breakdown(job.getId());

        assertThat(breakdown.total()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(breakdown.entries()).isZero();
    }

    @Test
    void breakdown_unknownJob_notFound() {
        assertThatThrownBy(() -> costs.breakdown(UUID.randomUUID())).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void estimate_balanced_usesFirstChoicePerPhase() {
        CostEstimate estimate = costs.estimate(QualityPreference.BALANCED);

        assertThat(estimate.backendByPhase()).containsEntry("RESEARCH", "gpt-3.5-turbo")
                                             .containsEntry("DRAFT", "gpt-4")
                                             .containsEntry("FORMAT", "gpt-4");
        assertThat(estimate.total()).isEqualByComparingTo("0.013000");
        assertThat(estimate.low()).isEqualByComparingTo("0.010400");
        assertThat(estimate.high()).isEqualByComparingTo("0.015600");
    }

    @Test
    void estimate_fastIsCheaperThanQuality() {
        CostEstimate fast    = costs.estimate(QualityPreference.FAST);
        CostEstimate quality = costs.estimate(QualityPreference.QUALITY);

        assertThat(fast.backendByPhase()).containsEntry("RESEARCH", "ollama");
        assertThat(quality.backendByPhase()).containsEntry("DRAFT", "claude-3-opus");
        assertThat(fast.total()).isLessThan(quality.total());
    }

    @Test
    void estimate_nullPreference_defaultsToBalanced() {
        assertThat(costs.estimate(null).preference()).isEqualTo(QualityPreference.BALANCED);
    }
}
