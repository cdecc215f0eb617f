package com.draftpilot.orchestrator.provider;

import com.draftpilot.orchestrator.model.PipelinePhase;
import com.draftpilot.orchestrator.model.QualityPreference;
import com.draftpilot.orchestrator.resilience.OperationCancelledException;
import com.draftpilot.orchestrator.resilience.ServiceCircuitBreakers;
import com.draftpilot.orchestrator.support.MutableClock;
import com.draftpilot.orchestrator.support.ScriptedProviderClient;
import com.draftpilot.orchestrator.support.TestRouters;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static com.draftpilot.orchestrator.provider.Backend.*;
import static org.assertj.core.api.Assertions.*;

class ProviderRouterTest {

    private static final Prompt           PROMPT = new Prompt("system", "write about pools");
    private static final GenerationParams PARAMS = GenerationParams.defaults(512);

    private SimpleMeterRegistry    meters;
    private ServiceCircuitBreakers breakers;
    private ScriptedProviderClient openai;
    private ScriptedProviderClient anthropic;
    private ScriptedProviderClient ollama;
    private ProviderRouter         router;

    @BeforeEach
    void setUp() {
        meters    = new SimpleMeterRegistry();
        breakers  = TestRouters.breakers(MutableClock.atEpochPlus(Duration.ZERO), meters, 5);
        openai    = new ScriptedProviderClient(Vendor.OPENAI);
        anthropic = new ScriptedProviderClient(Vendor.ANTHROPIC);
        ollama    = new ScriptedProviderClient(Vendor.OLLAMA);
        router    = TestRouters.router(List.of(openai, anthropic, ollama), breakers, meters);
    }

    // -------------------------------------------------------------------------
    // select
    // -------------------------------------------------------------------------

    @Test
    void select_tiersOrderTheTable() {
        assertThat(router.select(PipelinePhase.DRAFT, null, QualityPreference.FAST))
                .containsExactly(GPT_35_TURBO, GPT_4, CLAUDE_3_SONNET, CLAUDE_3_OPUS);
        assertThat(router.select(PipelinePhase.DRAFT, null, QualityPreference.QUALITY))
                .containsExactly(CLAUDE_3_OPUS, CLAUDE_3_SONNET, GPT_4, GPT_35_TURBO);
        assertThat(router.select(PipelinePhase.DRAFT, null, QualityPreference.BALANCED))
                .containsExactly(GPT_4, CLAUDE_3_SONNET, CLAUDE_3_OPUS, GPT_35_TURBO);
        assertThat(router.select(PipelinePhase.FORMAT, null, QualityPreference.BALANCED))
                .containsExactly(GPT_4, CLAUDE_3_OPUS, CLAUDE_3_HAIKU);
        assertThat(router.select(PipelinePhase.FORMAT, null, QualityPreference.FAST))
                .containsExactly(CLAUDE_3_HAIKU, GPT_4, CLAUDE_3_OPUS);
    }

    @Test
    void select_explicitBackendFirst_withoutDuplicates() {
        assertThat(router.select(PipelinePhase.RESEARCH, "gpt-4", QualityPreference.FAST))
                .containsExactly(GPT_4, OLLAMA, GPT_35_TURBO);
        assertThat(router.select(PipelinePhase.DRAFT, "CLAUDE-3-HAIKU", QualityPreference.FAST))
                .containsExactly(CLAUDE_3_HAIKU, GPT_35_TURBO, GPT_4, CLAUDE_3_SONNET, CLAUDE_3_OPUS);
    }

    @Test
    void select_unknownExplicitBackend_ignored() {
        assertThat(router.select(PipelinePhase.FORMAT, "gpt-9000", QualityPreference.FAST))
                .containsExactly(CLAUDE_3_HAIKU, GPT_4, CLAUDE_3_OPUS);
    }

    @Test
    void select_phaseWithoutLlm_hasNoCandidates() {
        assertThat(router.select(PipelinePhase.QUALITY_CHECK, null, QualityPreference.BALANCED)).isEmpty();
        assertThat(router.select(PipelinePhase.PUBLISH, null, QualityPreference.QUALITY)).isEmpty();
    }

    @Test
    void estimateCost_usesPhaseTokensOrOverride() {
        assertThat(router.estimateCost(PipelinePhase.DRAFT, GPT_4, null))
                .isEqualByComparingTo(new BigDecimal("0.009000"));
        assertThat(router.estimateCost(PipelinePhase.DRAFT, GPT_4, 1000))
                .isEqualByComparingTo(new BigDecimal("0.003000"));
        assertThat(router.estimateCost(PipelinePhase.RESEARCH, OLLAMA, null))
                .isEqualByComparingTo(BigDecimal.ZERO);
    }

    // -------------------------------------------------------------------------
    // execute
    // -------------------------------------------------------------------------

    @Test
    void execute_firstCandidateSucceeds_pricedFromUsage() {
        openai.respond(GPT_4, p -> new Generation("draft text", new TokenUsage(400, 600)));

        RoutedGeneration routed = router.execute(PipelinePhase.DRAFT, List.of(GPT_4, CLAUDE_3_OPUS), PROMPT, PARAMS);

        assertThat(routed.backend()).isEqualTo(GPT_4);
        assertThat(routed.text()).isEqualTo("draft text");
        assertThat(routed.cost()).isEqualByComparingTo(new BigDecimal("0.003000"));
        assertThat(routed.estimated()).isFalse();
        assertThat(routed.fallbacks()).isEmpty();
        assertThat(anthropic.calls(CLAUDE_3_OPUS)).isZero();
    }

    @Test
    void execute_noUsageReported_fallsBackToEstimate() {
        openai.respond(GPT_4, p -> new Generation("text", null));

        RoutedGeneration routed = router.execute(PipelinePhase.FORMAT, List.of(GPT_4), PROMPT, PARAMS);

        assertThat(routed.estimated()).isTrue();
        assertThat(routed.cost()).isEqualByComparingTo(new BigDecimal("0.003000"));
    }

    @Test
    void execute_transientFailure_retriedOnSameBackend() {
        openai.then(GPT_4, new ProviderException(ProviderException.Kind.RATE_LIMITED, Vendor.OPENAI, "429"))
              .respondText(GPT_4, "ok");

        RoutedGeneration routed = router.execute(PipelinePhase.DRAFT, List.of(GPT_4, CLAUDE_3_OPUS), PROMPT, PARAMS);

        assertThat(routed.backend()).isEqualTo(GPT_4);
        assertThat(openai.calls(GPT_4)).isEqualTo(2);
        assertThat(routed.fallbacks()).isEmpty();
    }

    @Test
    void execute_exhaustedBackend_fallsBackAfterExactlyMaxAttempts() {
        openai.alwaysFail(GPT_4, ProviderException.Kind.SERVER_ERROR);
        anthropic.respondText(CLAUDE_3_OPUS, "from opus");

        RoutedGeneration routed = router.execute(PipelinePhase.DRAFT, List.of(GPT_4, CLAUDE_3_OPUS), PROMPT, PARAMS);

        assertThat(routed.backend()).isEqualTo(CLAUDE_3_OPUS);
        assertThat(openai.calls(GPT_4)).isEqualTo(TestRouters.ATTEMPTS);
        assertThat(routed.fallbacks()).singleElement().satisfies(f -> {
            assertThat(f.backend()).isEqualTo(GPT_4);
            assertThat(f.called()).isTrue();
            assertThat(f.reason()).startsWith("retries exhausted after 3 attempt(s)");
        });
    }

    @Test
    void execute_openCircuit_skippedWithoutCalling() {
        for (int i = 0; i < 5; i++) {
            assertThatThrownBy(() -> breakers.execute(GPT_4.id(), () -> {
                throw new ProviderException(ProviderException.Kind.SERVER_ERROR, Vendor.OPENAI, "503");
            })).isInstanceOf(ProviderException.class);
        }
        assertThat(breakers.stateOf(GPT_4.id())).isEqualTo(CircuitBreaker.State.OPEN);
        openai.respondText(GPT_4, "should not be used");
        anthropic.respondText(CLAUDE_3_OPUS, "from opus");

        RoutedGeneration routed = router.execute(PipelinePhase.FORMAT, List.of(GPT_4, CLAUDE_3_OPUS), PROMPT, PARAMS);

        assertThat(routed.backend()).isEqualTo(CLAUDE_3_OPUS);
        assertThat(openai.calls(GPT_4)).isZero();
        assertThat(routed.fallbacks()).singleElement().satisfies(f -> {
            assertThat(f.called()).isFalse();
            assertThat(f.reason()).isEqualTo("circuit open");
        });
    }

    @Test
    void execute_circuitOpensMidRetry_stopsCallingThatBackend() {
        ServiceCircuitBreakers tight = TestRouters.breakers(MutableClock.atEpochPlus(Duration.ZERO), meters, 2);
        ProviderRouter tightRouter = TestRouters.router(List.of(openai, anthropic, ollama), tight, meters);
        openai.alwaysFail(GPT_4, ProviderException.Kind.TIMEOUT);
        anthropic.respondText(CLAUDE_3_OPUS, "from opus");

        RoutedGeneration routed = tightRouter.execute(PipelinePhase.FORMAT, List.of(GPT_4, CLAUDE_3_OPUS), PROMPT, PARAMS);

        assertThat(routed.backend()).isEqualTo(CLAUDE_3_OPUS);
        assertThat(openai.calls(GPT_4)).isEqualTo(2);
        assertThat(routed.fallbacks()).singleElement()
                .satisfies(f -> assertThat(f.reason()).isEqualTo("circuit opened"));
    }

    @Test
    void execute_unconfiguredVendor_skipped() {
        ScriptedProviderClient offline = new ScriptedProviderClient(Vendor.ANTHROPIC, false);
        ProviderRouter partial = TestRouters.router(List.of(openai, offline), breakers, meters);
        openai.respondText(GPT_4, "ok");

        RoutedGeneration routed = partial.execute(PipelinePhase.DRAFT, List.of(CLAUDE_3_OPUS, GPT_4), PROMPT, PARAMS);

        assertThat(routed.backend()).isEqualTo(GPT_4);
        assertThat(offline.calls(CLAUDE_3_OPUS)).isZero();
        assertThat(routed.fallbacks()).singleElement()
                .satisfies(f -> assertThat(f.reason()).contains("not configured"));
    }

    @Test
    void execute_fatalError_stopsRoutingImmediately() {
        openai.alwaysFail(GPT_4, ProviderException.Kind.AUTH);
        anthropic.respondText(CLAUDE_3_OPUS, "never");

        assertThatThrownBy(() -> router.execute(PipelinePhase.FORMAT, List.of(GPT_4, CLAUDE_3_OPUS), PROMPT, PARAMS))
                .isInstanceOf(FatalProviderException.class)
                .satisfies(e -> assertThat(((FatalProviderException) e).backend()).isEqualTo(GPT_4));

        assertThat(openai.calls(GPT_4)).isEqualTo(1);
        assertThat(anthropic.calls(CLAUDE_3_OPUS)).isZero();
        assertThat(breakers.stateOf(GPT_4.id())).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(breakers.failuresOf(GPT_4.id())).isZero();
    }

    @Test
    void execute_cancelledWhileBlocked_propagatesWithoutFallbackOrBreakerFailure() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch never   = new CountDownLatch(1);
        openai.respond(GPT_4, p -> {
            started.countDown();
            try {
                never.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OperationCancelledException("provider:gpt-4", e);
            }
            return new Generation("too late", null);
        });
        anthropic.respondText(CLAUDE_3_OPUS, "never");

        AtomicReference<Throwable> thrown = new AtomicReference<>();
        Thread worker = new Thread(() -> {
            try {
                router.execute(PipelinePhase.FORMAT, List.of(GPT_4, CLAUDE_3_OPUS), PROMPT, PARAMS);
            } catch (Throwable t) {
                thrown.set(t);
            }
        });
        worker.start();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        worker.interrupt();
        worker.join(5_000);

        assertThat(worker.isAlive()).isFalse();
        assertThat(thrown.get()).isInstanceOf(OperationCancelledException.class);
        assertThat(openai.calls(GPT_4)).isEqualTo(1);
        assertThat(anthropic.calls(CLAUDE_3_OPUS)).isZero();
        assertThat(breakers.stateOf(GPT_4.id())).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(breakers.failuresOf(GPT_4.id())).isZero();
        assertThat(meters.counter("draftpilot.retry.calls",
                "operation", "provider:gpt-4", "outcome", "cancelled").count()).isEqualTo(1.0);
        assertThat(meters.find("draftpilot.router.fallbacks").counters()).isEmpty();
    }

    @Test
    void execute_everyCandidateDown_allProvidersUnavailable() {
        openai.alwaysFail(GPT_4, ProviderException.Kind.CONNECTION);
        anthropic.alwaysFail(CLAUDE_3_OPUS, ProviderException.Kind.SERVER_ERROR);

        assertThatThrownBy(() -> router.execute(PipelinePhase.FORMAT, List.of(GPT_4, CLAUDE_3_OPUS), PROMPT, PARAMS))
                .isInstanceOf(AllProvidersUnavailableException.class)
                .satisfies(e -> {
                    AllProvidersUnavailableException ex = (AllProvidersUnavailableException) e;
                    assertThat(ex.phase()).isEqualTo(PipelinePhase.FORMAT);
                    assertThat(ex.failures()).extracting(BackendFailure::backend)
                            .containsExactly(GPT_4, CLAUDE_3_OPUS);
                });

        assertThat(openai.calls(GPT_4)).isEqualTo(3);
        assertThat(anthropic.calls(CLAUDE_3_OPUS)).isEqualTo(3);
        assertThat(meters.counter("draftpilot.router.unavailable", "phase", "FORMAT").count()).isEqualTo(1.0);
    }

    @Test
    void execute_noCandidates_unavailable() {
        assertThatThrownBy(() -> router.execute(PipelinePhase.DRAFT, List.of(), PROMPT, PARAMS))
                .isInstanceOf(AllProvidersUnavailableException.class);
    }
}
