package com.draftpilot.orchestrator.provider;

import com.draftpilot.orchestrator.config.ProviderProperties;
import com.draftpilot.orchestrator.model.PipelinePhase;
import com.draftpilot.orchestrator.model.QualityPreference;
import com.draftpilot.orchestrator.resilience.CircuitOpenException;
import com.draftpilot.orchestrator.resilience.RetriesExhaustedException;
import com.draftpilot.orchestrator.resilience.RetryExecutor;
import com.draftpilot.orchestrator.resilience.RetryPolicy;
import com.draftpilot.orchestrator.resilience.ServiceCircuitBreakers;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Picks a backend for each phase and calls it with fallback.
 *
 * Each candidate call is wrapped as
 * <pre>
 *   retry( breaker[backendId]( client.generate(...) ) )
 * </pre>
 * so transient failures are retried on the same backend, every failed attempt
 * counts against that backend's breaker, and a circuit that opens mid-retry
 * stops the retries. When a backend is used up the router moves to the next
 * candidate; fatal errors stop routing altogether. A cancelled call (deadline
 * interrupt) is propagated as is: it is not a backend failure and does not
 * fall back.
 */
@Component
public class ProviderRouter {

    private static final Logger log = LoggerFactory.getLogger(ProviderRouter.class);

    private final Map<Vendor, ProviderClient> clients = new EnumMap<>(Vendor.class);
    private final RetryExecutor               retryExecutor;
    private final ServiceCircuitBreakers      breakers;
    private final RetryPolicy                 retryPolicy;
    private final Duration                    requestTimeout;
    private final MeterRegistry               meterRegistry;

    public ProviderRouter(List<ProviderClient> clients,
                          RetryExecutor retryExecutor,
                          ServiceCircuitBreakers breakers,
                          @Qualifier("providerRetryPolicy") RetryPolicy retryPolicy,
                          ProviderProperties properties,
                          MeterRegistry meterRegistry) {
        clients.forEach(c -> this.clients.put(c.vendor(), c));
        this.retryExecutor  = retryExecutor;
        this.breakers       = breakers;
        this.retryPolicy    = retryPolicy;
        this.requestTimeout = properties.requestTimeout();
        this.meterRegistry  = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Selection and estimation (pure)
    // ------------------------------------------------------------------

    /**
     * Ordered candidates for a phase.
     *
     * An explicit backend comes first, then the phase's table in tier order:
     * FAST cheapest first, QUALITY most expensive first, BALANCED the middle
     * entry, then more expensive ones, then cheaper ones. Unknown explicit ids
     * are ignored.
     */
    public List<Backend> select(PipelinePhase phase, String explicitBackend, QualityPreference preference) {
        Set<Backend> ordered = new LinkedHashSet<>();
        if (explicitBackend != null && !explicitBackend.isBlank()) {
            Optional<Backend> explicit = Backend.fromId(explicitBackend);
            if (explicit.isPresent()) {
                ordered.add(explicit.get());
            } else {
                log.warn("Unknown backend '{}' requested for {}, using the default order", explicitBackend, phase);
            }
        }
        ordered.addAll(tierOrder(CostTable.candidates(phase),
                preference == null ? QualityPreference.BALANCED : preference));
        return List.copyOf(ordered);
    }

    static List<Backend> tierOrder(List<Backend> cheapestFirst, QualityPreference preference) {
        int n = cheapestFirst.size();
        List<Backend> result = new ArrayList<>(n);
        switch (preference) {
            case FAST -> result.addAll(cheapestFirst);
            case QUALITY -> {
                for (int i = n - 1; i >= 0; i--) {
                    result.add(cheapestFirst.get(i));
                }
            }
            case BALANCED -> {
                if (n == 0) {
                    break;
                }
                int middle = (n - 1) / 2;
                for (int i = middle; i < n; i++) {
                    result.add(cheapestFirst.get(i));
                }
                for (int i = middle - 1; i >= 0; i--) {
                    result.add(cheapestFirst.get(i));
                }
            }
        }
        return result;
    }

    /**
     * Expected cost of running {@code phase} on {@code backend}.
     *
     * @param expectedTokens token count to price; the phase's typical count when null
     */
    public BigDecimal estimateCost(PipelinePhase phase, Backend backend, Integer expectedTokens) {
        int tokens = expectedTokens != null ? expectedTokens : CostTable.expectedTokens(phase);
        return CostTable.cost(backend, tokens);
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    /**
     * Generate with the first candidate that succeeds.
     *
     * @throws FatalProviderException           a backend failed in a way no retry or fallback fixes
     * @throws AllProvidersUnavailableException every candidate was skipped or exhausted
     */
    public RoutedGeneration execute(PipelinePhase phase, List<Backend> candidates,
                                    Prompt prompt, GenerationParams params) {
        List<BackendFailure> failures = new ArrayList<>();

        for (Backend backend : candidates) {
            ProviderClient client = clients.get(backend.vendor());
            if (client == null || !client.isConfigured()) {
                failures.add(new BackendFailure(backend, false, "vendor " + backend.vendor() + " not configured"));
                continue;
            }
            AtomicBoolean called = new AtomicBoolean();
            try {
                Generation generation = retryExecutor.execute("provider:" + backend.id(), retryPolicy,
                        () -> breakers.execute(backend.id(), () -> {
                            called.set(true);
                            return client.generate(backend.model(), prompt, params, requestTimeout);
                        }));
                RoutedGeneration routed = price(phase, backend, generation, failures);
                meterRegistry.counter("draftpilot.router.calls",
                        "phase", phase.name(), "backend", backend.id(), "outcome", "success").increment();
                if (!failures.isEmpty()) {
                    log.info("{} served by fallback backend {} after {}", phase, backend.id(), failures);
                }
                return routed;
            } catch (RetriesExhaustedException e) {
                String cause = e.getCause() == null ? "unknown" : e.getCause().getMessage();
                log.warn("Backend {} exhausted for {} after {} attempt(s): {}",
                        backend.id(), phase, e.attempts(), cause);
                failures.add(new BackendFailure(backend, true,
                        "retries exhausted after " + e.attempts() + " attempt(s): " + cause));
                countFallback(phase, backend, "exhausted");
            } catch (CircuitOpenException e) {
                if (called.get()) {
                    log.warn("Circuit for {} opened while serving {}", backend.id(), phase);
                    failures.add(new BackendFailure(backend, true, "circuit opened"));
                } else {
                    log.info("Skipping {} for {}: circuit open", backend.id(), phase);
                    failures.add(new BackendFailure(backend, false, "circuit open"));
                }
                countFallback(phase, backend, "circuit_open");
            } catch (ProviderException e) {
                meterRegistry.counter("draftpilot.router.calls",
                        "phase", phase.name(), "backend", backend.id(), "outcome", "fatal").increment();
                throw new FatalProviderException(backend, e);
            }
        }

        meterRegistry.counter("draftpilot.router.unavailable", "phase", phase.name()).increment();
        throw new AllProvidersUnavailableException(phase, failures);
    }

    private RoutedGeneration price(PipelinePhase phase, Backend backend,
                                   Generation generation, List<BackendFailure> failures) {
        TokenUsage usage = generation.usage();
        if (usage != null && usage.total() > 0) {
            return new RoutedGeneration(generation, backend, CostTable.cost(backend, usage.total()), false, failures);
        }
        return new RoutedGeneration(generation, backend, estimateCost(phase, backend, null), true, failures);
    }

    private void countFallback(PipelinePhase phase, Backend backend, String reason) {
        meterRegistry.counter("draftpilot.router.fallbacks",
                "phase", phase.name(), "backend", backend.id(), "reason", reason).increment();
    }
}
