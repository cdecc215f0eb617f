package com.draftpilot.orchestrator.support;

import com.draftpilot.orchestrator.config.ProviderProperties;
import com.draftpilot.orchestrator.config.ResilienceConfig;
import com.draftpilot.orchestrator.provider.ProviderClient;
import com.draftpilot.orchestrator.provider.ProviderException;
import com.draftpilot.orchestrator.provider.ProviderRouter;
import com.draftpilot.orchestrator.resilience.RetryExecutor;
import com.draftpilot.orchestrator.resilience.RetryPolicy;
import com.draftpilot.orchestrator.resilience.ServiceCircuitBreakers;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/** Router wiring for tests: no backoff pauses, three attempts per backend. */
public final class TestRouters {

    public static final int      ATTEMPTS       = 3;
    public static final Duration FAILURE_WINDOW = Duration.ofMinutes(1);
    public static final Duration COOL_DOWN      = Duration.ofSeconds(30);

    private TestRouters() {}

    public static RetryExecutor retryExecutor(MeterRegistry meters) {
        return new RetryExecutor(RetryRegistry.ofDefaults(), meters);
    }

    public static RetryPolicy providerPolicy() {
        return new RetryPolicy(ATTEMPTS, Duration.ZERO, 1.0, 0.0, Duration.ZERO,
                e -> e instanceof ProviderException pe && pe.isRetryable());
    }

    public static ServiceCircuitBreakers breakers(Clock clock, MeterRegistry meters, int threshold) {
        return new ServiceCircuitBreakers(
                CircuitBreakerRegistry.of(ResilienceConfig.circuitBreakerConfig(threshold, COOL_DOWN, clock,
                        e -> !(e instanceof ProviderException pe) || pe.isRetryable())),
                FAILURE_WINDOW, clock, meters);
    }

    public static ProviderRouter router(List<ProviderClient> clients,
                                        ServiceCircuitBreakers breakers,
                                        MeterRegistry meters) {
        ProviderProperties properties = new ProviderProperties(Duration.ofSeconds(5),
                new ProviderProperties.Vendor(null, "k"),
                new ProviderProperties.Vendor(null, "k"),
                new ProviderProperties.Vendor("http://localhost:11434", null));
        return new ProviderRouter(clients, retryExecutor(meters), breakers, providerPolicy(), properties, meters);
    }
}
