package com.draftpilot.orchestrator.config;

import com.draftpilot.orchestrator.provider.ProviderException;
import com.draftpilot.orchestrator.publishing.PublishingException;
import com.draftpilot.orchestrator.resilience.ConnectionPoolHealthMonitor;
import com.draftpilot.orchestrator.resilience.HikariPoolMetricsSource;
import com.draftpilot.orchestrator.resilience.PoolMetricsSource;
import com.draftpilot.orchestrator.resilience.RetryExecutor;
import com.draftpilot.orchestrator.resilience.RetryPolicy;
import com.draftpilot.orchestrator.resilience.ServiceCircuitBreakers;
import com.draftpilot.orchestrator.resilience.TransientErrors;
import com.zaxxer.hikari.HikariDataSource;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.function.Predicate;

/**
 * Wires the resilience primitives from {@code draftpilot.resilience.*} and
 * {@code draftpilot.pool-health.*}.
 *
 * Retries and circuit breakers are Resilience4j registries; {@link RetryExecutor}
 * and {@link ServiceCircuitBreakers} add cancellation handling, metrics and
 * logging on top.
 *
 * Three retry policies are exposed as separate beans:
 * <ul>
 *   <li>{@code providerRetryPolicy}: retryable {@link ProviderException} kinds only</li>
 *   <li>{@code publishingRetryPolicy}: retryable {@link PublishingException}s only</li>
 *   <li>{@code databaseRetryPolicy}: transient database errors only</li>
 * </ul>
 */
@Configuration
public class ResilienceConfig {

    /** Slow calls are bounded by the request timeout, not by the breaker. */
    private static final Duration SLOW_CALLS_NEVER = Duration.ofDays(1);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.ofDefaults();
    }

    @Bean
    public RetryExecutor retryExecutor(RetryRegistry retryRegistry, MeterRegistry meterRegistry) {
        return new RetryExecutor(retryRegistry, meterRegistry);
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(ResilienceProperties properties, Clock clock) {
        ResilienceProperties.Breaker b = properties.breaker();
        return CircuitBreakerRegistry.of(
                circuitBreakerConfig(b.failureThreshold(), b.coolDown(), clock, ResilienceConfig::countsAgainstService));
    }

    @Bean
    public ServiceCircuitBreakers serviceCircuitBreakers(CircuitBreakerRegistry circuitBreakerRegistry,
                                                         ResilienceProperties properties,
                                                         Clock clock,
                                                         MeterRegistry meterRegistry) {
        return new ServiceCircuitBreakers(circuitBreakerRegistry, properties.breaker().failureWindow(),
                clock, meterRegistry);
    }

    @Bean
    public RetryPolicy providerRetryPolicy(ResilienceProperties properties) {
        return policy(properties.provider(), e -> e instanceof ProviderException pe && pe.isRetryable());
    }

    @Bean
    public RetryPolicy publishingRetryPolicy(ResilienceProperties properties) {
        return policy(properties.publishing(), e -> e instanceof PublishingException pe && pe.isRetryable());
    }

    @Bean
    public RetryPolicy databaseRetryPolicy(ResilienceProperties properties) {
        return policy(properties.database(), TransientErrors::isTransientDatabaseError);
    }

    @Bean
    public PoolMetricsSource poolMetricsSource(DataSource dataSource, Clock clock) {
        try {
            return new HikariPoolMetricsSource(dataSource.unwrap(HikariDataSource.class), clock);
        } catch (SQLException e) {
            throw new IllegalStateException("Pool health monitoring needs a HikariCP data source", e);
        }
    }

    @Bean
    public ConnectionPoolHealthMonitor connectionPoolHealthMonitor(PoolMetricsSource source,
                                                                   PoolHealthProperties properties,
                                                                   Clock clock) {
        return new ConnectionPoolHealthMonitor(source, new ConnectionPoolHealthMonitor.Thresholds(
                properties.degradedUtilisation(),
                properties.degradedLatency(),
                properties.criticalLatency(),
                properties.maxSampleAge()), clock);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Only failures that say something about the service's health trip its breaker. */
    static boolean countsAgainstService(Throwable e) {
        if (e instanceof ProviderException pe) {
            return pe.isRetryable();
        }
        if (e instanceof PublishingException pe) {
            return pe.isRetryable();
        }
        return true;
    }

    /**
     * Opens after {@code failureThreshold} consecutive recorded failures: a
     * count-based window of that size that trips only at a 100 % failure rate.
     * Errors rejected by {@code countsAgainstService} are ignored rather than
     * recorded as successes, so they neither extend nor break a streak.
     */
    public static CircuitBreakerConfig circuitBreakerConfig(int failureThreshold,
                                                            Duration coolDown,
                                                            Clock clock,
                                                            Predicate<Throwable> countsAgainstService) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1 (was " + failureThreshold + ")");
        }
        return CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failureThreshold)
                .minimumNumberOfCalls(failureThreshold)
                .failureRateThreshold(100.0f)
                .slowCallDurationThreshold(SLOW_CALLS_NEVER)
                .waitDurationInOpenState(coolDown)
                .permittedNumberOfCallsInHalfOpenState(1)
                .ignoreException(e -> !countsAgainstService.test(e))
                .clock(clock)
                .build();
    }

    private static RetryPolicy policy(ResilienceProperties.Retry r, Predicate<Throwable> retryable) {
        return new RetryPolicy(r.maxAttempts(), r.baseDelay(), r.multiplier(), r.jitter(), r.maxDelay(), retryable);
    }
}
