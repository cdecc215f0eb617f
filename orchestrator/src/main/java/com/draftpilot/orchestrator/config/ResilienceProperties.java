package com.draftpilot.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Retry and circuit breaker settings ({@code draftpilot.resilience.*}).
 *
 * Provider calls, publishing calls and database writes each get their own
 * retry schedule; all external services share one breaker configuration.
 */
@ConfigurationProperties(prefix = "draftpilot.resilience")
public record ResilienceProperties(
        @DefaultValue Retry   provider,
        @DefaultValue Retry   publishing,
        @DefaultValue Retry   database,
        @DefaultValue Breaker breaker
) {

    public record Retry(
            @DefaultValue("3")     int      maxAttempts,
            @DefaultValue("500ms") Duration baseDelay,
            @DefaultValue("2.0")   double   multiplier,
            @DefaultValue("0.2")   double   jitter,
            @DefaultValue("10s")   Duration maxDelay
    ) {}

    public record Breaker(
            @DefaultValue("5")   int      failureThreshold,
            @DefaultValue("60s") Duration failureWindow,
            @DefaultValue("30s") Duration coolDown
    ) {}
}
