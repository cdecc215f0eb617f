package com.draftpilot.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/** Connection-pool health thresholds ({@code draftpilot.pool-health.*}). */
@ConfigurationProperties(prefix = "draftpilot.pool-health")
public record PoolHealthProperties(
        @DefaultValue("0.8")   double   degradedUtilisation,
        @DefaultValue("250ms") Duration degradedLatency,
        @DefaultValue("2s")    Duration criticalLatency,
        @DefaultValue("10s")   Duration maxSampleAge
) {}
