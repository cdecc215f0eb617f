package com.draftpilot.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/** CMS hand-off target ({@code draftpilot.publishing.*}). */
@ConfigurationProperties(prefix = "draftpilot.publishing")
public record PublishingProperties(
        @DefaultValue("http://localhost:1337") String   baseUrl,
        String                                          apiToken,
        @DefaultValue("30s")                   Duration timeout
) {}
