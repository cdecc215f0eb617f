package com.draftpilot.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * LLM vendor endpoints ({@code draftpilot.providers.*}).
 *
 * A vendor with a blank API key is treated as not configured and its
 * backends are skipped by the router.
 */
@ConfigurationProperties(prefix = "draftpilot.providers")
public record ProviderProperties(
        @DefaultValue("60s") Duration requestTimeout,
        @DefaultValue Vendor openai,
        @DefaultValue Vendor anthropic,
        @DefaultValue Vendor ollama
) {

    public record Vendor(String baseUrl, String apiKey) {}
}
