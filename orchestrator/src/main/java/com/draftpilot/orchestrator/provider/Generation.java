package com.draftpilot.orchestrator.provider;

/**
 * Text returned by a provider.
 *
 * @param usage token usage as reported by the vendor; null when it reported none
 */
public record Generation(String text, TokenUsage usage) {}
