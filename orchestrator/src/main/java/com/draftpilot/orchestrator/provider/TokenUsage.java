package com.draftpilot.orchestrator.provider;

/** Token counts reported by the provider for one call. */
public record TokenUsage(int inputTokens, int outputTokens) {

    public int total() {
        return inputTokens + outputTokens;
    }
}
