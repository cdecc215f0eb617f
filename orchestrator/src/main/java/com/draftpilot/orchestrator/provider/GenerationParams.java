package com.draftpilot.orchestrator.provider;

/** Sampling parameters passed through to every vendor. */
public record GenerationParams(int maxTokens, double temperature) {

    public static GenerationParams defaults(int maxTokens) {
        return new GenerationParams(maxTokens, 0.7);
    }
}
