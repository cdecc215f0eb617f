package com.draftpilot.orchestrator.provider;

/**
 * A single-turn request: optional system instructions plus the user message.
 */
public record Prompt(String system, String user) {

    public Prompt {
        if (user == null || user.isBlank()) {
            throw new IllegalArgumentException("Prompt user message must not be blank");
        }
    }
}
