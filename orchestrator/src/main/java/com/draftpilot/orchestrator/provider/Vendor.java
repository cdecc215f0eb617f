package com.draftpilot.orchestrator.provider;

/** Company / runtime behind a backend; one {@link ProviderClient} per vendor. */
public enum Vendor {
    OPENAI,
    ANTHROPIC,
    OLLAMA
}
