package com.draftpilot.orchestrator.provider;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Optional;

/**
 * Every LLM backend the router can pick.
 *
 * The id is what callers put into {@code models_by_phase} and what the
 * circuit breaker and cost ledger are keyed by. Prices are USD per 1K tokens.
 */
public enum Backend {
    OLLAMA         ("ollama",          Vendor.OLLAMA,    "mistral",                  "0"),
    GPT_35_TURBO   ("gpt-3.5-turbo",   Vendor.OPENAI,    "gpt-3.5-turbo",            "0.0005"),
    GPT_4          ("gpt-4",           Vendor.OPENAI,    "gpt-4",                    "0.003"),
    CLAUDE_3_HAIKU ("claude-3-haiku",  Vendor.ANTHROPIC, "claude-3-haiku-20240307",  "0.00025"),
    CLAUDE_3_SONNET("claude-3-sonnet", Vendor.ANTHROPIC, "claude-3-sonnet-20240229", "0.003"),
    CLAUDE_3_OPUS  ("claude-3-opus",   Vendor.ANTHROPIC, "claude-3-opus-20240229",   "0.015");

    private final String     id;
    private final Vendor     vendor;
    private final String     model;
    private final BigDecimal costPer1kTokens;

    Backend(String id, Vendor vendor, String model, String costPer1kTokens) {
        this.id              = id;
        this.vendor          = vendor;
        this.model           = model;
        this.costPer1kTokens = new BigDecimal(costPer1kTokens);
    }

    public String     id()              { return id; }
    public Vendor     vendor()          { return vendor; }
    public String     model()           { return model; }
    public BigDecimal costPer1kTokens() { return costPer1kTokens; }

    public static Optional<Backend> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(b -> b.id.equalsIgnoreCase(id.trim()))
                .findFirst();
    }
}
