package com.draftpilot.orchestrator.provider;

import com.draftpilot.orchestrator.model.PipelinePhase;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Static routing and pricing tables.
 *
 * Candidate lists are ordered cheapest first. QUALITY_CHECK and PUBLISH make
 * no LLM call and have no candidates.
 */
public final class CostTable {

    public static final int COST_SCALE = 6;

    private static final Map<PipelinePhase, List<Backend>> CANDIDATES = new EnumMap<>(PipelinePhase.class);
    private static final Map<PipelinePhase, Integer>       EXPECTED_TOKENS = new EnumMap<>(PipelinePhase.class);

    static {
        CANDIDATES.put(PipelinePhase.RESEARCH,      List.of(Backend.OLLAMA, Backend.GPT_35_TURBO, Backend.GPT_4));
        CANDIDATES.put(PipelinePhase.DRAFT,         List.of(Backend.GPT_35_TURBO, Backend.GPT_4,
                                                             Backend.CLAUDE_3_SONNET, Backend.CLAUDE_3_OPUS));
        CANDIDATES.put(PipelinePhase.QUALITY_CHECK, List.of());
        CANDIDATES.put(PipelinePhase.FORMAT,        List.of(Backend.CLAUDE_3_HAIKU, Backend.GPT_4, Backend.CLAUDE_3_OPUS));
        CANDIDATES.put(PipelinePhase.PUBLISH,       List.of());

        EXPECTED_TOKENS.put(PipelinePhase.RESEARCH,      2000);
        EXPECTED_TOKENS.put(PipelinePhase.DRAFT,         3000);
        EXPECTED_TOKENS.put(PipelinePhase.QUALITY_CHECK, 500);
        EXPECTED_TOKENS.put(PipelinePhase.FORMAT,        1000);
        EXPECTED_TOKENS.put(PipelinePhase.PUBLISH,       0);
    }

    private CostTable() {}

    /** Candidate backends for a phase, cheapest first. */
    public static List<Backend> candidates(PipelinePhase phase) {
        return CANDIDATES.get(phase);
    }

    /** Typical input + output tokens spent by one run of the phase. */
    public static int expectedTokens(PipelinePhase phase) {
        return EXPECTED_TOKENS.get(phase);
    }

    /** {@code tokens / 1000 * price}, scale 6, HALF_UP. */
    public static BigDecimal cost(Backend backend, int tokens) {
        return backend.costPer1kTokens()
                .multiply(BigDecimal.valueOf(tokens))
                .divide(BigDecimal.valueOf(1000), COST_SCALE, RoundingMode.HALF_UP);
    }
}
