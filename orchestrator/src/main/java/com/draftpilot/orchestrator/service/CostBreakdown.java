package com.draftpilot.orchestrator.service;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * Spend on one job, summed from its cost ledger.
 *
 * @param estimatedEntries ledger rows priced from the phase estimate rather than reported usage
 */
public record CostBreakdown(UUID jobId,
                            BigDecimal total,
                            Map<String, BigDecimal> byPhase,
                            Map<String, BigDecimal> byBackend,
                            long totalTokens,
                            int entries,
                            int estimatedEntries) {}
