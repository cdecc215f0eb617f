package com.draftpilot.orchestrator.service;

import com.draftpilot.orchestrator.model.QualityPreference;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Up-front cost estimate for one run of the pipeline.
 *
 * @param backendByPhase first-choice backend per generating phase
 * @param costByPhase    estimated cost per generating phase
 * @param low            {@code total} minus 20%
 * @param high           {@code total} plus 20%
 */
public record CostEstimate(QualityPreference preference,
                           Map<String, String> backendByPhase,
                           Map<String, BigDecimal> costByPhase,
                           BigDecimal total,
                           BigDecimal low,
                           BigDecimal high) {}
