package com.draftpilot.orchestrator.service;

import com.draftpilot.orchestrator.model.CostLedgerEntry;
import com.draftpilot.orchestrator.model.JobStatus;
import com.draftpilot.orchestrator.model.PhaseResult;
import com.draftpilot.orchestrator.model.QualityEvaluation;

/**
 * Everything one successful phase writes, committed together.
 *
 * @param expectedStatus  status the job must still be in; guards against a concurrent move
 * @param ledgerEntry     null for phases without a provider call
 * @param evaluation      only for QUALITY_CHECK
 * @param refinementRound refinement round to store with the new status
 */
public record PhaseCompletion(JobStatus expectedStatus,
                              PhaseResult result,
                              CostLedgerEntry ledgerEntry,
                              QualityEvaluation evaluation,
                              JobStatus nextStatus,
                              int refinementRound) {}
