package com.draftpilot.orchestrator.pipeline;

import com.draftpilot.orchestrator.model.Job;

/**
 * Runs one phase for a job. Throws on failure; the orchestrator records it.
 */
@FunctionalInterface
interface PhaseHandler {

    PhaseOutput run(Job job);
}
