package com.draftpilot.orchestrator.provider;

import com.draftpilot.orchestrator.model.PipelinePhase;

import java.util.List;

/**
 * Every candidate backend for a phase was unavailable: retries exhausted,
 * circuit open, or vendor not configured. Fails the phase.
 */
public class AllProvidersUnavailableException extends RuntimeException {

    private final PipelinePhase        phase;
    private final List<BackendFailure> failures;

    public AllProvidersUnavailableException(PipelinePhase phase, List<BackendFailure> failures) {
        super("No backend available for " + phase + " after trying " + failures.size()
                + " candidate(s): " + failures);
        this.phase    = phase;
        this.failures = List.copyOf(failures);
    }

    public PipelinePhase        phase()    { return phase; }
    public List<BackendFailure> failures() { return failures; }
}
