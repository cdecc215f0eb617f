package com.draftpilot.orchestrator.provider;

/**
 * Why one candidate backend was given up on during routing.
 *
 * @param called whether a network call was attempted (false for open circuits
 *               and unconfigured vendors)
 */
public record BackendFailure(Backend backend, boolean called, String reason) {

    @Override
    public String toString() {
        return backend.id() + ": " + reason;
    }
}
