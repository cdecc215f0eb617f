package com.draftpilot.orchestrator.provider;

/**
 * A backend rejected the request for a reason another backend or another
 * attempt would not fix (bad credentials, malformed request). Fails the phase
 * without trying the remaining candidates.
 */
public class FatalProviderException extends RuntimeException {

    private final Backend backend;

    public FatalProviderException(Backend backend, ProviderException cause) {
        super("Backend '" + backend.id() + "' failed fatally: " + cause.getMessage(), cause);
        this.backend = backend;
    }

    public Backend backend() { return backend; }
}
