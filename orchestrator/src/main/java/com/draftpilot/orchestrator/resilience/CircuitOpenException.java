package com.draftpilot.orchestrator.resilience;

/**
 * A call was short-circuited because the service's breaker is open (or a
 * half-open trial is already in flight) and the caller supplied no fallback.
 */
public class CircuitOpenException extends RuntimeException {

    private final String service;

    public CircuitOpenException(String service) {
        super("Circuit for '" + service + "' is open");
        this.service = service;
    }

    public CircuitOpenException(String service, Throwable cause) {
        this(service);
        initCause(cause);
    }

    public String service() { return service; }
}
