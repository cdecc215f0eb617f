package com.draftpilot.orchestrator.resilience;

import java.time.Duration;

/**
 * Every attempt allowed by a {@link RetryPolicy} failed with a retryable error.
 * The last error is the cause.
 */
public class RetriesExhaustedException extends RuntimeException {

    private final String   operation;
    private final int      attempts;
    private final Duration elapsed;

    public RetriesExhaustedException(String operation, int attempts, Duration elapsed, Throwable lastError) {
        super("'%s' failed after %d attempt(s) in %d ms: %s".formatted(
                operation, attempts, elapsed.toMillis(),
                lastError == null ? "unknown error" : lastError.getMessage()), lastError);
        this.operation = operation;
        this.attempts  = attempts;
        this.elapsed   = elapsed;
    }

    public String   operation() { return operation; }
    public int      attempts()  { return attempts; }
    public Duration elapsed()   { return elapsed; }
}
