package com.draftpilot.orchestrator.resilience;

import java.util.concurrent.CancellationException;

/**
 * Thrown when the calling thread is interrupted during an I/O call or a
 * backoff pause.
 *
 * Cancellation is terminal for the attempt: {@link RetryExecutor} never
 * retries it and {@link ServiceCircuitBreakers} does not count it as a
 * failure. The interrupt flag is restored before this is thrown.
 */
public class OperationCancelledException extends CancellationException {

    public OperationCancelledException(String operation) {
        super("Operation '" + operation + "' was cancelled");
    }

    public OperationCancelledException(String operation, Throwable cause) {
        this(operation);
        initCause(cause);
    }
}
