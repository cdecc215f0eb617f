package com.draftpilot.orchestrator.publishing;

/**
 * Publishing hand-off failed.
 *
 * {@link #isRetryable()} is true for network errors, timeouts, 429 and 5xx
 * answers; anything else is a rejection of the payload itself.
 */
public class PublishingException extends RuntimeException {

    private final boolean retryable;

    public PublishingException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public PublishingException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() { return retryable; }
}
