package com.draftpilot.orchestrator.resilience;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.function.Predicate;

/**
 * Exponential backoff with symmetric jitter, expressed as a Resilience4j
 * {@link RetryConfig}.
 *
 * <pre>
 * delay(n) = min(base * multiplier^(n-1) * (1 ± jitter), maxDelay)
 * </pre>
 *
 * where {@code n} is the number of the attempt that just failed (1-based).
 * With base=500ms, multiplier=2, jitter=0.2:
 * <ul>
 *   <li>after attempt 1: 400-600 ms</li>
 *   <li>after attempt 2: 800-1200 ms</li>
 *   <li>after attempt 3: 1600-2400 ms</li>
 * </ul>
 *
 * @param maxAttempts total calls allowed, including the first one
 * @param baseDelay   delay after the first failure, before jitter; zero means no pause
 * @param multiplier  growth factor per attempt (&gt;= 1.0)
 * @param jitter      jitter as a fraction of the computed delay, in [0.0, 1.0)
 * @param maxDelay    upper bound for any single delay
 * @param retryable   decides whether an error is worth another attempt
 */
public record RetryPolicy(int maxAttempts,
                          Duration baseDelay,
                          double multiplier,
                          double jitter,
                          Duration maxDelay,
                          Predicate<Throwable> retryable) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1 (was " + maxAttempts + ")");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be >= 0");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0 (was " + multiplier + ")");
        }
        if (jitter < 0.0 || jitter >= 1.0) {
            throw new IllegalArgumentException("jitter must be in [0.0, 1.0) (was " + jitter + ")");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        if (retryable == null) {
            retryable = e -> false;
        }
    }

    /** A policy that calls exactly once. */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, 0.0, Duration.ZERO, e -> false);
    }

    /** Whether {@code error} gets another attempt. Cancellation never does. */
    public boolean isRetryable(Throwable error) {
        if (error instanceof CancellationException
                || error instanceof InterruptedException
                || Thread.currentThread().isInterrupted()) {
            return false;
        }
        return retryable.test(error);
    }

    /** Wait before the attempt after {@code failedAttempt}, in milliseconds. */
    public IntervalFunction intervalFunction() {
        if (baseDelay.isZero()) {
            return failedAttempt -> 0L;
        }
        if (jitter == 0.0) {
            return IntervalFunction.ofExponentialBackoff(baseDelay, multiplier, maxDelay);
        }
        return IntervalFunction.ofExponentialRandomBackoff(baseDelay, multiplier, jitter, maxDelay);
    }

    public RetryConfig toRetryConfig() {
        return RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(intervalFunction())
                .retryOnException(this::isRetryable)
                .build();
    }
}
