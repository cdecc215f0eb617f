package com.draftpilot.orchestrator.resilience;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a fallible operation under a {@link RetryPolicy} through a
 * Resilience4j {@link Retry} named after the operation.
 *
 * Outcomes:
 * <ul>
 *   <li>success: the result is returned.</li>
 *   <li>non-retryable error: rethrown immediately, never retried.</li>
 *   <li>retryable error on the last attempt: {@link RetriesExhaustedException}
 *       wrapping the last error.</li>
 *   <li>interrupt / cancellation: {@link OperationCancelledException}; the
 *       attempt is not retried and the interrupt flag stays set.</li>
 * </ul>
 *
 * An operation name keeps the policy it was first used with, so each name
 * must always be run with the same policy.
 *
 * Every execution publishes its attempt count and elapsed time:
 * <pre>
 *   draftpilot.retry.calls{operation, outcome="success|fatal|exhausted|cancelled"}
 *   draftpilot.retry.attempts{operation}
 *   draftpilot.retry.elapsed{operation}
 * </pre>
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryRegistry registry;
    private final MeterRegistry meterRegistry;

    public RetryExecutor(RetryRegistry registry, MeterRegistry meterRegistry) {
        this.registry      = registry;
        this.meterRegistry = meterRegistry;
        registry.getEventPublisher().onEntryAdded(event -> event.getAddedEntry().getEventPublisher()
                .onRetry(retry -> log.warn("'{}' attempt {} failed ({}), retrying in {} ms",
                        retry.getName(), retry.getNumberOfRetryAttempts(),
                        retry.getLastThrowable() == null ? "unknown error" : retry.getLastThrowable().getMessage(),
                        retry.getWaitInterval().toMillis())));
    }

    /**
     * @param operation name used for logs, metric tags and the Resilience4j retry, e.g. {@code provider:gpt-4}
     */
    public <T> T execute(String operation, RetryPolicy policy, Callable<T> call) {
        long startNanos = System.nanoTime();
        if (Thread.currentThread().isInterrupted()) {
            record(operation, "cancelled", 0, startNanos);
            throw new OperationCancelledException(operation);
        }

        Retry retry = registry.retry(operation, policy::toRetryConfig);
        AtomicInteger attempts = new AtomicInteger();
        try {
            T result = retry.executeCallable(() -> {
                attempts.incrementAndGet();
                return call.call();
            });
            record(operation, "success", attempts.get(), startNanos);
            if (attempts.get() > 1) {
                log.info("'{}' succeeded on attempt {}/{}", operation, attempts.get(), policy.maxAttempts());
            }
            return result;
        } catch (CancellationException e) {
            record(operation, "cancelled", attempts.get(), startNanos);
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            record(operation, "cancelled", attempts.get(), startNanos);
            throw new OperationCancelledException(operation, e);
        } catch (Exception e) {
            if (Thread.currentThread().isInterrupted()) {
                record(operation, "cancelled", attempts.get(), startNanos);
                throw new OperationCancelledException(operation, e);
            }
            if (!policy.isRetryable(e)) {
                record(operation, "fatal", attempts.get(), startNanos);
                throw asUnchecked(operation, e);
            }
            Duration elapsed = record(operation, "exhausted", attempts.get(), startNanos);
            log.warn("'{}' exhausted {} attempt(s) after {} ms", operation, attempts.get(), elapsed.toMillis());
            throw new RetriesExhaustedException(operation, attempts.get(), elapsed, e);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Duration record(String operation, String outcome, int attempts, long startNanos) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        meterRegistry.counter("draftpilot.retry.calls", "operation", operation, "outcome", outcome).increment();
        meterRegistry.summary("draftpilot.retry.attempts", "operation", operation).record(attempts);
        meterRegistry.timer("draftpilot.retry.elapsed", "operation", operation).record(elapsed);
        log.debug("'{}' finished: outcome={} attempts={} elapsed={}ms",
                operation, outcome, attempts, elapsed.toMillis());
        return elapsed;
    }

    private static RuntimeException asUnchecked(String operation, Exception e) {
        if (e instanceof RuntimeException re) {
            return re;
        }
        return new IllegalStateException("'" + operation + "' failed", e);
    }
}
