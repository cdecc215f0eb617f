package com.draftpilot.orchestrator.resilience;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Per-service circuit breakers shared by every job in the process, one
 * Resilience4j {@link CircuitBreaker} per service name.
 *
 * The registry's config opens a circuit after N consecutive recorded failures
 * (count-based window of N, failure rate 100 %) and admits one half-open trial
 * after the cool-down. On top of that a streak older than the failure window
 * is discarded before the next failure is recorded.
 *
 * Outcomes of a guarded call:
 * <pre>
 *   returns                           → success
 *   throws a recorded error           → failure (any Throwable, Errors included)
 *   throws an ignored error           → permit released, nothing recorded
 *   cancelled / thread interrupted    → permit released, nothing recorded
 *   rejected by the breaker           → fallback, or {@link CircuitOpenException}
 * </pre>
 *
 * <pre>{@code
 * String text = breakers.execute("gpt-4", () -> client.generate(...));
 * String text = breakers.execute("cms", () -> cms.publish(...), "fallback");
 * }</pre>
 */
public class ServiceCircuitBreakers {

    private static final Logger log = LoggerFactory.getLogger(ServiceCircuitBreakers.class);

    private final CircuitBreakerRegistry registry;
    private final Duration               failureWindow;
    private final Clock                  clock;
    private final MeterRegistry          meterRegistry;

    /** Time of the first recorded failure of each service's current streak. */
    private final Map<String, Instant> streaks = new ConcurrentHashMap<>();

    /**
     * @param registry      Resilience4j registry whose default config carries threshold, cool-down
     *                      and the recorded / ignored error predicates
     * @param failureWindow failures further apart than this restart the streak
     */
    public ServiceCircuitBreakers(CircuitBreakerRegistry registry,
                                  Duration failureWindow,
                                  Clock clock,
                                  MeterRegistry meterRegistry) {
        this.registry      = registry;
        this.failureWindow = failureWindow;
        this.clock         = clock;
        this.meterRegistry = meterRegistry;
        registry.getEventPublisher().onEntryAdded(event -> event.getAddedEntry().getEventPublisher()
                .onStateTransition(t -> transitioned(t.getCircuitBreakerName(),
                        t.getStateTransition().getFromState(), t.getStateTransition().getToState())));
    }

    // ------------------------------------------------------------------
    // Guarded execution
    // ------------------------------------------------------------------

    /**
     * Run {@code call} through the breaker for {@code service}.
     *
     * @throws CircuitOpenException if the circuit rejects the call
     */
    public <T> T execute(String service, Supplier<T> call) {
        return guard(service, call, false, null);
    }

    /**
     * Run {@code call} through the breaker, returning {@code fallback} without
     * calling when the circuit rejects the call.
     */
    public <T> T execute(String service, Supplier<T> call, T fallback) {
        return guard(service, call, true, fallback);
    }

    private <T> T guard(String service, Supplier<T> call, boolean hasFallback, T fallback) {
        CircuitBreaker breaker = registry.circuitBreaker(service);
        try {
            breaker.acquirePermission();
        } catch (CallNotPermittedException e) {
            meterRegistry.counter("draftpilot.breaker.rejected", "service", service).increment();
            if (hasFallback) {
                log.debug("Circuit for '{}' rejected the call, returning fallback", service);
                return fallback;
            }
            throw new CircuitOpenException(service, e);
        }

        long started = System.nanoTime();
        T result;
        try {
            result = call.get();
        } catch (Throwable t) {
            onError(service, breaker, System.nanoTime() - started, t);
            throw t;
        }
        breaker.onSuccess(System.nanoTime() - started, TimeUnit.NANOSECONDS);
        streaks.remove(service);
        return result;
    }

    private void onError(String service, CircuitBreaker breaker, long durationNanos, Throwable error) {
        if (error instanceof CancellationException || Thread.currentThread().isInterrupted()) {
            breaker.releasePermission();
            return;
        }
        if (breaker.getState() == CircuitBreaker.State.CLOSED && recorded(breaker, error)) {
            restartStaleStreak(service, breaker);
        }
        breaker.onError(durationNanos, TimeUnit.NANOSECONDS, error);
    }

    private static boolean recorded(CircuitBreaker breaker, Throwable error) {
        var config = breaker.getCircuitBreakerConfig();
        return !config.getIgnoreExceptionPredicate().test(error)
                && config.getRecordExceptionPredicate().test(error);
    }

    private void restartStaleStreak(String service, CircuitBreaker breaker) {
        Instant now = clock.instant();
        Instant startedAt = streaks.putIfAbsent(service, now);
        if (startedAt != null && Duration.between(startedAt, now).compareTo(failureWindow) > 0
                && streaks.replace(service, startedAt, now)) {
            log.debug("Failure streak for '{}' older than {}, starting over", service, failureWindow);
            breaker.reset();
            streaks.put(service, now);
        }
    }

    // ------------------------------------------------------------------
    // Inspection
    // ------------------------------------------------------------------

    public CircuitBreaker.State stateOf(String service) {
        return registry.circuitBreaker(service).getState();
    }

    /** Recorded failures in the current window of {@code service}. */
    public int failuresOf(String service) {
        return registry.circuitBreaker(service).getMetrics().getNumberOfFailedCalls();
    }

    /** Current state of every service seen so far, sorted by name. */
    public Map<String, CircuitBreaker.State> states() {
        Map<String, CircuitBreaker.State> out = new TreeMap<>();
        registry.getAllCircuitBreakers().forEach(cb -> out.put(cb.getName(), cb.getState()));
        return out;
    }

    /** Force a service back to CLOSED (operator action / tests). */
    public void reset(String service) {
        registry.circuitBreaker(service).reset();
        streaks.remove(service);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void transitioned(String service, CircuitBreaker.State from, CircuitBreaker.State to) {
        streaks.remove(service);
        meterRegistry.counter("draftpilot.breaker.transitions",
                "service", service, "from", from.name(), "to", to.name()).increment();
        if (to == CircuitBreaker.State.OPEN) {
            log.warn("Circuit for '{}' {} -> {}", service, from, to);
        } else {
            log.info("Circuit for '{}' {} -> {}", service, from, to);
        }
    }
}
