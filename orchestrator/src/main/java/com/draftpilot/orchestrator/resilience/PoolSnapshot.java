package com.draftpilot.orchestrator.resilience;

import java.time.Duration;
import java.time.Instant;

/**
 * One sample of the database connection pool.
 *
 * @param acquisitionLatency time the test borrow needed to borrow a connection
 * @param borrowFailed        the test borrow could not get a connection at all
 */
public record PoolSnapshot(int active,
                           int idle,
                           int total,
                           int max,
                           int awaitingConnection,
                           Duration acquisitionLatency,
                           boolean borrowFailed,
                           Instant sampledAt) {

    public double utilisation() {
        return max <= 0 ? 0.0 : (double) active / max;
    }
}
