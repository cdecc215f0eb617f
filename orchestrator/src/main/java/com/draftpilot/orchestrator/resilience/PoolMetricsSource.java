package com.draftpilot.orchestrator.resilience;

/** Reads the current figures of a connection pool. */
@FunctionalInterface
public interface PoolMetricsSource {

    PoolSnapshot sample();
}
