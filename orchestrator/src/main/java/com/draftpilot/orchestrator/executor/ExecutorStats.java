package com.draftpilot.orchestrator.executor;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Running counters of the task executor, logged on shutdown.
 */
public class ExecutorStats {

    /** Point-in-time copy of the counters. */
    public record Snapshot(long pollCycles,
                           long skippedCycles,
                           long dispatched,
                           long completed,
                           long failed,
                           long timedOut,
                           long claimsLost) {}

    final AtomicLong pollCycles    = new AtomicLong();
    final AtomicLong skippedCycles = new AtomicLong();
    final AtomicLong dispatched    = new AtomicLong();
    final AtomicLong completed     = new AtomicLong();
    final AtomicLong failed        = new AtomicLong();
    final AtomicLong timedOut      = new AtomicLong();
    final AtomicLong claimsLost    = new AtomicLong();

    public Snapshot snapshot() {
        return new Snapshot(pollCycles.get(), skippedCycles.get(), dispatched.get(),
                completed.get(), failed.get(), timedOut.get(), claimsLost.get());
    }
}
