package com.draftpilot.orchestrator.executor;

import java.util.UUID;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One in-flight execution of a claimed job.
 *
 * The worker finishing and the deadline firing race through a single CAS on
 * {@link #state}; only the winner releases the claim, so a timed-out run
 * never overwrites TIMED_OUT and a finished run is never timed out.
 */
final class JobRun {

    enum State { RUNNING, FINISHED, TIMED_OUT }

    private final AtomicReference<State> state = new AtomicReference<>(State.RUNNING);

    private final UUID   jobId;
    private final String claimToken;
    private final String runId;
    private final long   startedNanos;

    private volatile Future<?>          worker;
    private volatile ScheduledFuture<?> deadline;

    JobRun(UUID jobId, String claimToken) {
        this.jobId        = jobId;
        this.claimToken   = claimToken;
        this.runId        = UUID.randomUUID().toString().substring(0, 8);
        this.startedNanos = System.nanoTime();
    }

    /** @return true if this call ended the run */
    boolean finish() {
        return state.compareAndSet(State.RUNNING, State.FINISHED);
    }

    /** @return true if the deadline won the race */
    boolean timeOut() {
        return state.compareAndSet(State.RUNNING, State.TIMED_OUT);
    }

    void attachWorker(Future<?> worker)             { this.worker = worker; }
    void attachDeadline(ScheduledFuture<?> deadline) { this.deadline = deadline; }

    void interruptWorker() {
        Future<?> f = worker;
        if (f != null) {
            f.cancel(true);
        }
    }

    void cancelDeadline() {
        ScheduledFuture<?> d = deadline;
        if (d != null) {
            d.cancel(false);
        }
    }

    long elapsedMs() {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }

    State  state()      { return state.get(); }
    UUID   jobId()      { return jobId; }
    String claimToken() { return claimToken; }
    String runId()      { return runId; }
}
