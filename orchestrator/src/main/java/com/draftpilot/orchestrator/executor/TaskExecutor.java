package com.draftpilot.orchestrator.executor;

import com.draftpilot.orchestrator.config.ExecutorProperties;
import com.draftpilot.orchestrator.model.Job;
import com.draftpilot.orchestrator.model.JobStatus;
import com.draftpilot.orchestrator.pipeline.PipelineOrchestrator;
import com.draftpilot.orchestrator.resilience.ConnectionPoolHealthMonitor;
import com.draftpilot.orchestrator.service.ClaimLostException;
import com.draftpilot.orchestrator.service.JobStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background executor that drives jobs through the pipeline.
 *
 * The DB is the queue: every poll cycle claims up to as many dispatchable
 * jobs as there are free worker slots (SELECT FOR UPDATE SKIP LOCKED) and
 * hands each to a worker thread. Each run gets a hard deadline; when it fires
 * the job is marked TIMED_OUT, its claim released and the worker interrupted.
 *
 * Backpressure: a cycle claims nothing while the connection pool is critical.
 *
 * Lifecycle is explicit ({@link #start()} / {@link #stop()}) and owned by the
 * Spring context through {@link SmartLifecycle}; it stops before the data
 * source is closed.
 */
@Component
public class TaskExecutor implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    private final JobStore                    store;
    private final PipelineOrchestrator        orchestrator;
    private final ConnectionPoolHealthMonitor poolHealth;
    private final ExecutorProperties          properties;
    private final MeterRegistry               meterRegistry;

    private final ExecutorStats      stats    = new ExecutorStats();
    private final Map<UUID, JobRun>  inFlight = new ConcurrentHashMap<>();
    private final Semaphore          permits;

    private final Object lifecycleLock = new Object();
    private volatile boolean                  running;
    private ScheduledExecutorService          scheduler;
    private ExecutorService                   workers;

    public TaskExecutor(JobStore store,
                        PipelineOrchestrator orchestrator,
                        ConnectionPoolHealthMonitor poolHealth,
                        ExecutorProperties properties,
                        MeterRegistry meterRegistry) {
        this.store         = store;
        this.orchestrator  = orchestrator;
        this.poolHealth    = poolHealth;
        this.properties    = properties;
        this.meterRegistry = meterRegistry;
        this.permits       = new Semaphore(properties.maxConcurrentJobs());
        meterRegistry.gauge("draftpilot.executor.in_flight", inFlight, Map::size);
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                return;
            }
            scheduler = Executors.newScheduledThreadPool(2, named("draftpilot-poll"));
            workers   = Executors.newFixedThreadPool(properties.maxConcurrentJobs(), named("draftpilot-worker"));
            long interval = properties.pollInterval().toMillis();
            scheduler.scheduleWithFixedDelay(this::pollOnce, interval, interval, TimeUnit.MILLISECONDS);
            running = true;
            log.info("Task executor started: poll every {} ms, {} worker(s), job timeout {}",
                    interval, properties.maxConcurrentJobs(), properties.jobTimeout());
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            workers.shutdown();
            try {
                if (!workers.awaitTermination(properties.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("{} run(s) still in flight after {}, interrupting",
                            inFlight.size(), properties.shutdownTimeout());
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workers.shutdownNow();
            }
            scheduler.shutdownNow();
            log.info("Task executor stopped: {}", stats.snapshot());
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.autoStart();
    }

    // ------------------------------------------------------------------
    // Poll cycle
    // ------------------------------------------------------------------

    /**
     * One poll cycle: claim up to the number of free slots and dispatch.
     * Never throws, so a bad cycle cannot kill the schedule.
     *
     * @return number of jobs claimed
     */
    public int pollOnce() {
        if (!running) {
            return 0;
        }
        stats.pollCycles.incrementAndGet();
        try {
            if (poolHealth.isCritical()) {
                stats.skippedCycles.incrementAndGet();
                meterRegistry.counter("draftpilot.executor.skipped_cycles").increment();
                log.warn("Connection pool critical ({}), claiming nothing this cycle",
                        poolHealth.latest().orElse(null));
                return 0;
            }
            int free = permits.availablePermits();
            if (free == 0) {
                return 0;
            }
            List<Job> claimed = store.claimDispatchable(free);
            for (Job job : claimed) {
                dispatch(job);
            }
            if (!claimed.isEmpty()) {
                log.debug("Poll cycle claimed {} job(s)", claimed.size());
            }
            return claimed.size();
        } catch (RuntimeException e) {
            log.error("Poll cycle failed: {}", e.getMessage(), e);
            return 0;
        }
    }

    private void dispatch(Job job) {
        JobRun run = new JobRun(job.getId(), job.getClaimedBy());
        if (!permits.tryAcquire()) {
            log.warn("No free slot for job {}, releasing claim", job.getId());
            store.releaseClaim(job.getId(), run.claimToken());
            return;
        }
        try {
            inFlight.put(job.getId(), run);
            run.attachWorker(workers.submit(() -> execute(run, job)));
            run.attachDeadline(scheduler.schedule(() -> onDeadline(run),
                    properties.jobTimeout().toMillis(), TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            inFlight.remove(job.getId());
            permits.release();
            store.releaseClaim(job.getId(), run.claimToken());
            throw e;
        }
        stats.dispatched.incrementAndGet();
        meterRegistry.counter("draftpilot.executor.dispatched").increment();
        log.info("Dispatched job {} (status={}, run={})", job.getId(), job.getStatus(), run.runId());
    }

    // ------------------------------------------------------------------
    // Worker side
    // ------------------------------------------------------------------

    private void execute(JobRun run, Job job) {
        MDC.put("runId", run.runId());
        try {
            Job finished = orchestrator.run(job);
            if (finished.getStatus() == JobStatus.FAILED) {
                stats.failed.incrementAndGet();
            } else {
                stats.completed.incrementAndGet();
            }
        } catch (ClaimLostException e) {
            stats.claimsLost.incrementAndGet();
            log.warn("Run {} of job {} discarded: {}", run.runId(), run.jobId(), e.getMessage());
        } catch (CancellationException e) {
            log.info("Run {} of job {} cancelled after {} ms", run.runId(), run.jobId(), run.elapsedMs());
        } catch (RuntimeException e) {
            if (run.state() == JobRun.State.TIMED_OUT) {
                log.info("Run {} of job {} ended after timeout: {}", run.runId(), run.jobId(), e.getMessage());
            } else {
                stats.failed.incrementAndGet();
                log.error("Unhandled error in run {} of job {}: {}", run.runId(), run.jobId(), e.getMessage(), e);
            }
        } finally {
            if (run.finish()) {
                run.cancelDeadline();
                releaseClaim(run);
            }
            inFlight.remove(run.jobId());
            permits.release();
            MDC.remove("runId");
        }
    }

    private void onDeadline(JobRun run) {
        if (!run.timeOut()) {
            return;
        }
        stats.timedOut.incrementAndGet();
        meterRegistry.counter("draftpilot.executor.timeouts").increment();
        String detail = "Job exceeded its " + properties.jobTimeout() + " deadline";
        log.warn("Job {} timed out after {} ms (run {})", run.jobId(), run.elapsedMs(), run.runId());
        try {
            // Mark first: once the claim is gone, any late write from the worker fails the ownership check.
            store.markTimedOut(run.jobId(), run.claimToken(), run.elapsedMs(), detail);
        } catch (RuntimeException e) {
            log.error("Could not mark job {} TIMED_OUT; its claim will be reaped as stale: {}",
                    run.jobId(), e.getMessage(), e);
        } finally {
            run.interruptWorker();
        }
    }

    private void releaseClaim(JobRun run) {
        try {
            store.releaseClaim(run.jobId(), run.claimToken());
        } catch (RuntimeException e) {
            log.error("Could not release claim on job {}; it will be reaped as stale: {}",
                    run.jobId(), e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------
    // Inspection
    // ------------------------------------------------------------------

    public ExecutorStats.Snapshot stats() {
        return stats.snapshot();
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
