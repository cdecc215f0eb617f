package com.draftpilot.orchestrator.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks the database connection pool so the task executor can stop taking
 * work before the pool itself gives out.
 *
 * <ul>
 *   <li>degraded: utilisation at or above the degraded ratio, any thread
 *       waiting for a connection, or borrow latency above the degraded limit.</li>
 *   <li>critical: every connection in use with threads waiting, the test borrow
 *       failed, or borrow latency above the critical limit.</li>
 * </ul>
 *
 * Samples are taken on a schedule ({@link #sample()}) and on demand when the
 * last one is older than {@code maxSampleAge}.
 */
public class ConnectionPoolHealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(ConnectionPoolHealthMonitor.class);

    /**
     * @param degradedUtilisation active/max ratio that counts as degraded
     * @param degradedLatency     borrow latency that counts as degraded
     * @param criticalLatency     borrow latency that counts as critical
     * @param maxSampleAge        older samples are refreshed before use
     */
    public record Thresholds(double degradedUtilisation,
                             Duration degradedLatency,
                             Duration criticalLatency,
                             Duration maxSampleAge) {}

    private final PoolMetricsSource source;
    private final Thresholds        thresholds;
    private final Clock             clock;

    private final AtomicReference<PoolSnapshot> latest = new AtomicReference<>();

    public ConnectionPoolHealthMonitor(PoolMetricsSource source, Thresholds thresholds, Clock clock) {
        this.source     = source;
        this.thresholds = thresholds;
        this.clock      = clock;
    }

    /** Take a fresh sample and remember it. */
    public PoolSnapshot sample() {
        PoolSnapshot snapshot = source.sample();
        PoolSnapshot previous = latest.getAndSet(snapshot);
        boolean wasCritical = previous != null && isCritical(previous);
        boolean nowCritical = isCritical(snapshot);
        if (nowCritical && !wasCritical) {
            log.warn("Connection pool CRITICAL: active={}/{} waiting={} latency={}ms borrowFailed={}",
                    snapshot.active(), snapshot.max(), snapshot.awaitingConnection(),
                    snapshot.acquisitionLatency().toMillis(), snapshot.borrowFailed());
        } else if (!nowCritical && wasCritical) {
            log.info("Connection pool recovered: active={}/{} waiting={}",
                    snapshot.active(), snapshot.max(), snapshot.awaitingConnection());
        } else if (isDegraded(snapshot)) {
            log.debug("Connection pool degraded: active={}/{} waiting={} latency={}ms",
                    snapshot.active(), snapshot.max(), snapshot.awaitingConnection(),
                    snapshot.acquisitionLatency().toMillis());
        }
        return snapshot;
    }

    public boolean isDegraded() {
        return isDegraded(current());
    }

    public boolean isCritical() {
        return isCritical(current());
    }

    public Optional<PoolSnapshot> latest() {
        return Optional.ofNullable(latest.get());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private PoolSnapshot current() {
        PoolSnapshot snapshot = latest.get();
        if (snapshot == null
                || Duration.between(snapshot.sampledAt(), clock.instant()).compareTo(thresholds.maxSampleAge()) > 0) {
            return sample();
        }
        return snapshot;
    }

    private boolean isDegraded(PoolSnapshot s) {
        return isCritical(s)
                || s.utilisation() >= thresholds.degradedUtilisation()
                || s.awaitingConnection() > 0
                || s.acquisitionLatency().compareTo(thresholds.degradedLatency()) > 0;
    }

    private boolean isCritical(PoolSnapshot s) {
        boolean exhausted = s.max() > 0 && s.active() >= s.max() && s.awaitingConnection() > 0;
        return exhausted
                || s.borrowFailed()
                || s.acquisitionLatency().compareTo(thresholds.criticalLatency()) > 0;
    }
}
