package com.draftpilot.orchestrator.resilience;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;

/**
 * Samples HikariCP through its pool MXBean and times one test borrow.
 *
 * The test borrow is bounded by the pool's own {@code connectionTimeout}; a borrow
 * that times out marks the sample as failed.
 */
public class HikariPoolMetricsSource implements PoolMetricsSource {

    private static final Logger log = LoggerFactory.getLogger(HikariPoolMetricsSource.class);

    private final HikariDataSource dataSource;
    private final Clock            clock;

    public HikariPoolMetricsSource(HikariDataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock      = clock;
    }

    @Override
    public PoolSnapshot sample() {
        int max = dataSource.getMaximumPoolSize();
        HikariPoolMXBean pool = dataSource.getHikariPoolMXBean();
        if (pool == null) {
            // Pool not started yet: nothing borrowed, nothing waiting.
            return new PoolSnapshot(0, 0, 0, max, 0, Duration.ZERO, false, clock.instant());
        }

        long start = System.nanoTime();
        boolean borrowFailed = false;
        try (Connection ignored = dataSource.getConnection()) {
            // borrowed and returned
        } catch (SQLException e) {
            borrowFailed = true;
            log.warn("Connection pool test borrow failed: {}", e.getMessage());
        }
        Duration latency = Duration.ofNanos(System.nanoTime() - start);

        return new PoolSnapshot(
                pool.getActiveConnections(),
                pool.getIdleConnections(),
                pool.getTotalConnections(),
                max,
                pool.getThreadsAwaitingConnection(),
                latency,
                borrowFailed,
                clock.instant());
    }
}
