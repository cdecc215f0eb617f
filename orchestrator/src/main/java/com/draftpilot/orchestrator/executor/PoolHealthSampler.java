package com.draftpilot.orchestrator.executor;

import com.draftpilot.orchestrator.resilience.ConnectionPoolHealthMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Keeps the pool health sample fresh between poll cycles.
 */
@Component
public class PoolHealthSampler {

    private static final Logger log = LoggerFactory.getLogger(PoolHealthSampler.class);

    private final ConnectionPoolHealthMonitor monitor;

    public PoolHealthSampler(ConnectionPoolHealthMonitor monitor) {
        this.monitor = monitor;
    }

    @Scheduled(fixedDelayString = "${draftpilot.pool-health.sample-interval:PT5S}")
    public void sample() {
        try {
            monitor.sample();
        } catch (RuntimeException e) {
            log.error("Connection pool sample failed: {}", e.getMessage(), e);
        }
    }
}
