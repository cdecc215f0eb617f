package com.draftpilot.orchestrator.executor;

import com.draftpilot.orchestrator.config.ExecutorProperties;
import com.draftpilot.orchestrator.service.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Releases claims left behind by a crashed process so its jobs resume.
 *
 * A live run holds its claim for at most the job timeout, so anything older
 * than the lease (timeout + grace) has no owner left.
 */
@Component
@EnableScheduling
public class StaleClaimReaper {

    private static final Logger log = LoggerFactory.getLogger(StaleClaimReaper.class);

    private final JobStore           store;
    private final ExecutorProperties properties;
    private final Clock              clock;

    public StaleClaimReaper(JobStore store, ExecutorProperties properties, Clock clock) {
        this.store      = store;
        this.properties = properties;
        this.clock      = clock;
    }

    @Scheduled(fixedDelayString = "${draftpilot.executor.stale-claim-sweep-interval:PT1M}")
    public void scheduledSweep() {
        sweep();
    }

    /** @return number of claims released */
    public int sweep() {
        Instant cutoff = clock.instant().minus(properties.claimLease());
        try {
            int released = store.releaseStaleClaims(cutoff);
            if (released > 0) {
                log.warn("Released {} stale claim(s) older than {}", released, cutoff);
            }
            return released;
        } catch (RuntimeException e) {
            log.error("Stale claim sweep failed: {}", e.getMessage(), e);
            return 0;
        }
    }
}
