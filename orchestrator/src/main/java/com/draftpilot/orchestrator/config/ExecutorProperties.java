package com.draftpilot.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Task executor settings ({@code draftpilot.executor.*}).
 *
 * @param pollInterval      pause between poll cycles
 * @param maxConcurrentJobs jobs allowed in flight at once
 * @param jobTimeout        hard wall-clock deadline for one job run
 * @param claimGrace        extra time after {@code jobTimeout} before a claim is considered stale
 * @param shutdownTimeout   how long {@code stop()} waits for in-flight runs
 * @param autoStart         start polling with the application context
 */
@ConfigurationProperties(prefix = "draftpilot.executor")
public record ExecutorProperties(
        @DefaultValue("5s")   Duration pollInterval,
        @DefaultValue("4")    int      maxConcurrentJobs,
        @DefaultValue("15m")  Duration jobTimeout,
        @DefaultValue("2m")   Duration claimGrace,
        @DefaultValue("30s")  Duration shutdownTimeout,
        @DefaultValue("true") boolean  autoStart
) {

    /** Claims older than this were left behind by a crashed run. */
    public Duration claimLease() {
        return jobTimeout.plus(claimGrace);
    }
}
