package io.github.drompincen.reportscheduler.runtime.scheduler;

import java.time.Duration;
import java.util.UUID;

/**
 * Tuning for the scheduler loop and the claim protocol.
 *
 * @param pollInterval        delay between two ticks
 * @param workerThreads       concurrent renders per instance
 * @param drainTimeout        how long {@code stop()} waits for in-flight renders
 * @param claimLease          how long a claim stays valid without a heartbeat
 * @param storeRetryAttempts  store calls per tick before the tick gives up
 * @param storeRetryBackoff   first backoff, doubled after every failed attempt
 * @param initializeBatchSize schedules assigned a first {@code nextRun} per tick
 * @param instanceId          claim owner written to the store
 */
public record SchedulerProperties(
        Duration pollInterval,
        int workerThreads,
        Duration drainTimeout,
        Duration claimLease,
        int storeRetryAttempts,
        Duration storeRetryBackoff,
        int initializeBatchSize,
        String instanceId
) {

    public SchedulerProperties {
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        if (claimLease == null || claimLease.isNegative() || claimLease.isZero()) {
            throw new IllegalArgumentException("claimLease must be positive");
        }
        workerThreads = Math.max(1, workerThreads);
        storeRetryAttempts = Math.max(1, storeRetryAttempts);
        initializeBatchSize = Math.max(1, initializeBatchSize);
        drainTimeout = drainTimeout != null ? drainTimeout : Duration.ofSeconds(30);
        storeRetryBackoff = storeRetryBackoff != null ? storeRetryBackoff : Duration.ZERO;
        instanceId = instanceId != null && !instanceId.isBlank()
                ? instanceId
                : UUID.randomUUID().toString().substring(0, 8);
    }

    public static SchedulerProperties defaults() {
        return new SchedulerProperties(Duration.ofSeconds(30), 4, Duration.ofSeconds(30),
                Duration.ofMinutes(10), 3, Duration.ofMillis(500), 100, null);
    }
}
