package io.github.drompincen.reportscheduler.runtime.scheduler;

import java.time.Instant;

public record ScheduleUpdate(
        Instant claimedNextRun,
        Instant nextRun,
        Instant lastRun,
        boolean failed,
        String lastError,
        boolean errorState
) {}
