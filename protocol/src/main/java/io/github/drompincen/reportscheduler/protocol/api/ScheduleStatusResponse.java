package io.github.drompincen.reportscheduler.protocol.api;

import java.time.Instant;
import java.util.List;

public record ScheduleStatusResponse(
        String scheduleId,
        boolean enabled,
        boolean errorState,
        Instant lastRun,
        Instant nextRun,
        long runCount,
        long failureCount,
        String lastError,
        List<RunRecordResponse> recentRuns
) {}
