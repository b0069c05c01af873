package io.github.drompincen.reportscheduler.protocol.api;

import java.time.Instant;
import java.util.List;
import java.util.Set;

public record ScheduleResponse(
        String scheduleId,
        String name,
        String description,
        String reportId,
        Frequency frequency,
        String timeOfDay,
        String timezone,
        Integer dayOfWeek,
        Integer dayOfMonth,
        boolean enabled,
        Instant nextRun,
        Instant lastRun,
        long runCount,
        long failureCount,
        Set<OutputFormat> outputFormats,
        List<String> recipients,
        boolean errorState,
        String lastError,
        String createdBy,
        long version,
        Instant createdAt,
        Instant updatedAt
) {}
