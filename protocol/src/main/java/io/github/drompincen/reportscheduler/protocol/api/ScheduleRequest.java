package io.github.drompincen.reportscheduler.protocol.api;

import java.util.List;
import java.util.Set;

/**
 * Create / update payload for a report schedule. On update every {@code null} field is left as is.
 */
public record ScheduleRequest(
        String name,
        String description,
        String reportId,
        Frequency frequency,
        String timeOfDay,
        String timezone,
        Integer dayOfWeek,
        Integer dayOfMonth,
        Boolean enabled,
        Set<OutputFormat> outputFormats,
        List<String> recipients
) {}
