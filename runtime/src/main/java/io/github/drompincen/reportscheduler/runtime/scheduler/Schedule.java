package io.github.drompincen.reportscheduler.runtime.scheduler;

import io.github.drompincen.reportscheduler.protocol.api.Frequency;
import io.github.drompincen.reportscheduler.protocol.api.OutputFormat;

import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;

/**
 * Immutable snapshot of a persisted report schedule, as seen by the engine.
 *
 * <p>{@code timeOfDay} is {@code null} when the stored value could not be parsed; the
 * {@link RecurrenceCalculator} rejects such schedules.
 */
public record Schedule(
        String id,
        String name,
        String reportId,
        Frequency frequency,
        LocalTime timeOfDay,
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
        String lastError
) {

    public Schedule {
        outputFormats = outputFormats != null ? Set.copyOf(outputFormats) : Set.of();
        recipients = recipients != null ? List.copyOf(recipients) : List.of();
    }

    /** A fresh, enabled schedule carrying only its recurrence fields. */
    public static Schedule recurring(String id, Frequency frequency, LocalTime timeOfDay, String timezone,
                                     Integer dayOfWeek, Integer dayOfMonth) {
        return new Schedule(id, null, null, frequency, timeOfDay, timezone, dayOfWeek, dayOfMonth,
                true, null, null, 0, 0, Set.of(), List.of(), false, null);
    }

    public Schedule withNextRun(Instant next) {
        return new Schedule(id, name, reportId, frequency, timeOfDay, timezone, dayOfWeek, dayOfMonth,
                enabled, next, lastRun, runCount, failureCount, outputFormats, recipients, errorState, lastError);
    }
}
