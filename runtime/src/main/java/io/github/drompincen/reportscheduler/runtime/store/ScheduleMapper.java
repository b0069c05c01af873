package io.github.drompincen.reportscheduler.runtime.store;

import io.github.drompincen.reportscheduler.persistence.document.ReportScheduleDocument;
import io.github.drompincen.reportscheduler.protocol.api.OutputFormat;
import io.github.drompincen.reportscheduler.runtime.scheduler.Schedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.Set;

public final class ScheduleMapper {

    private static final Logger log = LoggerFactory.getLogger(ScheduleMapper.class);
    public static final DateTimeFormatter TIME_OF_DAY = DateTimeFormatter.ofPattern("HH:mm");

    private ScheduleMapper() {}

    public static Schedule toSchedule(ReportScheduleDocument doc) {
        return new Schedule(
                doc.getScheduleId(),
                doc.getName(),
                doc.getReportId(),
                doc.getFrequency(),
                parseTimeOfDay(doc.getScheduleId(), doc.getTimeOfDay()),
                doc.getTimezone(),
                doc.getDayOfWeek(),
                doc.getDayOfMonth(),
                doc.isEnabled(),
                doc.getNextRun(),
                doc.getLastRun(),
                doc.getRunCount(),
                doc.getFailureCount(),
                formats(doc),
                doc.getRecipients(),
                doc.isErrorState(),
                doc.getLastError());
    }

    /** Null when absent or not {@code HH:mm}; the engine flags such schedules. */
    static LocalTime parseTimeOfDay(String scheduleId, String value) {
        if (value == null) return null;
        try {
            return LocalTime.parse(value, TIME_OF_DAY);
        } catch (DateTimeParseException e) {
            log.warn("Schedule {} has malformed timeOfDay '{}'", scheduleId, value);
            return null;
        }
    }

    private static Set<OutputFormat> formats(ReportScheduleDocument doc) {
        if (doc.getOutputFormats() == null || doc.getOutputFormats().isEmpty()) {
            return Set.of();
        }
        return EnumSet.copyOf(doc.getOutputFormats());
    }
}
