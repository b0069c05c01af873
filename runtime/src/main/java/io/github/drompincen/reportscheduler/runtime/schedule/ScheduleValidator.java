package io.github.drompincen.reportscheduler.runtime.schedule;

import io.github.drompincen.reportscheduler.persistence.document.ReportScheduleDocument;
import io.github.drompincen.reportscheduler.protocol.api.Frequency;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Write-time checks, so that a stored schedule can always be evaluated by the engine.
 */
@Component
public class ScheduleValidator {

    private static final Pattern TIME_OF_DAY = Pattern.compile("([01]\\d|2[0-3]):[0-5]\\d");
    private static final Pattern EMAIL = Pattern.compile("[^@\\s]+@[^@\\s]+\\.[^@\\s]+");

    public void validate(ReportScheduleDocument schedule) {
        List<String> errors = new ArrayList<>();

        if (isBlank(schedule.getName())) {
            errors.add("name is required");
        }
        if (isBlank(schedule.getReportId())) {
            errors.add("reportId is required");
        }
        if (schedule.getTimeOfDay() == null || !TIME_OF_DAY.matcher(schedule.getTimeOfDay()).matches()) {
            errors.add("timeOfDay must be HH:mm (00:00-23:59)");
        }
        if (isBlank(schedule.getTimezone())) {
            errors.add("timezone is required");
        } else {
            try {
                ZoneId.of(schedule.getTimezone());
            } catch (DateTimeException e) {
                errors.add("unknown timezone: " + schedule.getTimezone());
            }
        }

        Frequency frequency = schedule.getFrequency();
        Integer dayOfWeek = schedule.getDayOfWeek();
        Integer dayOfMonth = schedule.getDayOfMonth();
        if (frequency == null) {
            errors.add("frequency is required");
        } else if (frequency == Frequency.WEEKLY) {
            if (dayOfWeek == null || dayOfWeek < 0 || dayOfWeek > 6) {
                errors.add("dayOfWeek must be between 0 (Sunday) and 6 (Saturday)");
            }
            if (dayOfMonth != null) {
                errors.add("dayOfMonth is only allowed for MONTHLY schedules");
            }
        } else if (frequency == Frequency.MONTHLY) {
            if (dayOfMonth == null || dayOfMonth < 1 || dayOfMonth > 31) {
                errors.add("dayOfMonth must be between 1 and 31");
            }
            if (dayOfWeek != null) {
                errors.add("dayOfWeek is only allowed for WEEKLY schedules");
            }
        } else {
            if (dayOfWeek != null) {
                errors.add("dayOfWeek is only allowed for WEEKLY schedules");
            }
            if (dayOfMonth != null) {
                errors.add("dayOfMonth is only allowed for MONTHLY schedules");
            }
        }

        if (schedule.getOutputFormats() == null || schedule.getOutputFormats().isEmpty()) {
            errors.add("at least one output format is required");
        }
        if (schedule.getRecipients() != null) {
            for (String recipient : schedule.getRecipients()) {
                if (recipient == null || !EMAIL.matcher(recipient).matches()) {
                    errors.add("invalid recipient: " + recipient);
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new ScheduleValidationException(errors);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
