package io.github.drompincen.reportscheduler.runtime.scheduler;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.time.zone.ZoneRules;
import java.util.List;
import java.util.Objects;

/**
 * Computes the next firing instant of a schedule in its own timezone.
 *
 * <p>Pure function of its inputs: the same schedule and {@code from} always yield the same instant,
 * and the result is always strictly after {@code from}.
 */
@Component
public class RecurrenceCalculator {

    private static final int MAX_ATTEMPTS = 8;

    private final DstOverlapPolicy overlapPolicy;

    public RecurrenceCalculator(@Value("${reportscheduler.dst-overlap:EARLIER}") DstOverlapPolicy overlapPolicy) {
        this.overlapPolicy = overlapPolicy != null ? overlapPolicy : DstOverlapPolicy.EARLIER;
    }

    public Instant computeNextRun(Schedule schedule, Instant from) {
        Objects.requireNonNull(from, "from");
        if (schedule.frequency() == null) {
            throw new InvalidScheduleException(schedule.id(), "frequency is missing");
        }
        if (schedule.timeOfDay() == null) {
            throw new InvalidScheduleException(schedule.id(), "timeOfDay is missing or malformed");
        }
        ZoneId zone = zoneOf(schedule);
        LocalTime time = schedule.timeOfDay().truncatedTo(ChronoUnit.MINUTES);

        LocalDateTime fromLocal = LocalDateTime.ofInstant(from, zone);
        LocalDate baseline = fromLocal.toLocalDate();
        if (!baseline.atTime(time).isAfter(fromLocal)) {
            baseline = baseline.plusDays(1);
        }

        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            LocalDate target = applyFrequency(schedule, baseline);
            Instant candidate = resolve(target.atTime(time), zone);
            if (candidate.isAfter(from)) {
                return candidate;
            }
            // overlap resolved to an instant we already passed
            baseline = target.plusDays(1);
        }
        throw new InvalidScheduleException(schedule.id(), "no occurrence found after " + from);
    }

    private LocalDate applyFrequency(Schedule schedule, LocalDate baseline) {
        return switch (schedule.frequency()) {
            case DAILY -> baseline;
            case WEEKLY -> baseline.with(TemporalAdjusters.nextOrSame(weekdayOf(schedule)));
            case MONTHLY -> monthly(baseline, dayOfMonthOf(schedule));
            case QUARTERLY -> quarterly(baseline);
        };
    }

    private static LocalDate monthly(LocalDate baseline, int dayOfMonth) {
        YearMonth month = YearMonth.from(baseline);
        LocalDate candidate = clamp(month, dayOfMonth);
        if (candidate.isBefore(baseline)) {
            candidate = clamp(month.plusMonths(1), dayOfMonth);
        }
        return candidate;
    }

    private static LocalDate clamp(YearMonth month, int dayOfMonth) {
        return month.atDay(Math.min(dayOfMonth, month.lengthOfMonth()));
    }

    private static LocalDate quarterly(LocalDate baseline) {
        LocalDate first = baseline.withDayOfMonth(1);
        return first.isBefore(baseline) ? first.plusMonths(3) : first;
    }

    private Instant resolve(LocalDateTime local, ZoneId zone) {
        ZoneRules rules = zone.getRules();
        List<ZoneOffset> offsets = rules.getValidOffsets(local);
        if (offsets.size() == 1) {
            return local.toInstant(offsets.get(0));
        }
        if (offsets.isEmpty()) {
            // spring-forward gap: first valid instant after it
            return rules.getTransition(local).getInstant();
        }
        Instant first = local.toInstant(offsets.get(0));
        Instant second = local.toInstant(offsets.get(1));
        Instant earlier = first.isBefore(second) ? first : second;
        Instant later = first.isBefore(second) ? second : first;
        return overlapPolicy == DstOverlapPolicy.LATER ? later : earlier;
    }

    private static ZoneId zoneOf(Schedule schedule) {
        if (schedule.timezone() == null || schedule.timezone().isBlank()) {
            throw new InvalidScheduleException(schedule.id(), "timezone is missing");
        }
        try {
            return ZoneId.of(schedule.timezone());
        } catch (DateTimeException e) {
            throw new InvalidScheduleException(schedule.id(), "unknown timezone '" + schedule.timezone() + "'", e);
        }
    }

    private static DayOfWeek weekdayOf(Schedule schedule) {
        Integer dow = schedule.dayOfWeek();
        if (dow == null) {
            return DayOfWeek.MONDAY;
        }
        if (dow < 0 || dow > 6) {
            throw new InvalidScheduleException(schedule.id(), "dayOfWeek out of range 0-6: " + dow);
        }
        return DayOfWeek.of(dow == 0 ? 7 : dow);
    }

    private static int dayOfMonthOf(Schedule schedule) {
        Integer dom = schedule.dayOfMonth();
        if (dom == null) {
            throw new InvalidScheduleException(schedule.id(), "dayOfMonth is required for MONTHLY");
        }
        if (dom < 1 || dom > 31) {
            throw new InvalidScheduleException(schedule.id(), "dayOfMonth out of range 1-31: " + dom);
        }
        return dom;
    }
}
