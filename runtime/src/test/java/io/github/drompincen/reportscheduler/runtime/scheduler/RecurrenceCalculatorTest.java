package io.github.drompincen.reportscheduler.runtime.scheduler;

import io.github.drompincen.reportscheduler.protocol.api.Frequency;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class RecurrenceCalculatorTest {

    private final RecurrenceCalculator calculator = new RecurrenceCalculator(DstOverlapPolicy.EARLIER);

    // ------------------------------------------------------------------
    // Daily
    // ------------------------------------------------------------------

    @Test
    void daily_sameDay_whenTimeNotYetReached() {
        Schedule s = daily("09:00", "UTC");

        assertThat(calculator.computeNextRun(s, Instant.parse("2024-01-03T08:00:00Z")))
                .isEqualTo(Instant.parse("2024-01-03T09:00:00Z"));
    }

    @Test
    void daily_nextDay_whenTimeAlreadyPassed() {
        Schedule s = daily("09:00", "UTC");

        assertThat(calculator.computeNextRun(s, Instant.parse("2024-01-03T10:00:00Z")))
                .isEqualTo(Instant.parse("2024-01-04T09:00:00Z"));
    }

    @Test
    void daily_nextDay_whenExactlyAtTimeOfDay() {
        Schedule s = daily("09:00", "UTC");

        assertThat(calculator.computeNextRun(s, Instant.parse("2024-01-03T09:00:00Z")))
                .isEqualTo(Instant.parse("2024-01-04T09:00:00Z"));
    }

    @Test
    void daily_isTwentyThreeHoursApart_acrossSpringForward() {
        Schedule s = daily("09:00", "Europe/Berlin");

        Instant first = calculator.computeNextRun(s, Instant.parse("2024-03-30T07:00:00Z"));
        Instant second = calculator.computeNextRun(s, first);

        assertThat(first).isEqualTo(Instant.parse("2024-03-30T08:00:00Z"));
        assertThat(second).isEqualTo(Instant.parse("2024-03-31T07:00:00Z"));
        assertThat(Duration.between(first, second)).isEqualTo(Duration.ofHours(23));
    }

    @Test
    void daily_isTwentyFiveHoursApart_acrossFallBack() {
        Schedule s = daily("09:00", "Europe/Berlin");

        Instant first = calculator.computeNextRun(s, Instant.parse("2024-10-26T06:00:00Z"));
        Instant second = calculator.computeNextRun(s, first);

        assertThat(first).isEqualTo(Instant.parse("2024-10-26T07:00:00Z"));
        assertThat(second).isEqualTo(Instant.parse("2024-10-27T08:00:00Z"));
        assertThat(Duration.between(first, second)).isEqualTo(Duration.ofHours(25));
    }

    @Test
    void daily_usesScheduleTimezone() {
        Schedule s = daily("09:00", "America/New_York");

        assertThat(calculator.computeNextRun(s, Instant.parse("2024-01-03T10:00:00Z")))
                .isEqualTo(Instant.parse("2024-01-03T14:00:00Z"));
    }

    // ------------------------------------------------------------------
    // Weekly
    // ------------------------------------------------------------------

    @Test
    void weekly_mondayAtNine_fromWednesday() {
        Schedule s = Schedule.recurring("w1", Frequency.WEEKLY, LocalTime.of(9, 0), "UTC", 1, null);

        assertThat(calculator.computeNextRun(s, Instant.parse("2024-01-03T10:00:00Z")))
                .isEqualTo(Instant.parse("2024-01-08T09:00:00Z"));
    }

    @Test
    void weekly_zeroMeansSunday() {
        Schedule s = Schedule.recurring("w0", Frequency.WEEKLY, LocalTime.of(9, 0), "UTC", 0, null);

        assertThat(calculator.computeNextRun(s, Instant.parse("2024-01-03T10:00:00Z")))
                .isEqualTo(Instant.parse("2024-01-07T09:00:00Z"));
    }

    @Test
    void weekly_defaultsToMonday_whenDayOfWeekMissing() {
        Schedule s = Schedule.recurring("w", Frequency.WEEKLY, LocalTime.of(9, 0), "UTC", null, null);

        Instant next = calculator.computeNextRun(s, Instant.parse("2024-01-03T10:00:00Z"));

        assertThat(next.atZone(ZoneId.of("UTC")).getDayOfWeek()).isEqualTo(DayOfWeek.MONDAY);
    }

    @Test
    void weekly_sameDay_whenTimeNotYetReached() {
        Schedule s = Schedule.recurring("w3", Frequency.WEEKLY, LocalTime.of(18, 30), "UTC", 3, null);

        assertThat(calculator.computeNextRun(s, Instant.parse("2024-01-03T10:00:00Z")))
                .isEqualTo(Instant.parse("2024-01-03T18:30:00Z"));
    }

    @Test
    void weekly_resultIsEarliestMatchingWeekdayAfterFrom() {
        ZoneId zone = ZoneId.of("Australia/Sydney");
        List<Instant> froms = List.of(
                Instant.parse("2024-01-03T10:00:00Z"),
                Instant.parse("2024-04-06T15:59:00Z"),
                Instant.parse("2024-10-05T23:00:00Z"),
                Instant.parse("2024-12-31T12:00:00Z"));

        for (int dow = 0; dow <= 6; dow++) {
            Schedule s = Schedule.recurring("w" + dow, Frequency.WEEKLY, LocalTime.of(7, 15),
                    zone.getId(), dow, null);
            DayOfWeek expected = DayOfWeek.of(dow == 0 ? 7 : dow);
            for (Instant from : froms) {
                Instant next = calculator.computeNextRun(s, from);
                ZonedDateTime local = next.atZone(zone);

                assertThat(next).isAfter(from);
                assertThat(local.getDayOfWeek()).isEqualTo(expected);
                assertThat(local.toLocalTime()).isEqualTo(LocalTime.of(7, 15));
                assertThat(local.minusWeeks(1).toInstant()).isBeforeOrEqualTo(from);
            }
        }
    }

    // ------------------------------------------------------------------
    // Monthly / quarterly
    // ------------------------------------------------------------------

    @Test
    void monthly_day31_clampsToLeapFebruary() {
        Schedule s = Schedule.recurring("m31", Frequency.MONTHLY, LocalTime.MIDNIGHT, "UTC", null, 31);

        assertThat(calculator.computeNextRun(s, Instant.parse("2024-02-15T00:00:00Z")))
                .isEqualTo(Instant.parse("2024-02-29T00:00:00Z"));
    }

    @Test
    void monthly_day31_clampsToLastDayOfThirtyDayMonth() {
        Schedule s = Schedule.recurring("m31", Frequency.MONTHLY, LocalTime.MIDNIGHT, "UTC", null, 31);

        assertThat(calculator.computeNextRun(s, Instant.parse("2024-04-10T12:00:00Z")))
                .isEqualTo(Instant.parse("2024-04-30T00:00:00Z"));
    }

    @Test
    void monthly_afterClampedDay_movesToFollowingMonth() {
        Schedule s = Schedule.recurring("m31", Frequency.MONTHLY, LocalTime.MIDNIGHT, "UTC", null, 31);

        assertThat(calculator.computeNextRun(s, Instant.parse("2024-04-30T00:00:00Z")))
                .isEqualTo(Instant.parse("2024-05-31T00:00:00Z"));
    }

    @Test
    void monthly_dayAlreadyPassed_usesNextMonth() {
        Schedule s = Schedule.recurring("m5", Frequency.MONTHLY, LocalTime.of(6, 0), "UTC", null, 5);

        assertThat(calculator.computeNextRun(s, Instant.parse("2024-01-10T00:00:00Z")))
                .isEqualTo(Instant.parse("2024-02-05T06:00:00Z"));
    }

    @Test
    void quarterly_firstOfMonth_whenBaselineIsFirst() {
        Schedule s = Schedule.recurring("q", Frequency.QUARTERLY, LocalTime.of(6, 0), "UTC", null, null);

        assertThat(calculator.computeNextRun(s, Instant.parse("2024-01-01T00:00:00Z")))
                .isEqualTo(Instant.parse("2024-01-01T06:00:00Z"));
    }

    @Test
    void quarterly_advancesThreeMonths_fromMidMonth() {
        Schedule s = Schedule.recurring("q", Frequency.QUARTERLY, LocalTime.of(6, 0), "UTC", null, null);

        assertThat(calculator.computeNextRun(s, Instant.parse("2024-01-15T00:00:00Z")))
                .isEqualTo(Instant.parse("2024-04-01T06:00:00Z"));
    }

    // ------------------------------------------------------------------
    // DST gap / overlap
    // ------------------------------------------------------------------

    @Test
    void dstGap_resolvesToTransitionInstant() {
        Schedule s = daily("02:30", "Europe/Berlin");

        assertThat(calculator.computeNextRun(s, Instant.parse("2024-03-30T12:00:00Z")))
                .isEqualTo(Instant.parse("2024-03-31T01:00:00Z"));
    }

    @Test
    void dstOverlap_picksEarlierInstant_byDefault() {
        Schedule s = daily("02:30", "Europe/Berlin");

        assertThat(calculator.computeNextRun(s, Instant.parse("2024-10-26T12:00:00Z")))
                .isEqualTo(Instant.parse("2024-10-27T00:30:00Z"));
    }

    @Test
    void dstOverlap_picksLaterInstant_whenConfigured() {
        RecurrenceCalculator later = new RecurrenceCalculator(DstOverlapPolicy.LATER);
        Schedule s = daily("02:30", "Europe/Berlin");

        assertThat(later.computeNextRun(s, Instant.parse("2024-10-26T12:00:00Z")))
                .isEqualTo(Instant.parse("2024-10-27T01:30:00Z"));
    }

    @Test
    void dstOverlap_movesToNextDay_whenEarlierInstantAlreadyPassed() {
        Schedule s = daily("02:30", "Europe/Berlin");

        assertThat(calculator.computeNextRun(s, Instant.parse("2024-10-27T01:00:00Z")))
                .isEqualTo(Instant.parse("2024-10-28T01:30:00Z"));
    }

    // ------------------------------------------------------------------
    // Determinism and errors
    // ------------------------------------------------------------------

    @Test
    void computeNextRun_isIdempotent_andStrictlyIncreasing() {
        Schedule s = Schedule.recurring("m", Frequency.MONTHLY, LocalTime.of(23, 45), "Asia/Kolkata", null, 30);
        Instant from = Instant.parse("2024-02-01T00:00:00Z");

        Instant first = calculator.computeNextRun(s, from);

        assertThat(calculator.computeNextRun(s, from)).isEqualTo(first);
        assertThat(calculator.computeNextRun(s, first)).isAfter(first);
    }

    @Test
    void unknownTimezone_throwsInvalidSchedule() {
        Schedule s = daily("09:00", "Mars/Olympus_Mons");

        assertThatThrownBy(() -> calculator.computeNextRun(s, Instant.parse("2024-01-03T10:00:00Z")))
                .isInstanceOf(InvalidScheduleException.class)
                .hasMessageContaining("unknown timezone");
    }

    @Test
    void monthlyWithoutDay_throwsInvalidSchedule() {
        Schedule s = Schedule.recurring("m", Frequency.MONTHLY, LocalTime.NOON, "UTC", null, null);

        assertThatThrownBy(() -> calculator.computeNextRun(s, Instant.parse("2024-01-03T10:00:00Z")))
                .isInstanceOf(InvalidScheduleException.class)
                .hasMessageContaining("dayOfMonth");
    }

    @Test
    void weeklyOutOfRange_throwsInvalidSchedule() {
        Schedule s = Schedule.recurring("w", Frequency.WEEKLY, LocalTime.NOON, "UTC", 7, null);

        assertThatThrownBy(() -> calculator.computeNextRun(s, Instant.parse("2024-01-03T10:00:00Z")))
                .isInstanceOf(InvalidScheduleException.class);
    }

    @Test
    void missingTimeOfDay_throwsInvalidSchedule() {
        Schedule s = Schedule.recurring("d", Frequency.DAILY, null, "UTC", null, null);

        InvalidScheduleException e = catchThrowableOfType(
                () -> calculator.computeNextRun(s, Instant.parse("2024-01-03T10:00:00Z")),
                InvalidScheduleException.class);

        assertThat(e).isNotNull();
        assertThat(e.getScheduleId()).isEqualTo("d");
    }

    private static Schedule daily(String time, String zone) {
        return Schedule.recurring("d-" + time, Frequency.DAILY, LocalTime.parse(time), zone, null, null);
    }
}
