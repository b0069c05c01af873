package io.github.drompincen.reportscheduler.runtime.store;

import io.github.drompincen.reportscheduler.persistence.document.ReportScheduleDocument;
import io.github.drompincen.reportscheduler.protocol.api.Frequency;
import io.github.drompincen.reportscheduler.protocol.api.OutputFormat;
import io.github.drompincen.reportscheduler.runtime.scheduler.Schedule;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduleMapperTest {

    @Test
    void toSchedule_copiesRecurrenceAndCounters() {
        ReportScheduleDocument doc = new ReportScheduleDocument();
        doc.setScheduleId("m1");
        doc.setFrequency(Frequency.MONTHLY);
        doc.setTimeOfDay("23:59");
        doc.setTimezone("Europe/Paris");
        doc.setDayOfMonth(31);
        doc.setRunCount(7);
        doc.setFailureCount(2);
        doc.setOutputFormats(List.of(OutputFormat.EXCEL, OutputFormat.PDF));

        Schedule schedule = ScheduleMapper.toSchedule(doc);

        assertThat(schedule.timeOfDay()).isEqualTo(LocalTime.of(23, 59));
        assertThat(schedule.dayOfMonth()).isEqualTo(31);
        assertThat(schedule.runCount()).isEqualTo(7);
        assertThat(schedule.failureCount()).isEqualTo(2);
        assertThat(schedule.outputFormats()).containsExactlyInAnyOrder(OutputFormat.EXCEL, OutputFormat.PDF);
    }

    @Test
    void malformedTimeOfDay_mapsToNull() {
        ReportScheduleDocument doc = new ReportScheduleDocument();
        doc.setScheduleId("bad");
        doc.setTimeOfDay("25:99");

        assertThat(ScheduleMapper.toSchedule(doc).timeOfDay()).isNull();
    }
}
