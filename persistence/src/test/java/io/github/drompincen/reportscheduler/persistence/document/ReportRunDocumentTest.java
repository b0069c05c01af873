package io.github.drompincen.reportscheduler.persistence.document;

import io.github.drompincen.reportscheduler.protocol.api.ResultStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ReportRunDocumentTest {

    @Test
    void runFieldsPreserved() {
        ReportRunDocument doc = new ReportRunDocument();
        Instant fired = Instant.parse("2024-02-29T00:00:05Z");

        doc.setRunId("run-1");
        doc.setScheduleId("rs-1");
        doc.setScheduledFor(Instant.parse("2024-02-29T00:00:00Z"));
        doc.setFiredAt(fired);
        doc.setFinishedAt(fired.plusMillis(2500));
        doc.setDurationMs(2500);
        doc.setResultStatus(ResultStatus.FAIL);
        doc.setErrorMessage("renderer timed out");

        assertThat(doc.getScheduledFor()).isBefore(doc.getFiredAt());
        assertThat(doc.getFinishedAt()).isAfter(doc.getFiredAt());
        assertThat(doc.getResultStatus()).isEqualTo(ResultStatus.FAIL);
        assertThat(doc.getErrorMessage()).isEqualTo("renderer timed out");
        assertThat(doc.getOutputFormats()).isEmpty();
    }
}
