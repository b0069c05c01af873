package io.github.drompincen.reportscheduler.gateway.controller;

import io.github.drompincen.reportscheduler.persistence.document.ReportRunDocument;
import io.github.drompincen.reportscheduler.persistence.document.ReportScheduleDocument;
import io.github.drompincen.reportscheduler.protocol.api.OutputFormat;
import io.github.drompincen.reportscheduler.protocol.api.RunRecordResponse;
import io.github.drompincen.reportscheduler.protocol.api.ScheduleResponse;
import io.github.drompincen.reportscheduler.protocol.api.ScheduleStatusResponse;
import io.github.drompincen.reportscheduler.runtime.schedule.ScheduleStatus;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

final class ReportResponses {

    private ReportResponses() {}

    static ScheduleResponse toScheduleResponse(ReportScheduleDocument doc) {
        return new ScheduleResponse(
                doc.getScheduleId(),
                doc.getName(),
                doc.getDescription(),
                doc.getReportId(),
                doc.getFrequency(),
                doc.getTimeOfDay(),
                doc.getTimezone(),
                doc.getDayOfWeek(),
                doc.getDayOfMonth(),
                doc.isEnabled(),
                doc.getNextRun(),
                doc.getLastRun(),
                doc.getRunCount(),
                doc.getFailureCount(),
                formats(doc.getOutputFormats()),
                doc.getRecipients() != null ? List.copyOf(doc.getRecipients()) : List.of(),
                doc.isErrorState(),
                doc.getLastError(),
                doc.getCreatedBy(),
                doc.getVersion(),
                doc.getCreatedAt(),
                doc.getUpdatedAt()
        );
    }

    static RunRecordResponse toRunResponse(ReportRunDocument doc) {
        return new RunRecordResponse(
                doc.getRunId(),
                doc.getScheduleId(),
                doc.getScheduledFor(),
                doc.getFiredAt(),
                doc.getFinishedAt(),
                doc.getDurationMs(),
                doc.getResultStatus(),
                doc.getErrorMessage(),
                doc.getArtifactRef(),
                formats(doc.getOutputFormats()),
                doc.getInstanceId()
        );
    }

    static ScheduleStatusResponse toStatusResponse(ScheduleStatus status) {
        ReportScheduleDocument doc = status.schedule();
        return new ScheduleStatusResponse(
                doc.getScheduleId(),
                doc.isEnabled(),
                doc.isErrorState(),
                doc.getLastRun(),
                doc.getNextRun(),
                doc.getRunCount(),
                doc.getFailureCount(),
                doc.getLastError(),
                status.recentRuns().stream().map(ReportResponses::toRunResponse).toList()
        );
    }

    private static Set<OutputFormat> formats(List<OutputFormat> formats) {
        return formats == null || formats.isEmpty() ? Set.of() : EnumSet.copyOf(formats);
    }
}
