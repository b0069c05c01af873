package io.github.drompincen.reportscheduler.runtime.schedule;

import io.github.drompincen.reportscheduler.persistence.document.ReportRunDocument;
import io.github.drompincen.reportscheduler.persistence.document.ReportScheduleDocument;

import java.util.List;

public record ScheduleStatus(ReportScheduleDocument schedule, List<ReportRunDocument> recentRuns) {}
