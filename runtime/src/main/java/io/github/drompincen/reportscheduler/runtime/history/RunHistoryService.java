package io.github.drompincen.reportscheduler.runtime.history;

import io.github.drompincen.reportscheduler.persistence.document.ReportRunDocument;
import io.github.drompincen.reportscheduler.persistence.repository.ReportRunRepository;
import io.github.drompincen.reportscheduler.protocol.api.OutputFormat;
import io.github.drompincen.reportscheduler.protocol.api.ResultStatus;
import io.github.drompincen.reportscheduler.protocol.api.RunStatsResponse;
import io.github.drompincen.reportscheduler.runtime.scheduler.RunResult;
import io.github.drompincen.reportscheduler.runtime.scheduler.RunResultListener;
import io.github.drompincen.reportscheduler.runtime.scheduler.SchedulerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only log of report runs in {@code report_runs}, plus the queries over it.
 */
@Service
public class RunHistoryService implements RunResultListener {

    private static final Logger log = LoggerFactory.getLogger(RunHistoryService.class);
    private static final int MAX_PAGE_SIZE = 200;
    private static final Duration DEFAULT_STATS_WINDOW = Duration.ofDays(30);

    private final ReportRunRepository runRepository;
    private final Clock clock;
    private final String instanceId;

    public RunHistoryService(ReportRunRepository runRepository, Clock clock, SchedulerProperties properties) {
        this.runRepository = runRepository;
        this.clock = clock;
        this.instanceId = properties.instanceId();
    }

    @Override
    public void onRunResult(RunResult result) {
        ReportRunDocument run = new ReportRunDocument();
        run.setRunId(UUID.randomUUID().toString());
        run.setScheduleId(result.scheduleId());
        run.setScheduledFor(result.scheduledFor());
        run.setFiredAt(result.firedAt());
        run.setFinishedAt(result.finishedAt());
        run.setDurationMs(result.durationMs());
        run.setResultStatus(result.succeeded() ? ResultStatus.SUCCESS : ResultStatus.FAIL);
        run.setErrorMessage(result.errorDetail());
        run.setArtifactRef(result.artifactRef());
        run.setOutputFormats(new ArrayList<>(result.outputFormats()));
        run.setInstanceId(instanceId);
        run.setCreatedAt(clock.instant());
        runRepository.save(run);
        log.debug("Recorded {} run {} for schedule {}", run.getResultStatus(), run.getRunId(), run.getScheduleId());
    }

    public List<ReportRunDocument> recentRuns(String scheduleId, int limit) {
        return runRepository.findByScheduleIdOrderByFiredAtDesc(scheduleId, PageRequest.of(0, clampSize(limit)))
                .getContent();
    }

    public Page<ReportRunDocument> listRuns(String scheduleId, int page, int size) {
        PageRequest request = PageRequest.of(Math.max(0, page), clampSize(size));
        if (scheduleId == null || scheduleId.isBlank()) {
            return runRepository.findAllByOrderByFiredAtDesc(request);
        }
        return runRepository.findByScheduleIdOrderByFiredAtDesc(scheduleId, request);
    }

    /** Aggregates over runs fired in {@code [from, to]}; defaults to the last 30 days. */
    public RunStatsResponse stats(Instant from, Instant to) {
        to = to != null ? to : clock.instant();
        from = from != null ? from : to.minus(DEFAULT_STATS_WINDOW);
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("'from' must not be after 'to'");
        }
        List<ReportRunDocument> runs = runRepository.findByFiredAtBetween(from, to);
        if (runs.isEmpty()) {
            return RunStatsResponse.empty(from, to);
        }

        long succeeded = runs.stream().filter(r -> r.getResultStatus() == ResultStatus.SUCCESS).count();
        double averageDuration = runs.stream().mapToLong(ReportRunDocument::getDurationMs).average().orElse(0);

        Map<OutputFormat, Long> counts = new EnumMap<>(OutputFormat.class);
        for (ReportRunDocument run : runs) {
            if (run.getOutputFormats() == null) continue;
            for (OutputFormat format : run.getOutputFormats()) {
                counts.merge(format, 1L, Long::sum);
            }
        }
        Map<OutputFormat, Long> byUsage = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<OutputFormat, Long>comparingByValue(Comparator.reverseOrder()))
                .forEach(e -> byUsage.put(e.getKey(), e.getValue()));

        return new RunStatsResponse(from, to, runs.size(), succeeded, runs.size() - succeeded,
                averageDuration, byUsage);
    }

    private static int clampSize(int size) {
        return Math.min(Math.max(1, size), MAX_PAGE_SIZE);
    }
}
