package io.github.drompincen.reportscheduler.runtime.schedule;

import io.github.drompincen.reportscheduler.persistence.document.ReportScheduleDocument;
import io.github.drompincen.reportscheduler.persistence.repository.ReportScheduleRepository;
import io.github.drompincen.reportscheduler.protocol.api.Frequency;
import io.github.drompincen.reportscheduler.protocol.api.ScheduleRequest;
import io.github.drompincen.reportscheduler.runtime.history.RunHistoryService;
import io.github.drompincen.reportscheduler.runtime.scheduler.InvalidScheduleException;
import io.github.drompincen.reportscheduler.runtime.scheduler.RecurrenceCalculator;
import io.github.drompincen.reportscheduler.runtime.store.ScheduleMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Management operations on report schedules. The engine only ever sees what passed
 * {@link ScheduleValidator}.
 */
@Service
public class ReportScheduleService {

    private static final Logger log = LoggerFactory.getLogger(ReportScheduleService.class);
    private static final int STATUS_RECENT_RUNS = 10;
    private static final int DEFAULT_DAY_OF_WEEK = 1;

    private final ReportScheduleRepository scheduleRepository;
    private final RunHistoryService runHistoryService;
    private final ScheduleValidator validator;
    private final RecurrenceCalculator recurrenceCalculator;
    private final Clock clock;

    public ReportScheduleService(ReportScheduleRepository scheduleRepository,
                                 RunHistoryService runHistoryService,
                                 ScheduleValidator validator,
                                 RecurrenceCalculator recurrenceCalculator,
                                 Clock clock) {
        this.scheduleRepository = scheduleRepository;
        this.runHistoryService = runHistoryService;
        this.validator = validator;
        this.recurrenceCalculator = recurrenceCalculator;
        this.clock = clock;
    }

    /** New schedules are stored without {@code nextRun}; the scheduler loop assigns the first one. */
    public ReportScheduleDocument create(ScheduleRequest request, String actor) {
        Instant now = clock.instant();
        ReportScheduleDocument doc = new ReportScheduleDocument();
        doc.setScheduleId(UUID.randomUUID().toString());
        applyRequest(doc, request);
        if (request.enabled() != null) {
            doc.setEnabled(request.enabled());
        }
        doc.setDayOfWeek(request.dayOfWeek());
        doc.setDayOfMonth(request.dayOfMonth());
        defaultDayOfWeek(doc);
        doc.setCreatedBy(actor != null ? actor : "system");
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);

        validator.validate(doc);
        ReportScheduleDocument saved = scheduleRepository.save(doc);
        log.info("Created {} schedule {} '{}' for report {}", saved.getFrequency(), saved.getScheduleId(),
                saved.getName(), saved.getReportId());
        return saved;
    }

    /**
     * Patch semantics: null fields keep their value. Changing the frequency resets both day fields
     * to whatever the request carries.
     */
    public ReportScheduleDocument update(String scheduleId, ScheduleRequest request) {
        ReportScheduleDocument doc = get(scheduleId);
        String timingBefore = timingOf(doc);
        boolean wasEnabled = doc.isEnabled();
        boolean wasErrored = doc.isErrorState();
        Frequency previousFrequency = doc.getFrequency();

        applyRequest(doc, request);
        if (request.frequency() != null && request.frequency() != previousFrequency) {
            doc.setDayOfWeek(request.dayOfWeek());
            doc.setDayOfMonth(request.dayOfMonth());
        } else {
            if (request.dayOfWeek() != null) doc.setDayOfWeek(request.dayOfWeek());
            if (request.dayOfMonth() != null) doc.setDayOfMonth(request.dayOfMonth());
        }
        defaultDayOfWeek(doc);
        if (request.enabled() != null) {
            doc.setEnabled(request.enabled());
        }
        validator.validate(doc);

        Instant now = clock.instant();
        boolean timingChanged = !timingBefore.equals(timingOf(doc));
        if (timingChanged || wasErrored) {
            doc.setErrorState(false);
            doc.setLastError(null);
        }
        if (doc.isEnabled() && (timingChanged || wasErrored || !wasEnabled)) {
            scheduleNextRun(doc, now);
        }
        doc.setUpdatedAt(now);
        ReportScheduleDocument saved = scheduleRepository.save(doc);
        log.info("Updated schedule {} (timing changed: {}, next run {})", scheduleId, timingChanged, saved.getNextRun());
        return saved;
    }

    /** Disabling freezes {@code nextRun}; enabling recomputes it strictly after now. */
    public ReportScheduleDocument setEnabled(String scheduleId, boolean enabled) {
        ReportScheduleDocument doc = get(scheduleId);
        if (doc.isEnabled() == enabled) {
            return doc;
        }
        Instant now = clock.instant();
        doc.setEnabled(enabled);
        if (enabled) {
            scheduleNextRun(doc, now);
        }
        doc.setUpdatedAt(now);
        ReportScheduleDocument saved = scheduleRepository.save(doc);
        log.info("Schedule {} {}; next run {}", scheduleId, enabled ? "enabled" : "disabled", saved.getNextRun());
        return saved;
    }

    /** Makes the schedule due now; the regular claim path fires it on the next tick. */
    public ReportScheduleDocument triggerNow(String scheduleId) {
        ReportScheduleDocument doc = get(scheduleId);
        if (!doc.isEnabled()) {
            throw new IllegalStateException("Schedule " + scheduleId + " is disabled");
        }
        if (doc.isErrorState()) {
            throw new IllegalStateException("Schedule " + scheduleId + " is in error state: " + doc.getLastError());
        }
        Instant now = clock.instant();
        doc.setNextRun(now);
        doc.setUpdatedAt(now);
        ReportScheduleDocument saved = scheduleRepository.save(doc);
        log.info("Schedule {} triggered manually", scheduleId);
        return saved;
    }

    /** Run history is kept. */
    public void delete(String scheduleId) {
        if (!scheduleRepository.existsById(scheduleId)) {
            throw new ScheduleNotFoundException(scheduleId);
        }
        scheduleRepository.deleteById(scheduleId);
        log.info("Deleted schedule {}", scheduleId);
    }

    public ReportScheduleDocument get(String scheduleId) {
        return scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
    }

    public List<ReportScheduleDocument> list(Boolean enabled) {
        if (enabled == null) {
            return scheduleRepository.findAllByOrderByCreatedAtDesc();
        }
        return scheduleRepository.findByEnabledOrderByCreatedAtDesc(enabled);
    }

    public List<ReportScheduleDocument> listErrored() {
        return scheduleRepository.findByErrorStateTrue();
    }

    public ScheduleStatus status(String scheduleId) {
        ReportScheduleDocument doc = get(scheduleId);
        return new ScheduleStatus(doc, runHistoryService.recentRuns(scheduleId, STATUS_RECENT_RUNS));
    }

    private void scheduleNextRun(ReportScheduleDocument doc, Instant now) {
        try {
            doc.setNextRun(recurrenceCalculator.computeNextRun(ScheduleMapper.toSchedule(doc), now));
        } catch (InvalidScheduleException e) {
            log.error("Flagging schedule {}: {}", doc.getScheduleId(), e.getMessage());
            doc.setErrorState(true);
            doc.setLastError(e.getMessage());
        }
    }

    private static void applyRequest(ReportScheduleDocument doc, ScheduleRequest request) {
        if (request.name() != null) doc.setName(request.name().trim());
        if (request.description() != null) doc.setDescription(request.description());
        if (request.reportId() != null) doc.setReportId(request.reportId());
        if (request.frequency() != null) doc.setFrequency(request.frequency());
        if (request.timeOfDay() != null) doc.setTimeOfDay(request.timeOfDay());
        if (request.timezone() != null) doc.setTimezone(request.timezone());
        if (request.outputFormats() != null) doc.setOutputFormats(new ArrayList<>(request.outputFormats()));
        if (request.recipients() != null) doc.setRecipients(new ArrayList<>(request.recipients()));
    }

    private static void defaultDayOfWeek(ReportScheduleDocument doc) {
        if (doc.getFrequency() == Frequency.WEEKLY && doc.getDayOfWeek() == null) {
            doc.setDayOfWeek(DEFAULT_DAY_OF_WEEK);
        }
    }

    private static String timingOf(ReportScheduleDocument doc) {
        return Objects.toString(doc.getFrequency()) + '|' + doc.getTimeOfDay() + '|' + doc.getTimezone()
                + '|' + doc.getDayOfWeek() + '|' + doc.getDayOfMonth();
    }
}
