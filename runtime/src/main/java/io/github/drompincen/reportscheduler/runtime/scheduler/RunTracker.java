package io.github.drompincen.reportscheduler.runtime.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

@Service
public class RunTracker {

    private static final Logger log = LoggerFactory.getLogger(RunTracker.class);

    private final ScheduleStore scheduleStore;
    private final List<RunResultListener> listeners;

    public RunTracker(ScheduleStore scheduleStore, List<RunResultListener> listeners) {
        this.scheduleStore = scheduleStore;
        this.listeners = listeners != null ? List.copyOf(listeners) : List.of();
    }

    public OutcomeWrite recordSuccess(Schedule schedule, Instant firedAt, Instant finishedAt,
                                      Instant nextRun, RenderOutcome outcome) {
        OutcomeWrite write = write(schedule,
                new ScheduleUpdate(schedule.nextRun(), nextRun, firedAt, false, null, false));
        publish(new RunResult(schedule.id(), schedule.nextRun(), firedAt, finishedAt,
                true, null, outcome.artifactRef(), schedule.outputFormats()));
        return write;
    }

    public OutcomeWrite recordFailure(Schedule schedule, Instant firedAt, Instant finishedAt,
                                      Instant nextRun, String error) {
        OutcomeWrite write = write(schedule,
                new ScheduleUpdate(schedule.nextRun(), nextRun, firedAt, true, error, false));
        publish(new RunResult(schedule.id(), schedule.nextRun(), firedAt, finishedAt,
                false, error, null, schedule.outputFormats()));
        return write;
    }

    /**
     * The run happened but no next occurrence can be computed: counters follow the render outcome,
     * {@code nextRun} stays where it was and the schedule is flagged.
     */
    public OutcomeWrite recordFatal(Schedule schedule, Instant firedAt, Instant finishedAt,
                                    RenderOutcome outcome, Exception cause) {
        OutcomeWrite write = write(schedule, new ScheduleUpdate(schedule.nextRun(), schedule.nextRun(), firedAt,
                !outcome.succeeded(), cause.getMessage(), true));
        publish(new RunResult(schedule.id(), schedule.nextRun(), firedAt, finishedAt,
                outcome.succeeded(), outcome.succeeded() ? null : outcome.reason(),
                outcome.artifactRef(), schedule.outputFormats()));
        return write;
    }

    public boolean recordInitializationFailure(Schedule schedule, Exception cause) {
        boolean flagged = scheduleStore.flagError(schedule.id(), schedule.nextRun(), cause.getMessage());
        if (!flagged) {
            log.debug("Schedule {} changed before it could be flagged", schedule.id());
        }
        return flagged;
    }

    private OutcomeWrite write(Schedule schedule, ScheduleUpdate update) {
        OutcomeWrite write = scheduleStore.update(schedule.id(), update);
        if (write == OutcomeWrite.NEXT_RUN_KEPT) {
            log.info("Schedule {} was changed while running; keeping its stored nextRun", schedule.id());
        } else if (write == OutcomeWrite.CLAIM_LOST) {
            log.warn("Claim on schedule {} was taken over during the run; only counters were recorded",
                    schedule.id());
        } else if (write == OutcomeWrite.MISSING) {
            log.debug("Schedule {} was deleted before its run outcome was written", schedule.id());
        }
        return write;
    }

    private void publish(RunResult result) {
        for (RunResultListener listener : listeners) {
            try {
                listener.onRunResult(result);
            } catch (Exception e) {
                log.warn("Run result listener {} failed for schedule {}: {}",
                        listener.getClass().getSimpleName(), result.scheduleId(), e.getMessage());
            }
        }
    }
}
