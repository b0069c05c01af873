package io.github.drompincen.reportscheduler.runtime.scheduler;

import java.time.Instant;
import java.util.List;

/**
 * Persistence operations the scheduler loop relies on. All mutations are conditional or keyed by id;
 * no caller holds schedule state across calls.
 */
public interface ScheduleStore {

    /** Enabled, non-errored schedules with {@code nextRun <= now} and no live claim. */
    List<Schedule> fetchDue(Instant now);

    /** Enabled, non-errored schedules that have never been assigned a {@code nextRun}. */
    List<Schedule> fetchUninitialized(int limit);

    /**
     * Claims one occurrence. Succeeds only if the stored {@code nextRun} still equals
     * {@code expectedNextRun}, the schedule is enabled and not errored, and nobody holds a live claim.
     *
     * @return false when the race was lost or the schedule was deleted or disabled
     */
    boolean claim(String scheduleId, Instant expectedNextRun);

    /** Extends the lease of a claim held by this instance. */
    boolean renewClaim(String scheduleId);

    /**
     * Records a finished run. {@code runCount} and {@code failureCount} are incremented and
     * {@code lastRun} only moves forward. {@code nextRun} and {@code errorState} are written only while
     * this instance still holds the claim on {@code claimedNextRun} of an enabled schedule; otherwise
     * the stored values win. The claim is released only when this instance holds it.
     */
    OutcomeWrite update(String scheduleId, ScheduleUpdate update);

    /** Flags a schedule as errored, only if its {@code nextRun} still equals {@code expectedNextRun}. */
    boolean flagError(String scheduleId, Instant expectedNextRun, String error);

    /** Sets the first {@code nextRun}, only if it is still unset. */
    boolean initializeNextRun(String scheduleId, Instant nextRun);
}
