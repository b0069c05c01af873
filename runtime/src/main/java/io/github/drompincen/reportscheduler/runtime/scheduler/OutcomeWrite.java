package io.github.drompincen.reportscheduler.runtime.scheduler;

/** What {@link ScheduleStore#update} was able to write for a finished run. */
public enum OutcomeWrite {
    /** Counters, {@code nextRun} and {@code errorState} written; claim released. */
    APPLIED,
    /** Schedule was disabled or rescheduled during the run: counters written, stored {@code nextRun} kept. */
    NEXT_RUN_KEPT,
    /** Another instance took the claim over after the lease expired: counters written, claim left alone. */
    CLAIM_LOST,
    MISSING
}
