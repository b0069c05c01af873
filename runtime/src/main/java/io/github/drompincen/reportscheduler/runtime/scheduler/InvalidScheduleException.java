package io.github.drompincen.reportscheduler.runtime.scheduler;

/**
 * A stored schedule whose recurrence cannot be evaluated. Such schedules are flagged, not retried.
 */
public class InvalidScheduleException extends RuntimeException {

    private final String scheduleId;

    public InvalidScheduleException(String scheduleId, String message) {
        super("Schedule " + scheduleId + ": " + message);
        this.scheduleId = scheduleId;
    }

    public InvalidScheduleException(String scheduleId, String message, Throwable cause) {
        super("Schedule " + scheduleId + ": " + message, cause);
        this.scheduleId = scheduleId;
    }

    public String getScheduleId() {
        return scheduleId;
    }
}
