package io.github.drompincen.reportscheduler.runtime.schedule;

public class ScheduleNotFoundException extends RuntimeException {

    public ScheduleNotFoundException(String scheduleId) {
        super("Schedule not found: " + scheduleId);
    }
}
