package io.github.drompincen.reportscheduler.runtime.schedule;

import java.util.List;

/**
 * A schedule definition that cannot be stored. Carries every problem found, not just the first.
 */
public class ScheduleValidationException extends RuntimeException {

    private final List<String> errors;

    public ScheduleValidationException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
