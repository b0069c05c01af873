package io.github.drompincen.reportscheduler.runtime.scheduler;

public record TickSummary(int initialized, int due, int claimed, int skipped) {

    public static final TickSummary EMPTY = new TickSummary(0, 0, 0, 0);
}
