package io.github.drompincen.reportscheduler.protocol.api;

public enum Frequency {
    DAILY,
    WEEKLY,
    MONTHLY,
    /** Every three months, always on day 1 of the month. */
    QUARTERLY
}
