package io.github.drompincen.reportscheduler.runtime.scheduler;

/** Which instant to pick when a wall-clock time occurs twice on a fall-back day. */
public enum DstOverlapPolicy {
    EARLIER,
    LATER
}
