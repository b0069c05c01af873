package io.github.drompincen.reportscheduler.runtime.scheduler;

import io.github.drompincen.reportscheduler.protocol.api.OutputFormat;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * Outcome of one firing. {@code scheduledFor} is the {@code nextRun} that was claimed.
 */
public record RunResult(
        String scheduleId,
        Instant scheduledFor,
        Instant firedAt,
        Instant finishedAt,
        boolean succeeded,
        String errorDetail,
        String artifactRef,
        Set<OutputFormat> outputFormats
) {

    public long durationMs() {
        if (firedAt == null || finishedAt == null) return 0;
        return Math.max(0, Duration.between(firedAt, finishedAt).toMillis());
    }
}
