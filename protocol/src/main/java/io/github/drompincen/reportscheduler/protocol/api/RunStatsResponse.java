package io.github.drompincen.reportscheduler.protocol.api;

import java.time.Instant;
import java.util.Map;

public record RunStatsResponse(
        Instant from,
        Instant to,
        long totalRuns,
        long successfulRuns,
        long failedRuns,
        double averageDurationMs,
        Map<OutputFormat, Long> formatCounts
) {

    public static RunStatsResponse empty(Instant from, Instant to) {
        return new RunStatsResponse(from, to, 0, 0, 0, 0.0, Map.of());
    }

    public double successRate() {
        return totalRuns == 0 ? 0.0 : (double) successfulRuns / totalRuns;
    }
}
