package io.github.drompincen.reportscheduler.protocol.api;

import java.time.Instant;
import java.util.Set;

public record RunRecordResponse(
        String runId,
        String scheduleId,
        Instant scheduledFor,
        Instant firedAt,
        Instant finishedAt,
        long durationMs,
        ResultStatus resultStatus,
        String errorMessage,
        String artifactRef,
        Set<OutputFormat> outputFormats,
        String instanceId
) {}
