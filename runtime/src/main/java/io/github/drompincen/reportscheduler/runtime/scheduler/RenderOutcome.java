package io.github.drompincen.reportscheduler.runtime.scheduler;

public record RenderOutcome(boolean succeeded, String artifactRef, String reason) {

    public static RenderOutcome success(String artifactRef) {
        return new RenderOutcome(true, artifactRef, null);
    }

    public static RenderOutcome failure(String reason) {
        return new RenderOutcome(false, null, reason != null ? reason : "unknown render failure");
    }
}
