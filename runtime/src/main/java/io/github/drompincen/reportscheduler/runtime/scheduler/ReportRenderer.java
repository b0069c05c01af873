package io.github.drompincen.reportscheduler.runtime.scheduler;

/**
 * Produces the report artifact for a fired schedule and hands it to delivery.
 *
 * <p>Implementations may block for minutes and must be safe to call concurrently for distinct
 * schedules. Thrown exceptions are treated the same as {@link RenderOutcome#failure(String)}.
 */
public interface ReportRenderer {

    RenderOutcome render(Schedule schedule);
}
