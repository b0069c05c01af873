package io.github.drompincen.reportscheduler.runtime.scheduler;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Periodically finds due schedules, claims each occurrence and renders the claimed ones on a
 * bounded worker pool.
 *
 * <p>At-most-once firing per occurrence rests on {@link ScheduleStore#claim}; the loop keeps no
 * schedule state between ticks apart from the set of renders it is currently running.
 */
@Service
public class SchedulerLoop {

    private static final Logger log = LoggerFactory.getLogger(SchedulerLoop.class);

    private final ScheduleStore scheduleStore;
    private final ReportRenderer reportRenderer;
    private final RecurrenceCalculator recurrenceCalculator;
    private final RunTracker runTracker;
    private final ClaimLeaseHeartbeat claimLeaseHeartbeat;
    private final Clock clock;
    private final SchedulerProperties properties;

    private final ScheduledExecutorService ticker;
    private final ExecutorService workers;
    private final Map<String, CompletableFuture<Void>> inFlight = new ConcurrentHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean stopped;

    public SchedulerLoop(ScheduleStore scheduleStore,
                         ReportRenderer reportRenderer,
                         RecurrenceCalculator recurrenceCalculator,
                         RunTracker runTracker,
                         ClaimLeaseHeartbeat claimLeaseHeartbeat,
                         Clock clock,
                         SchedulerProperties properties) {
        this.scheduleStore = scheduleStore;
        this.reportRenderer = reportRenderer;
        this.recurrenceCalculator = recurrenceCalculator;
        this.runTracker = runTracker;
        this.claimLeaseHeartbeat = claimLeaseHeartbeat;
        this.clock = clock;
        this.properties = properties;
        this.ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "scheduler-tick");
            t.setDaemon(true);
            return t;
        });
        AtomicInteger workerIndex = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(properties.workerThreads(), r -> {
            Thread t = new Thread(r, "report-render-" + workerIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (stopped) {
            throw new IllegalStateException("Scheduler loop was stopped and cannot be restarted");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        long delayMs = properties.pollInterval().toMillis();
        ticker.scheduleWithFixedDelay(this::safeTick, 0, delayMs, TimeUnit.MILLISECONDS);
        log.info("Scheduler loop started on instance {} (poll every {} ms, {} workers)",
                properties.instanceId(), delayMs, properties.workerThreads());
    }

    @PreDestroy
    public void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        ticker.shutdown();
        workers.shutdown();
        int pending = inFlight.size();
        if (pending > 0) {
            log.info("Draining {} in-flight render(s) for up to {}", pending, properties.drainTimeout());
        }
        try {
            if (!workers.awaitTermination(properties.drainTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Drain timeout elapsed; interrupting {} render(s)", inFlight.size());
                workers.shutdownNow();
            }
            ticker.awaitTermination(properties.drainTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        ticker.shutdownNow();
        log.info("Scheduler loop stopped on instance {}", properties.instanceId());
    }

    public boolean isRunning() {
        return started.get() && !stopped;
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Runs one scheduling pass. Never throws; store failures that survive the retries skip the
     * rest of the pass.
     */
    public TickSummary tick() {
        if (stopped) {
            return TickSummary.EMPTY;
        }
        Instant now = clock.instant();
        int initialized = initializeNewSchedules(now);

        List<Schedule> due = withStoreRetry("fetchDue", () -> scheduleStore.fetchDue(now));
        if (due == null) {
            return new TickSummary(initialized, 0, 0, 0);
        }

        int claimed = 0;
        int skipped = 0;
        for (Schedule schedule : due) {
            if (stopped) {
                skipped += due.size() - claimed - skipped;
                break;
            }
            if (!isFireable(schedule, now) || inFlight.containsKey(schedule.id())) {
                skipped++;
                continue;
            }
            Boolean won = withStoreRetry("claim " + schedule.id(),
                    () -> scheduleStore.claim(schedule.id(), schedule.nextRun()));
            if (!Boolean.TRUE.equals(won)) {
                log.debug("Lost claim on schedule {} for {}", schedule.id(), schedule.nextRun());
                skipped++;
                continue;
            }
            if (dispatch(schedule)) {
                claimed++;
            } else {
                skipped++;
            }
        }
        if (claimed > 0 || initialized > 0) {
            log.info("Tick at {}: {} initialised, {} due, {} claimed", now, initialized, due.size(), claimed);
        }
        return new TickSummary(initialized, due.size(), claimed, skipped);
    }

    /**
     * Waits until every render dispatched so far has been recorded.
     *
     * @return true if nothing is in flight any more
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        for (CompletableFuture<Void> future : List.copyOf(inFlight.values())) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return inFlight.isEmpty();
            }
            try {
                future.get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                return false;
            } catch (ExecutionException e) {
                throw new IllegalStateException("Render task failed unexpectedly", e.getCause());
            }
        }
        return inFlight.isEmpty();
    }

    private void safeTick() {
        try {
            tick();
        } catch (Exception e) {
            log.error("Scheduler tick failed: {}", e.getMessage(), e);
        }
    }

    private int initializeNewSchedules(Instant now) {
        List<Schedule> fresh = withStoreRetry("fetchUninitialized",
                () -> scheduleStore.fetchUninitialized(properties.initializeBatchSize()));
        if (fresh == null) {
            return 0;
        }
        int initialized = 0;
        for (Schedule schedule : fresh) {
            Instant next;
            try {
                next = recurrenceCalculator.computeNextRun(schedule, now);
            } catch (InvalidScheduleException e) {
                log.error("Flagging schedule {}: {}", schedule.id(), e.getMessage());
                persist(schedule, () -> runTracker.recordInitializationFailure(schedule, e));
                continue;
            }
            Boolean set = withStoreRetry("initializeNextRun " + schedule.id(),
                    () -> scheduleStore.initializeNextRun(schedule.id(), next));
            if (Boolean.TRUE.equals(set)) {
                initialized++;
                log.debug("Schedule {} first run at {}", schedule.id(), next);
            }
        }
        return initialized;
    }

    private boolean dispatch(Schedule schedule) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        inFlight.put(schedule.id(), done);
        try {
            workers.execute(() -> {
                try {
                    fire(schedule);
                } catch (Exception e) {
                    log.error("Unexpected error firing schedule {}: {}", schedule.id(), e.getMessage(), e);
                } finally {
                    inFlight.remove(schedule.id());
                    done.complete(null);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            inFlight.remove(schedule.id());
            done.complete(null);
            log.warn("Schedule {} claimed while stopping; it fires after its claim lease expires", schedule.id());
            return false;
        }
    }

    private void fire(Schedule schedule) {
        Instant firedAt = clock.instant();
        log.info("Firing schedule {} ({}) due {}", schedule.id(), schedule.name(), schedule.nextRun());

        RenderOutcome outcome;
        claimLeaseHeartbeat.start(schedule.id());
        try {
            outcome = render(schedule);
        } finally {
            claimLeaseHeartbeat.stop(schedule.id());
        }
        Instant finishedAt = clock.instant();

        Instant nextRun;
        try {
            nextRun = recurrenceCalculator.computeNextRun(schedule, firedAt);
        } catch (InvalidScheduleException e) {
            log.error("Flagging schedule {}: {}", schedule.id(), e.getMessage());
            persist(schedule, () -> runTracker.recordFatal(schedule, firedAt, finishedAt, outcome, e));
            return;
        }

        if (outcome.succeeded()) {
            persist(schedule, () -> runTracker.recordSuccess(schedule, firedAt, finishedAt, nextRun, outcome));
            log.info("Schedule {} rendered {}; next run {}", schedule.id(), outcome.artifactRef(), nextRun);
        } else {
            log.warn("Render failed for schedule {}: {}; next run {}", schedule.id(), outcome.reason(), nextRun);
            persist(schedule, () -> runTracker.recordFailure(schedule, firedAt, finishedAt, nextRun, outcome.reason()));
        }
    }

    private RenderOutcome render(Schedule schedule) {
        try {
            RenderOutcome outcome = reportRenderer.render(schedule);
            return outcome != null ? outcome : RenderOutcome.failure("renderer returned no outcome");
        } catch (Exception e) {
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return RenderOutcome.failure(reason);
        }
    }

    private void persist(Schedule schedule, Supplier<?> write) {
        if (withStoreRetry("update " + schedule.id(), write) == null) {
            log.error("Could not persist run outcome of schedule {}; it becomes claimable again when its lease expires",
                    schedule.id());
        }
    }

    private <T> T withStoreRetry(String operation, Supplier<T> call) {
        long backoffMs = properties.storeRetryBackoff().toMillis();
        int attempts = properties.storeRetryAttempts();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return call.get();
            } catch (RuntimeException e) {
                if (attempt == attempts) {
                    log.warn("Store {} failed after {} attempt(s): {}", operation, attempts, e.getMessage());
                    return null;
                }
                log.warn("Store {} failed (attempt {}/{}), retrying in {} ms: {}",
                        operation, attempt, attempts, backoffMs, e.getMessage());
                if (!sleep(backoffMs)) {
                    return null;
                }
                backoffMs *= 2;
            }
        }
        return null;
    }

    private static boolean sleep(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static boolean isFireable(Schedule schedule, Instant now) {
        return schedule.enabled()
                && !schedule.errorState()
                && schedule.nextRun() != null
                && !schedule.nextRun().isAfter(now);
    }
}
