package io.github.drompincen.reportscheduler.runtime.scheduler;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

@Service
public class ClaimLeaseHeartbeat {

    private static final Logger log = LoggerFactory.getLogger(ClaimLeaseHeartbeat.class);
    private static final long MIN_INTERVAL_MS = 50;

    private final ScheduleStore scheduleStore;
    private final long intervalMs;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "claim-heartbeat");
        t.setDaemon(true);
        return t;
    });
    private final Map<String, ScheduledFuture<?>> activeHeartbeats = new ConcurrentHashMap<>();

    public ClaimLeaseHeartbeat(ScheduleStore scheduleStore, SchedulerProperties properties) {
        this.scheduleStore = scheduleStore;
        this.intervalMs = Math.max(MIN_INTERVAL_MS, properties.claimLease().toMillis() / 3);
    }

    public void start(String scheduleId) {
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(() -> {
            try {
                if (!scheduleStore.renewClaim(scheduleId)) {
                    log.warn("Claim on schedule {} is no longer held by this instance", scheduleId);
                }
            } catch (Exception e) {
                log.warn("Heartbeat failed for schedule {}: {}", scheduleId, e.getMessage());
            }
        }, intervalMs, intervalMs, TimeUnit.MILLISECONDS);

        ScheduledFuture<?> previous = activeHeartbeats.put(scheduleId, future);
        if (previous != null) {
            previous.cancel(false);
        }
        log.debug("Started heartbeat for schedule {}", scheduleId);
    }

    public void stop(String scheduleId) {
        ScheduledFuture<?> future = activeHeartbeats.remove(scheduleId);
        if (future != null) {
            future.cancel(false);
            log.debug("Stopped heartbeat for schedule {}", scheduleId);
        }
    }

    public int activeCount() {
        return activeHeartbeats.size();
    }

    @PreDestroy
    public void shutdown() {
        activeHeartbeats.values().forEach(f -> f.cancel(false));
        activeHeartbeats.clear();
        scheduler.shutdown();
    }
}
