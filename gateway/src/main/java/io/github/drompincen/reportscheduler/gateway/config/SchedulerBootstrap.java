package io.github.drompincen.reportscheduler.gateway.config;

import io.github.drompincen.reportscheduler.runtime.scheduler.SchedulerLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the scheduler loop once the application is ready. Shutdown is handled by the loop itself.
 */
@Component
public class SchedulerBootstrap {

    private static final Logger log = LoggerFactory.getLogger(SchedulerBootstrap.class);

    private final SchedulerLoop schedulerLoop;
    private final boolean enabled;

    public SchedulerBootstrap(SchedulerLoop schedulerLoop,
                              @Value("${reportscheduler.enabled:true}") boolean enabled) {
        this.schedulerLoop = schedulerLoop;
        this.enabled = enabled;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startScheduler() {
        if (!enabled) {
            log.info("Report scheduler disabled (reportscheduler.enabled=false); serving management API only");
            return;
        }
        schedulerLoop.start();
    }
}
