package io.github.drompincen.reportscheduler.gateway.config;

import io.github.drompincen.reportscheduler.runtime.scheduler.SchedulerProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class SchedulerConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    SchedulerProperties schedulerProperties(
            @Value("${reportscheduler.poll-interval:30s}") Duration pollInterval,
            @Value("${reportscheduler.worker-threads:4}") int workerThreads,
            @Value("${reportscheduler.drain-timeout:30s}") Duration drainTimeout,
            @Value("${reportscheduler.claim-lease:10m}") Duration claimLease,
            @Value("${reportscheduler.store-retry-attempts:3}") int storeRetryAttempts,
            @Value("${reportscheduler.store-retry-backoff:500ms}") Duration storeRetryBackoff,
            @Value("${reportscheduler.initialize-batch-size:100}") int initializeBatchSize,
            @Value("${reportscheduler.instance-id:}") String instanceId) {
        return new SchedulerProperties(pollInterval, workerThreads, drainTimeout, claimLease,
                storeRetryAttempts, storeRetryBackoff, initializeBatchSize, instanceId);
    }
}
