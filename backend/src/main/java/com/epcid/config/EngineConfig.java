package com.epcid.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Engine infrastructure
 *
 * - Clock shared by age calculation, trend timestamps and escalation timers
 * - Scheduler that runs the per-contact escalation timeouts
 */
@Configuration
public class EngineConfig {

    @Value("${epcid.escalation.scheduler-pool-size:2}")
    private int schedulerPoolSize;

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean(name = "escalationTaskScheduler")
    public ThreadPoolTaskScheduler escalationTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(schedulerPoolSize);
        scheduler.setThreadNamePrefix("epcid-escalation-");
        // Cancelled timeouts must not linger in the queue until their deadline
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }
}
