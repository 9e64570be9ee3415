package com.opsdash.realtimeservice.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler for dashboard loads and debounced reloads.
 */
@Configuration
public class SchedulingConfig {

    @Bean
    public ThreadPoolTaskScheduler dashboardScheduler(RealtimeProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("dashboard-reload-");
        scheduler.setDaemon(true);
        scheduler.setRemoveOnCancelPolicy(true);
        // views release their scopes on shutdown; queued reloads are dropped
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }
}
