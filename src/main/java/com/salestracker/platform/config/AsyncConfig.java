package com.salestracker.platform.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String ACTIVITY_EXECUTOR = "activityPostProcessingExecutor";

    /**
     * Runs post-activity work off the request thread. When the queue is full the caller runs the
     * task itself rather than dropping it.
     */
    @Bean(name = ACTIVITY_EXECUTOR)
    public ThreadPoolTaskExecutor activityPostProcessingExecutor(SalesTrackerProperties properties) {
        SalesTrackerProperties.Notifications notifications = properties.getNotifications();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(notifications.getExecutorPoolSize());
        executor.setMaxPoolSize(notifications.getExecutorPoolSize());
        executor.setQueueCapacity(notifications.getExecutorQueueCapacity());
        executor.setThreadNamePrefix("activity-post-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Bean
    public ThreadPoolTaskScheduler maintenanceTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(3);
        scheduler.setThreadNamePrefix("maintenance-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }
}
