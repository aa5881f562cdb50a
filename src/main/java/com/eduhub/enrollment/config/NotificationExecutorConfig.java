package com.eduhub.enrollment.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor that hands notifications to Kafka off the request thread.
 *
 * A blocked producer (broker down, metadata wait) stalls this pool only,
 * never a thread holding a class lock. When the queue is full the publisher
 * drops the notification and counts the failure.
 *
 * A single worker keeps sends in publish order.
 *
 * @author Enrollment Team
 */
@Configuration
public class NotificationExecutorConfig {

    @Value("${enrollment.notifications.executor.queue-capacity:1000}")
    private int queueCapacity;

    @Bean(name = "notificationExecutor")
    public ThreadPoolTaskExecutor notificationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("notify-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
