package com.eduhub.enrollment.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

/**
 * Dedicated scheduler for {@code @Scheduled} jobs.
 *
 * The offer sweep waits on class locks, so it must not share threads with
 * the STOMP heartbeat scheduler.
 *
 * @author Enrollment Team
 */
@Configuration
public class SchedulingConfig implements SchedulingConfigurer {

    private static final Logger logger = LoggerFactory.getLogger(SchedulingConfig.class);

    static final String THREAD_NAME_PREFIX = "offer-sweep-";

    @Value("${enrollment.waitlist.expiry-scheduler.pool-size:2}")
    private int poolSize = 2;

    @Bean
    public ThreadPoolTaskScheduler offerSweepScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix(THREAD_NAME_PREFIX);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.setErrorHandler(t -> logger.error("Scheduled task failed", t));
        scheduler.initialize();
        return scheduler;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        taskRegistrar.setTaskScheduler(offerSweepScheduler());
        logger.info("Scheduled tasks run on {}* ({} threads)", THREAD_NAME_PREFIX, poolSize);
    }
}
