package com.microtrader.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Shared pool for the periodic trading tasks: scan cycle, position monitor, performance
 * snapshot and universe refresh each get a thread, so a slow scan never delays the monitor.
 */
@Configuration
public class SchedulerConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulerConfig.class);

    static final int POOL_SIZE = 4;

    @Bean("tradingTaskScheduler")
    public ThreadPoolTaskScheduler tradingTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(POOL_SIZE);
        scheduler.setThreadNamePrefix("trading-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.setErrorHandler(
                throwable -> log.error("Uncaught error in trading task: {}", throwable.getMessage(), throwable));
        return scheduler;
    }
}
