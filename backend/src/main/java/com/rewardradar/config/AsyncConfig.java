package com.rewardradar.config;

import com.rewardradar.polling.config.PollingProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Named worker pool for period fetches. One task per period; attempts inside a task stay sequential.
 */
@Configuration
public class AsyncConfig {

    public static final String FETCH_EXECUTOR = "fetch-executor";

    /** Interrupts running fetches on context close so they report CANCELLED. */
    @Bean(name = FETCH_EXECUTOR)
    public ThreadPoolTaskExecutor fetchExecutor(PollingProperties pollingProperties) {
        int size = Math.max(1, pollingProperties.getFetchPoolSize());
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(size);
        e.setMaxPoolSize(size);
        e.setThreadNamePrefix("fetch-");
        e.setWaitForTasksToCompleteOnShutdown(false);
        e.initialize();
        return e;
    }
}
