package com.rewardradar.fetch.config;

import com.rewardradar.cache.ResponseCache;
import com.rewardradar.client.RewardsApiClient;
import com.rewardradar.config.AsyncConfig;
import com.rewardradar.fetch.FetchOrchestrator;
import com.rewardradar.fetch.RewardPeriods;
import com.rewardradar.retry.RetryExecutor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class FetchConfig {

    @Bean(destroyMethod = "shutdown")
    public FetchOrchestrator fetchOrchestrator(RetryExecutor retryExecutor, RewardsApiClient rewardsApiClient,
                                               ResponseCache responseCache,
                                               @Qualifier(AsyncConfig.FETCH_EXECUTOR) ThreadPoolTaskExecutor fetchExecutor,
                                               Clock clock) {
        return new FetchOrchestrator(retryExecutor, rewardsApiClient, responseCache, fetchExecutor, clock);
    }

    @Bean
    public RewardPeriods rewardPeriods(Clock clock) {
        return new RewardPeriods(clock);
    }
}
