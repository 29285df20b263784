package com.rewardradar.retry.config;

import com.rewardradar.auth.TokenStore;
import com.rewardradar.common.RetryPolicy;
import com.rewardradar.common.Sleeper;
import com.rewardradar.ratelimit.RateLimiter;
import com.rewardradar.retry.RetryEventLog;
import com.rewardradar.retry.RetryExecutor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * One retry policy for both the credential exchange and API queries.
 */
@Configuration
@EnableConfigurationProperties(RetryProperties.class)
public class RetryConfig {

    @Bean
    public RetryPolicy retryPolicy(RetryProperties properties) {
        return new RetryPolicy(properties.getMaxAttempts(), properties.getBaseDelayMs(),
                properties.getMaxDelayMs(), properties.getJitterRatio());
    }

    @Bean
    public RetryEventLog retryEventLog(RetryProperties properties) {
        return new RetryEventLog(properties.getEventLogSize());
    }

    @Bean
    public RetryExecutor retryExecutor(TokenStore tokenStore, RateLimiter rateLimiter, RetryPolicy retryPolicy,
                                       RetryEventLog retryEventLog, Sleeper sleeper, Clock clock) {
        return new RetryExecutor(tokenStore, rateLimiter, retryPolicy, retryEventLog, sleeper, clock);
    }
}
