package com.rewardradar.ratelimit.config;

import com.rewardradar.ratelimit.RateLimiter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Rate limiter bean and its properties.
 */
@Configuration
@EnableConfigurationProperties(RateLimitProperties.class)
public class RateLimitConfig {

    @Bean
    public RateLimiter rateLimiter(RateLimitProperties properties, Clock clock) {
        return new RateLimiter(properties.getHourlyCapacity(), properties.getBurstCapacity(),
                properties.getBurstWindow(), clock);
    }
}
