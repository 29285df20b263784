package com.rewardradar.cache.config;

import com.rewardradar.cache.CacheTtlPolicy;
import com.rewardradar.cache.ResponseCache;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Response cache and its TTL table.
 */
@Configuration
@EnableConfigurationProperties(CacheProperties.class)
public class CacheConfig {

    @Bean
    public CacheTtlPolicy cacheTtlPolicy(CacheProperties properties, Clock clock) {
        return new CacheTtlPolicy(properties.resolvedTtls(), properties.getDayEndTtl(), properties.getMonthEndTtl(), clock);
    }

    @Bean
    public ResponseCache responseCache(CacheTtlPolicy cacheTtlPolicy, Clock clock) {
        return new ResponseCache(cacheTtlPolicy, clock);
    }
}
