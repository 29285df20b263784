package com.rewardradar.cache.config;

import com.rewardradar.cache.CacheKind;
import com.rewardradar.cache.CacheTtlPolicy;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Response cache TTLs. Documented in application.yml under rewardradar.cache.
 */
@ConfigurationProperties(prefix = "rewardradar.cache")
@NoArgsConstructor
@Getter
@Setter
public class CacheProperties {

    /** TTL per data kind; kinds left out keep their default. */
    private Map<CacheKind, Duration> ttl = new EnumMap<>(CacheKind.class);

    /** TTL for current-day data in the last two hours before UTC midnight. */
    private Duration dayEndTtl = Duration.ofMinutes(1);

    /** TTL for current-period data in the last days of the month. */
    private Duration monthEndTtl = Duration.ofMinutes(5);

    public Map<CacheKind, Duration> resolvedTtls() {
        Map<CacheKind, Duration> resolved = CacheTtlPolicy.defaultTtls();
        if (ttl != null) {
            resolved.putAll(ttl);
        }
        return resolved;
    }
}
