package com.rewardradar.cache;

import com.rewardradar.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CacheTtlPolicyTest {

    private final MutableClock clock = MutableClock.at("2024-05-10T12:00:00Z");
    private final CacheTtlPolicy policy = new CacheTtlPolicy(CacheTtlPolicy.defaultTtls(),
            Duration.ofMinutes(1), Duration.ofMinutes(5), clock);

    @Test
    @DisplayName("mid-day, mid-month TTLs come straight from the table")
    void table_lookup() {
        assertThat(policy.ttlFor(CacheKind.HOME_LIST)).isEqualTo(Duration.ofHours(1));
        assertThat(policy.ttlFor(CacheKind.DEVICE_LIST)).isEqualTo(Duration.ofMinutes(30));
        assertThat(policy.ttlFor(CacheKind.CURRENT_DAY)).isEqualTo(Duration.ofMinutes(5));
        assertThat(policy.ttlFor(CacheKind.CURRENT_PERIOD)).isEqualTo(Duration.ofMinutes(15));
        assertThat(policy.ttlFor(CacheKind.HISTORICAL_PERIOD)).isEqualTo(Duration.ofHours(1));
    }

    @Test
    @DisplayName("current-day TTL shortens in the last two hours before UTC midnight")
    void currentDay_nearMidnight() {
        clock.set(Instant.parse("2024-05-10T22:30:00Z"));
        assertThat(policy.ttlFor(CacheKind.CURRENT_DAY)).isEqualTo(Duration.ofMinutes(1));
        assertThat(policy.ttlFor(CacheKind.HISTORICAL_PERIOD)).isEqualTo(Duration.ofHours(1));
    }

    @Test
    @DisplayName("current-period TTL shortens at the end of the month")
    void currentPeriod_nearMonthEnd() {
        clock.set(Instant.parse("2024-05-30T08:00:00Z"));
        assertThat(policy.ttlFor(CacheKind.CURRENT_PERIOD)).isEqualTo(Duration.ofMinutes(5));
        clock.set(Instant.parse("2024-05-20T08:00:00Z"));
        assertThat(policy.ttlFor(CacheKind.CURRENT_PERIOD)).isEqualTo(Duration.ofMinutes(15));
    }

    @Test
    @DisplayName("every kind needs a TTL")
    void missingKind_rejected() {
        Map<CacheKind, Duration> partial = new EnumMap<>(CacheKind.class);
        partial.put(CacheKind.HOME_LIST, Duration.ofHours(1));
        assertThatThrownBy(() -> new CacheTtlPolicy(partial, Duration.ofMinutes(1), Duration.ofMinutes(5), clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
