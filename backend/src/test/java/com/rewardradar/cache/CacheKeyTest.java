package com.rewardradar.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CacheKeyTest {

    private static final String HOME = "96a14971-525a-4420-aae9-e5aedaa129ff";

    @Test
    @DisplayName("same logical request gives the same digest regardless of parameter order")
    void sameRequest_sameDigest() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("from", Instant.parse("2024-05-01T00:00:00Z"));
        first.put("to", Instant.parse("2024-06-01T00:00:00Z"));
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("to", Instant.parse("2024-06-01T00:00:00Z"));
        second.put("from", Instant.parse("2024-05-01T00:00:00Z"));

        CacheKey a = CacheKey.of("gridRewards", HOME, CacheKind.CURRENT_PERIOD, first);
        CacheKey b = CacheKey.of("gridRewards", HOME, CacheKind.CURRENT_PERIOD, second);

        assertThat(a).isEqualTo(b);
        assertThat(a.digest()).hasSize(64).matches("[0-9a-f]+");
    }

    @Test
    @DisplayName("different period, home or query gives a different digest")
    void differentRequest_differentDigest() {
        Map<String, Object> may = Map.of("from", "2024-05-01", "to", "2024-06-01");
        Map<String, Object> june = Map.of("from", "2024-06-01", "to", "2024-07-01");
        CacheKey base = CacheKey.of("gridRewards", HOME, CacheKind.CURRENT_PERIOD, may);

        assertThat(CacheKey.of("gridRewards", HOME, CacheKind.CURRENT_PERIOD, june)).isNotEqualTo(base);
        assertThat(CacheKey.of("gridRewards", "11111111-2222-3333-4444-555555555555", CacheKind.CURRENT_PERIOD, may))
                .isNotEqualTo(base);
        assertThat(CacheKey.of("gizmos", HOME, CacheKind.CURRENT_PERIOD, may)).isNotEqualTo(base);
    }

    @Test
    @DisplayName("kind only chooses the TTL and is not part of the identity")
    void kind_notPartOfIdentity() {
        CacheKey current = CacheKey.of("gridRewards", HOME, CacheKind.CURRENT_PERIOD, Map.of("from", "a"));
        CacheKey historical = CacheKey.of("gridRewards", HOME, CacheKind.HISTORICAL_PERIOD, Map.of("from", "a"));
        assertThat(historical).isEqualTo(current);
        assertThat(historical.kind()).isEqualTo(CacheKind.HISTORICAL_PERIOD);
    }
}
