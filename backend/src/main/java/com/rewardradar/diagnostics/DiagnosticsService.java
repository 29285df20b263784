package com.rewardradar.diagnostics;

import com.rewardradar.auth.TokenStore;
import com.rewardradar.cache.CacheStats;
import com.rewardradar.cache.ResponseCache;
import com.rewardradar.client.config.RewardsApiProperties;
import com.rewardradar.common.Redaction;
import com.rewardradar.polling.DeviceInventory;
import com.rewardradar.ratelimit.RateLimiter;
import com.rewardradar.retry.RetryEventLog;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class DiagnosticsService {

    private final ResponseCache responseCache;
    private final RateLimiter rateLimiter;
    private final TokenStore tokenStore;
    private final RetryEventLog retryEventLog;
    private final DeviceInventory deviceInventory;
    private final RewardsApiProperties apiProperties;
    private final Clock clock;

    public DiagnosticsSnapshot snapshot() {
        CacheStats stats = responseCache.stats();
        Map<String, List<String>> devices = deviceInventory.idsByType().entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey,
                        e -> e.getValue().stream().map(Redaction::shortId).toList()));
        String homeId = apiProperties.getHomeId();
        return new DiagnosticsSnapshot(
                clock.instant(),
                homeId == null || homeId.isBlank() ? null : Redaction.shortId(homeId),
                new DiagnosticsSnapshot.Cache(stats.entries(), stats.hits(), stats.misses(),
                        stats.totalRequests(), stats.hitRate()),
                rateLimiter.occupancy(),
                tokenStore.lastAuthenticatedAt().orElse(null),
                retryEventLog.recent(),
                devices,
                deviceInventory.updatedAt().orElse(null));
    }
}
