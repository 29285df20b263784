package com.rewardradar.fetch;

import com.rewardradar.cache.CacheKey;
import com.rewardradar.cache.CacheKind;
import com.rewardradar.cache.ResponseCache;
import com.rewardradar.client.CredentialsInvalidException;
import com.rewardradar.client.Device;
import com.rewardradar.client.FetchCancelledException;
import com.rewardradar.client.GridRewardsPeriod;
import com.rewardradar.client.Home;
import com.rewardradar.client.RetryExhaustedException;
import com.rewardradar.client.RewardsApiClient;
import com.rewardradar.client.RewardsQueryException;
import com.rewardradar.common.Redaction;
import com.rewardradar.retry.RetryExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Entry point for reward lookups. Each period goes cache, then rate limiter and retry executor, then cache put.
 * {@link #fetchAll} fans requests out on the fetch executor and joins them; a failing period only affects its own result.
 * Requests that differ only in category share one remote query.
 */
@Slf4j
public class FetchOrchestrator {

    static final String GRID_REWARDS = "gridRewardsHistoryPeriod";
    static final String HOMES = "homes";
    static final String DEVICES = "gizmos";

    private static final Duration HISTORICAL_AFTER = Duration.ofDays(1);
    private static final Duration DAY = Duration.ofDays(1);

    private final RetryExecutor retryExecutor;
    private final RewardsApiClient apiClient;
    private final ResponseCache responseCache;
    private final AsyncTaskExecutor fetchExecutor;
    private final Clock clock;
    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();

    private volatile boolean shutdown;

    public FetchOrchestrator(RetryExecutor retryExecutor, RewardsApiClient apiClient, ResponseCache responseCache,
                             AsyncTaskExecutor fetchExecutor, Clock clock) {
        this.retryExecutor = retryExecutor;
        this.apiClient = apiClient;
        this.responseCache = responseCache;
        this.fetchExecutor = fetchExecutor;
        this.clock = clock;
    }

    /**
     * Fetches all requests concurrently. Duplicates collapse; every distinct request gets exactly one result.
     */
    public Map<RewardPeriodRequest, RewardPeriodResult> fetchAll(Collection<RewardPeriodRequest> requests) {
        Map<RewardPeriodRequest, RewardPeriodResult> results = new LinkedHashMap<>();
        Map<CacheKey, List<RewardPeriodRequest>> groups = new LinkedHashMap<>();
        for (RewardPeriodRequest request : requests) {
            if (results.containsKey(request)) {
                continue;
            }
            try {
                request.validate();
            } catch (InvalidPeriodRequestException e) {
                results.put(request, RewardPeriodResult.failure(FetchFailure.INVALID_REQUEST, e.getMessage()));
                continue;
            }
            List<RewardPeriodRequest> group = groups.computeIfAbsent(rewardsKey(request), k -> new ArrayList<>());
            if (!group.contains(request)) {
                group.add(request);
            }
        }

        Map<CacheKey, Future<GridRewardsPeriod>> futures = new LinkedHashMap<>();
        for (Map.Entry<CacheKey, List<RewardPeriodRequest>> group : groups.entrySet()) {
            RewardPeriodRequest first = group.getValue().get(0);
            Future<GridRewardsPeriod> future = submit(group.getKey(), first);
            if (future != null) {
                futures.put(group.getKey(), future);
            }
        }

        int failed = 0;
        for (Map.Entry<CacheKey, List<RewardPeriodRequest>> group : groups.entrySet()) {
            Future<GridRewardsPeriod> future = futures.get(group.getKey());
            for (RewardPeriodRequest request : group.getValue()) {
                RewardPeriodResult result = future == null
                        ? RewardPeriodResult.failure(FetchFailure.CANCELLED, "Fetch executor is shut down")
                        : join(request, future);
                results.put(request, result);
            }
        }
        for (RewardPeriodResult result : results.values()) {
            if (!result.isSuccess()) {
                failed++;
            }
        }
        log.info("Fetched {} reward periods ({} remote queries or cache reads), {} failed",
                results.size(), groups.size(), failed);
        return results;
    }

    /**
     * Single lookup on the calling thread, e.g. for a manual refresh.
     */
    public RewardPeriodResult fetchOne(RewardPeriodRequest request) {
        try {
            request.validate();
            if (shutdown) {
                return RewardPeriodResult.failure(FetchFailure.CANCELLED, "Fetch orchestrator is shut down");
            }
            return project(request, loadRewards(rewardsKey(request), request));
        } catch (RuntimeException e) {
            return failureFor(request, e);
        }
    }

    public void clearCache() {
        responseCache.clear();
    }

    /**
     * Drops cached responses of one home only.
     */
    public int clearCache(String homeId) {
        int removed = responseCache.invalidateHome(homeId);
        log.info("Cleared {} cached responses for home {}", removed, Redaction.shortId(homeId));
        return removed;
    }

    /**
     * Homes on the account, cached as {@link CacheKind#HOME_LIST}.
     */
    @SuppressWarnings("unchecked")
    public List<Home> fetchHomes() {
        CacheKey key = CacheKey.of(HOMES, null, CacheKind.HOME_LIST, Map.of());
        return responseCache.get(key, List.class)
                .map(cached -> (List<Home>) cached)
                .orElseGet(() -> {
                    List<Home> homes = List.copyOf(retryExecutor.execute("fetchHomes", apiClient::fetchHomes));
                    responseCache.put(key, homes);
                    log.info("Fetched {} homes", homes.size());
                    return homes;
                });
    }

    /**
     * Devices of a home, cached as {@link CacheKind#DEVICE_LIST}.
     */
    @SuppressWarnings("unchecked")
    public List<Device> fetchDevices(String homeId) {
        CacheKey key = CacheKey.of(DEVICES, homeId, CacheKind.DEVICE_LIST, Map.of());
        return responseCache.get(key, List.class)
                .map(cached -> (List<Device>) cached)
                .orElseGet(() -> {
                    List<Device> devices = List.copyOf(retryExecutor.execute("fetchDevices",
                            token -> apiClient.fetchDevices(token, homeId)));
                    responseCache.put(key, devices);
                    log.info("Fetched {} devices for home {}", devices.size(), Redaction.shortId(homeId));
                    return devices;
                });
    }

    /**
     * Stops accepting work and interrupts fetches in flight; they report {@link FetchFailure#CANCELLED}.
     */
    public void shutdown() {
        shutdown = true;
        int cancelled = 0;
        for (Future<?> future : inFlight) {
            if (future.cancel(true)) {
                cancelled++;
            }
        }
        inFlight.clear();
        if (cancelled > 0) {
            log.info("Cancelled {} in-flight fetches on shutdown", cancelled);
        }
    }

    CacheKind kindFor(Instant from, Instant to) {
        Instant now = clock.instant();
        if (to.isBefore(now.minus(HISTORICAL_AFTER))) {
            return CacheKind.HISTORICAL_PERIOD;
        }
        if (Duration.between(from, to).compareTo(DAY) <= 0) {
            return CacheKind.CURRENT_DAY;
        }
        return CacheKind.CURRENT_PERIOD;
    }

    private CacheKey rewardsKey(RewardPeriodRequest request) {
        return CacheKey.of(GRID_REWARDS, request.homeId(), kindFor(request.from(), request.to()),
                Map.of("from", request.from(), "to", request.to()));
    }

    private Future<GridRewardsPeriod> submit(CacheKey key, RewardPeriodRequest request) {
        if (shutdown) {
            return null;
        }
        try {
            Future<GridRewardsPeriod> future = fetchExecutor.submit(() -> loadRewards(key, request));
            inFlight.add(future);
            if (shutdown) {
                // shutdown() may have iterated inFlight before the add
                future.cancel(true);
            }
            return future;
        } catch (TaskRejectedException e) {
            log.warn("Fetch for {} rejected: {}", request.label(), e.getMessage());
            return null;
        }
    }

    private RewardPeriodResult join(RewardPeriodRequest request, Future<GridRewardsPeriod> future) {
        try {
            return project(request, future.get());
        } catch (CancellationException e) {
            return RewardPeriodResult.failure(FetchFailure.CANCELLED, "Fetch cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return RewardPeriodResult.failure(FetchFailure.CANCELLED, "Interrupted while waiting for fetch");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                return failureFor(request, runtime);
            }
            log.error("Fetch for {} failed unexpectedly", request.label(), cause);
            return RewardPeriodResult.failure(FetchFailure.UNEXPECTED_ERROR, String.valueOf(cause));
        } finally {
            inFlight.remove(future);
        }
    }

    private GridRewardsPeriod loadRewards(CacheKey key, RewardPeriodRequest request) {
        return responseCache.get(key, GridRewardsPeriod.class).orElseGet(() -> {
            GridRewardsPeriod period = retryExecutor.execute("fetchGridRewards",
                    token -> apiClient.fetchGridRewards(token, request.homeId(), request.from(), request.to()));
            responseCache.put(key, period);
            return period;
        });
    }

    private RewardPeriodResult project(RewardPeriodRequest request, GridRewardsPeriod period) {
        BigDecimal amount = request.category().amountOf(period);
        if (amount == null) {
            return RewardPeriodResult.failure(FetchFailure.QUERY_FAILED,
                    "No " + request.category() + " reward reported for the period");
        }
        return RewardPeriodResult.success(amount, period.currency(), period.from(), period.to());
    }

    private RewardPeriodResult failureFor(RewardPeriodRequest request, RuntimeException e) {
        if (e instanceof FetchCancelledException || (shutdown && !(e instanceof CredentialsInvalidException))) {
            return RewardPeriodResult.failure(FetchFailure.CANCELLED, e.getMessage());
        }
        if (e instanceof CredentialsInvalidException) {
            return RewardPeriodResult.failure(FetchFailure.CREDENTIALS_INVALID, e.getMessage());
        }
        if (e instanceof RetryExhaustedException) {
            log.warn("Fetch for {} exhausted retries: {}", request.label(), e.getMessage());
            return RewardPeriodResult.failure(FetchFailure.RETRY_EXHAUSTED, e.getMessage());
        }
        if (e instanceof RewardsQueryException) {
            log.warn("Query for {} failed: {}", request.label(), e.getMessage());
            return RewardPeriodResult.failure(FetchFailure.QUERY_FAILED, e.getMessage());
        }
        if (e instanceof InvalidPeriodRequestException) {
            return RewardPeriodResult.failure(FetchFailure.INVALID_REQUEST, e.getMessage());
        }
        log.error("Fetch for {} failed unexpectedly", request.label(), e);
        return RewardPeriodResult.failure(FetchFailure.UNEXPECTED_ERROR, e.getMessage());
    }
}
