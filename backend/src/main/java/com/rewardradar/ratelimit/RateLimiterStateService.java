package com.rewardradar.ratelimit;

import com.rewardradar.domain.RateLimiterState;
import com.rewardradar.domain.RateLimiterStateRepository;
import com.rewardradar.ratelimit.config.RateLimitProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Loads limiter counters at startup and writes them back on a fixed interval when they changed, plus once on shutdown.
 * Storage failures are logged; limiting continues in memory.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RateLimiterStateService {

    private final RateLimiter rateLimiter;
    private final RateLimiterStateRepository repository;
    private final RateLimitProperties properties;

    @PostConstruct
    public void restore() {
        try {
            Optional<RateLimiterState> stored = repository.findById(properties.getStateId());
            if (stored.isPresent()) {
                rateLimiter.restore(stored.get());
                log.info("Restored rate limiter state for {}: hourly={}, burst={}", properties.getStateId(),
                        stored.get().getHourlyCount(), stored.get().getBurstCount());
            } else {
                log.debug("No stored rate limiter state for {}, starting with empty windows", properties.getStateId());
            }
        } catch (Exception e) {
            log.warn("Failed to restore rate limiter state: {}", e.getMessage());
        }
    }

    @Scheduled(
            fixedDelayString = "${rewardradar.rate-limit.persist-interval-ms:60000}",
            initialDelayString = "${rewardradar.rate-limit.persist-interval-ms:60000}")
    public void flushIfDirty() {
        rateLimiter.snapshotIfDirty(properties.getStateId()).ifPresent(this::save);
    }

    @PreDestroy
    public void flushOnShutdown() {
        save(rateLimiter.snapshot(properties.getStateId()));
    }

    /**
     * Empties both windows and removes the stored document.
     */
    public void reset() {
        rateLimiter.reset();
        try {
            repository.deleteById(properties.getStateId());
            log.info("Rate limiter state for {} reset", properties.getStateId());
        } catch (Exception e) {
            log.warn("Failed to remove rate limiter state: {}", e.getMessage());
        }
    }

    private void save(RateLimiterState state) {
        try {
            repository.save(state);
            log.debug("Saved rate limiter state: hourly={}, burst={}", state.getHourlyCount(), state.getBurstCount());
        } catch (Exception e) {
            rateLimiter.markDirty();
            log.warn("Failed to save rate limiter state: {}", e.getMessage());
        }
    }
}
