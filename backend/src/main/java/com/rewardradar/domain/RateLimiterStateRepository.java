package com.rewardradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for rate_limiter_state. Used by RateLimiterStateService on startup, on a timer and on shutdown.
 */
public interface RateLimiterStateRepository extends MongoRepository<RateLimiterState, String> {
}
