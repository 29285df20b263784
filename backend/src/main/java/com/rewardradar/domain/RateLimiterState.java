package com.rewardradar.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Persisted rate limiter counters, one document per account. Written on a timer, not per request.
 */
@Document(collection = "rate_limiter_state")
@NoArgsConstructor
@Getter
@Setter
public class RateLimiterState {

    @Id
    private String id;
    private int hourlyCount;
    private Instant hourlyWindowStart;
    private int burstCount;
    private Instant burstWindowStart;
    private Instant updatedAt;
}
