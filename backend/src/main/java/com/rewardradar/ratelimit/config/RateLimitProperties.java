package com.rewardradar.ratelimit.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Client-side request budget. Documented in application.yml under rewardradar.rate-limit.
 */
@ConfigurationProperties(prefix = "rewardradar.rate-limit")
@NoArgsConstructor
@Getter
@Setter
public class RateLimitProperties {

    /** Requests admitted per rolling hour. The API allows about 100; default leaves headroom. */
    private int hourlyCapacity = 80;

    /** Requests admitted per burst window. */
    private int burstCapacity = 20;

    /** Burst window length. Default 15 minutes. */
    private Duration burstWindow = Duration.ofMinutes(15);

    /** How often changed counters are written to MongoDB. Default 60000. */
    private long persistIntervalMs = 60_000L;

    /** Document id of the persisted state; one per account. */
    private String stateId = "default";
}
