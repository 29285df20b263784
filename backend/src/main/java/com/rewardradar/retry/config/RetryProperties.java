package com.rewardradar.retry.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * API retry policy (exponential backoff with jitter). Documented in application.yml.
 */
@ConfigurationProperties(prefix = "rewardradar.retry")
@NoArgsConstructor
@Getter
@Setter
public class RetryProperties {

    /** Attempts per operation, including the first. Default 3. */
    private int maxAttempts = 3;

    /** Base delay in ms for the first retry; doubles each attempt. Default 1000. */
    private long baseDelayMs = 1000L;

    /** Upper bound for the un-jittered delay. Default 60000. */
    private long maxDelayMs = 60_000L;

    /** Jitter ratio in [0, 1), e.g. 0.3 for +/-30%. Default 0.3. */
    private double jitterRatio = 0.3;

    /** How many recent retry events diagnostics keeps. Default 50. */
    private int eventLogSize = 50;
}
