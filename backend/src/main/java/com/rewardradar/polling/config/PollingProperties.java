package com.rewardradar.polling.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Poll intervals and fetch pool size. Documented in application.yml under rewardradar.polling.
 */
@ConfigurationProperties(prefix = "rewardradar.polling")
@NoArgsConstructor
@Getter
@Setter
public class PollingProperties {

    /** Rewards poll interval. Default 15 minutes. */
    private long rewardsIntervalMs = 900_000L;

    /** Delay before the first rewards poll after startup. */
    private long rewardsInitialDelayMs = 10_000L;

    /** Device inventory poll interval. Default 12 hours. */
    private long devicesIntervalMs = 43_200_000L;

    /** Parallel period fetches. */
    private int fetchPoolSize = 4;

    /** Switch both poll jobs off, e.g. in tests or when only manual refresh is wanted. */
    private boolean enabled = true;
}
