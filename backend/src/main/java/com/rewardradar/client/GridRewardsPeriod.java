package com.rewardradar.client;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One gridRewardsHistoryPeriod answer: vehicle, battery and total rewards for a period.
 * Reward fields are null when the API reports no value.
 */
public record GridRewardsPeriod(
        BigDecimal vehicleRewards,
        BigDecimal batteryRewards,
        BigDecimal totalReward,
        String currency,
        Instant from,
        Instant to) {
}
