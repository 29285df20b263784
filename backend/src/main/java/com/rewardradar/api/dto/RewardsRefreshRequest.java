package com.rewardradar.api.dto;

import com.rewardradar.fetch.DeviceCategory;
import com.rewardradar.fetch.StandardPeriod;

/**
 * Optional filter for a manual refresh. Null fields mean "all".
 */
public record RewardsRefreshRequest(StandardPeriod period, DeviceCategory category) {
}
