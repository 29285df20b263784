package com.rewardradar.client;

/**
 * Home registered on the account.
 */
public record Home(String id, String timeZone, boolean hasSmartMeterCapabilities,
                   boolean hasSignedEnergyDeal, boolean hasConsumption) {
}
