package com.rewardradar.client;

import java.time.Instant;
import java.util.List;

/**
 * Outbound calls to the rewards API. Implementations translate HTTP outcomes into the
 * {@link RewardsApiException} hierarchy; they do not retry.
 */
public interface RewardsApiClient {

    /**
     * Exchanges credentials for a raw bearer token.
     */
    String login(Credentials credentials);

    GridRewardsPeriod fetchGridRewards(AccessToken token, String homeId, Instant from, Instant to);

    List<Home> fetchHomes(AccessToken token);

    List<Device> fetchDevices(AccessToken token, String homeId);
}
