package com.rewardradar.polling;

import com.rewardradar.client.Home;
import com.rewardradar.client.RewardsApiException;
import com.rewardradar.client.config.RewardsApiProperties;
import com.rewardradar.common.Redaction;
import com.rewardradar.fetch.FetchOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Home whose rewards are polled: the configured id, or else the first home on the account.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HomeSelection {

    private final RewardsApiProperties apiProperties;
    private final FetchOrchestrator fetchOrchestrator;

    public Optional<String> homeId() {
        String configured = apiProperties.getHomeId();
        if (configured != null && !configured.isBlank()) {
            return Optional.of(configured.trim());
        }
        try {
            List<Home> homes = fetchOrchestrator.fetchHomes();
            if (homes.isEmpty()) {
                log.warn("No homes found on the account");
                return Optional.empty();
            }
            String id = homes.get(0).id();
            log.info("No home configured, using first home {}", Redaction.shortId(id));
            return Optional.of(id);
        } catch (RewardsApiException e) {
            log.warn("Could not resolve home: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
