package com.rewardradar.polling;

import com.rewardradar.client.Device;
import com.rewardradar.client.RewardsApiException;
import com.rewardradar.common.Redaction;
import com.rewardradar.fetch.FetchOrchestrator;
import com.rewardradar.polling.config.PollingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Device inventory poll, on its own slower interval. A failed poll keeps the previous inventory.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DevicePollJob {

    private final FetchOrchestrator fetchOrchestrator;
    private final DeviceInventory deviceInventory;
    private final HomeSelection homeSelection;
    private final PollingProperties pollingProperties;
    private final Clock clock;

    @Scheduled(fixedRateString = "${rewardradar.polling.devices-interval-ms:43200000}")
    public void runScheduled() {
        if (!pollingProperties.isEnabled()) {
            return;
        }
        pollDevices();
    }

    public boolean pollDevices() {
        Optional<String> homeId = homeSelection.homeId();
        if (homeId.isEmpty()) {
            log.warn("Device poll skipped: no home available");
            return false;
        }
        try {
            List<Device> devices = fetchOrchestrator.fetchDevices(homeId.get());
            deviceInventory.replace(devices, clock.instant());
            log.info("Device poll for home {}: tracking {}", Redaction.shortId(homeId.get()),
                    deviceInventory.idsByType().keySet());
            return true;
        } catch (RewardsApiException e) {
            log.warn("Device poll for home {} failed: {}", Redaction.shortId(homeId.get()), e.getMessage());
            return false;
        }
    }
}
