package com.rewardradar.polling;

import com.rewardradar.client.Device;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Device ids of the home grouped by type. Only reward-relevant types are kept.
 */
@Component
public class DeviceInventory {

    public static final Set<String> TRACKED_TYPES =
            Set.of("REAL_TIME_METER", "INVERTER", "BATTERY", "ELECTRIC_VEHICLE", "EV_CHARGER");

    private volatile Map<String, List<String>> idsByType = Map.of();
    private volatile Instant updatedAt;

    public void replace(List<Device> devices, Instant now) {
        Map<String, List<String>> grouped = new LinkedHashMap<>();
        for (Device device : devices) {
            if (device.id() != null && TRACKED_TYPES.contains(device.type())) {
                grouped.computeIfAbsent(device.type(), t -> new ArrayList<>()).add(device.id());
            }
        }
        grouped.replaceAll((type, ids) -> List.copyOf(ids));
        idsByType = Collections.unmodifiableMap(grouped);
        updatedAt = now;
    }

    public Map<String, List<String>> idsByType() {
        return idsByType;
    }

    public Optional<Instant> updatedAt() {
        return Optional.ofNullable(updatedAt);
    }
}
