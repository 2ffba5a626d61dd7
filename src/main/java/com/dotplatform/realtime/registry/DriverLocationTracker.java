package com.dotplatform.realtime.registry;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last reported position per driver. Ephemeral: kept in memory only and overwritten by every
 * update.
 */
@Component
public class DriverLocationTracker {

    private final Map<Long, DriverLocation> locations = new ConcurrentHashMap<>();

    public void update(Long driverId, DriverLocation location) {
        locations.put(driverId, location);
    }

    public Map<Long, DriverLocation> snapshot() {
        return Map.copyOf(locations);
    }
}
