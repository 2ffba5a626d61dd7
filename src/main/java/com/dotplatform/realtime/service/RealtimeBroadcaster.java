package com.dotplatform.realtime.service;

import com.dotplatform.common.security.UserRole;
import com.dotplatform.realtime.message.DriverLocationPayload;
import com.dotplatform.realtime.message.MessageType;
import com.dotplatform.realtime.message.RealtimeMessage;
import com.dotplatform.realtime.registry.ConnectionRegistry;
import com.dotplatform.realtime.registry.DriverLocation;
import com.dotplatform.realtime.registry.DriverLocationTracker;
import com.dotplatform.realtime.registry.RealtimeConnection;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Fan-out hub for real-time events.
 *
 * <h3>Delivery model</h3>
 * <ul>
 *   <li>Best-effort: no ordering, acknowledgement or replay. A client that reconnects re-reads
 *       state over HTTP.</li>
 *   <li>A message is serialized once and written to a snapshot of the target connections.
 *       No registry structure is locked while writing.</li>
 *   <li>A failed or closed connection is logged, closed and evicted; the remaining targets
 *       still receive the message. Nothing is ever thrown back to the caller.</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RealtimeBroadcaster {

    private final ConnectionRegistry registry;
    private final DriverLocationTracker locationTracker;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void register(RealtimeConnection connection) {
        registry.register(connection);
        log.info("Realtime connection registered: userId={}, role={}, connectionId={}",
                connection.userId(), connection.role(), connection.id());
    }

    public void unregister(RealtimeConnection connection) {
        if (registry.unregister(connection)) {
            log.info("Realtime connection removed: userId={}, connectionId={}", connection.userId(), connection.id());
        }
    }

    public void sendToUser(Long userId, RealtimeMessage message) {
        deliver(registry.connectionsOf(userId), message);
    }

    public void broadcastToRole(UserRole role, RealtimeMessage message) {
        deliver(registry.connectionsWithRole(role), message);
    }

    public void reply(RealtimeConnection connection, RealtimeMessage message) {
        deliver(List.of(connection), message);
    }

    /**
     * Overwrites the driver's last known position and pushes it to every admin connection.
     */
    public void updateDriverLocation(Long driverId, double latitude, double longitude) {
        LocalDateTime now = LocalDateTime.now(clock);
        locationTracker.update(driverId, new DriverLocation(latitude, longitude, now));
        broadcastToRole(UserRole.ADMIN, new RealtimeMessage(MessageType.DRIVER_LOCATION,
                new DriverLocationPayload(driverId, latitude, longitude, now)));
    }

    public Map<Long, DriverLocation> getDriverLocations() {
        return locationTracker.snapshot();
    }

    /**
     * Liveness sweep: evicts closed connections and pings the rest. A ping that cannot be
     * written marks the connection dead.
     */
    @Scheduled(fixedDelayString = "${dot.realtime.ping-interval-ms:30000}")
    public void sweepConnections() {
        for (RealtimeConnection connection : registry.allConnections()) {
            if (!connection.isOpen()) {
                evict(connection, "closed");
                continue;
            }
            try {
                connection.ping();
            } catch (IOException | RuntimeException e) {
                evict(connection, "ping failed: " + e.getMessage());
            }
        }
    }

    private void deliver(Collection<RealtimeConnection> targets, RealtimeMessage message) {
        if (targets.isEmpty()) {
            return;
        }
        String payload;
        try {
            payload = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize realtime message: type={}", message.type(), e);
            return;
        }

        for (RealtimeConnection connection : targets) {
            if (!connection.isOpen()) {
                evict(connection, "closed");
                continue;
            }
            try {
                connection.send(payload);
            } catch (IOException | RuntimeException e) {
                evict(connection, "send failed: " + e.getMessage());
            }
        }
    }

    private void evict(RealtimeConnection connection, String reason) {
        log.warn("Evicting realtime connection: userId={}, connectionId={}, reason={}",
                connection.userId(), connection.id(), reason);
        registry.unregister(connection);
        connection.close();
    }
}
