package com.dotplatform.realtime.registry;

import com.dotplatform.common.security.UserRole;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live connections indexed by user id and by role.
 *
 * <p>A user may hold several connections (several devices or tabs). Each user's entry is a
 * concurrent set mutated through {@link ConcurrentHashMap#compute}, so registrations for
 * different users never contend and an emptied entry is removed atomically. Lookups return
 * snapshots; no caller ever iterates a live set while sending.</p>
 */
@Component
public class ConnectionRegistry {

    private final Map<Long, Set<RealtimeConnection>> connectionsByUser = new ConcurrentHashMap<>();
    private final Map<UserRole, Set<RealtimeConnection>> connectionsByRole = new EnumMap<>(UserRole.class);

    public ConnectionRegistry() {
        for (UserRole role : UserRole.values()) {
            connectionsByRole.put(role, ConcurrentHashMap.newKeySet());
        }
    }

    public void register(RealtimeConnection connection) {
        connectionsByUser.compute(connection.userId(), (userId, connections) -> {
            Set<RealtimeConnection> target = connections == null ? ConcurrentHashMap.newKeySet() : connections;
            target.add(connection);
            return target;
        });
        connectionsByRole.get(connection.role()).add(connection);
    }

    /**
     * @return {@code true} if the connection was registered
     */
    public boolean unregister(RealtimeConnection connection) {
        boolean removed = connectionsByRole.get(connection.role()).remove(connection);
        connectionsByUser.computeIfPresent(connection.userId(), (userId, connections) -> {
            connections.remove(connection);
            return connections.isEmpty() ? null : connections;
        });
        return removed;
    }

    public List<RealtimeConnection> connectionsOf(Long userId) {
        Set<RealtimeConnection> connections = connectionsByUser.get(userId);
        return connections == null ? List.of() : List.copyOf(connections);
    }

    public List<RealtimeConnection> connectionsWithRole(UserRole role) {
        return List.copyOf(connectionsByRole.get(role));
    }

    public List<RealtimeConnection> allConnections() {
        List<RealtimeConnection> all = new ArrayList<>();
        connectionsByRole.values().forEach(all::addAll);
        return all;
    }
}
