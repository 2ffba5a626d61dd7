package com.dotplatform.realtime.handler;

import com.dotplatform.common.security.AuthenticatedUser;
import com.dotplatform.common.security.UserRole;
import com.dotplatform.realtime.message.MessageType;
import com.dotplatform.realtime.message.RealtimeMessage;
import com.dotplatform.realtime.registry.RealtimeConnection;
import com.dotplatform.realtime.registry.WebSocketConnection;
import com.dotplatform.realtime.service.RealtimeBroadcaster;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Endpoint {@code /ws}.
 *
 * <h3>Inbound messages</h3>
 * <pre>
 *   {"type": "driver_location", "data": {"latitude": 33.51, "longitude": 36.29}}   drivers only
 *   {"type": "get_driver_locations"}                                               admins only
 * </pre>
 * {@code order_update} and {@code new_order} are emitted by the server when an order changes;
 * clients cannot inject them. Malformed or unauthorized messages get an {@code error} reply and
 * the connection stays open.
 */
@Slf4j
@Component
public class RealtimeWebSocketHandler extends TextWebSocketHandler {

    private final RealtimeBroadcaster broadcaster;
    private final ObjectMapper objectMapper;
    private final int sendTimeLimitMs;
    private final int bufferSizeLimitBytes;
    private final Map<String, RealtimeConnection> connections = new ConcurrentHashMap<>();

    public RealtimeWebSocketHandler(RealtimeBroadcaster broadcaster, ObjectMapper objectMapper,
                                    @Value("${dot.realtime.send-time-limit-ms:5000}") int sendTimeLimitMs,
                                    @Value("${dot.realtime.buffer-size-limit-bytes:524288}") int bufferSizeLimitBytes) {
        this.broadcaster = broadcaster;
        this.objectMapper = objectMapper;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimitBytes = bufferSizeLimitBytes;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        Object attribute = session.getAttributes().get(JwtHandshakeInterceptor.USER_ATTRIBUTE);
        if (!(attribute instanceof AuthenticatedUser user)) {
            session.close(CloseStatus.POLICY_VIOLATION);
            return;
        }
        RealtimeConnection connection = new WebSocketConnection(
                session, user.userId(), user.role(), sendTimeLimitMs, bufferSizeLimitBytes);
        connections.put(session.getId(), connection);
        broadcaster.register(connection);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        RealtimeConnection connection = connections.get(session.getId());
        if (connection == null) {
            return;
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            broadcaster.reply(connection, RealtimeMessage.error("Malformed message"));
            return;
        }

        Optional<MessageType> type = Optional.ofNullable(root.get("type"))
                .map(JsonNode::asText)
                .flatMap(MessageType::fromWireName);
        if (type.isEmpty()) {
            broadcaster.reply(connection, RealtimeMessage.error("Unknown message type"));
            return;
        }

        switch (type.get()) {
            case DRIVER_LOCATION -> handleDriverLocation(connection, root.get("data"));
            case GET_DRIVER_LOCATIONS -> handleGetDriverLocations(connection);
            default -> broadcaster.reply(connection,
                    RealtimeMessage.error(type.get().getWireName() + " is not accepted from clients"));
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Transport error: sessionId={}, cause={}", session.getId(), exception.toString());
        remove(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        remove(session);
    }

    private void handleDriverLocation(RealtimeConnection connection, JsonNode data) {
        if (connection.role() != UserRole.DRIVER) {
            broadcaster.reply(connection, RealtimeMessage.error("Only drivers can report locations"));
            return;
        }
        if (data == null || !data.path("latitude").isNumber() || !data.path("longitude").isNumber()) {
            broadcaster.reply(connection, RealtimeMessage.error("latitude and longitude are required"));
            return;
        }
        double latitude = data.get("latitude").asDouble();
        double longitude = data.get("longitude").asDouble();
        if (Math.abs(latitude) > 90 || Math.abs(longitude) > 180) {
            broadcaster.reply(connection, RealtimeMessage.error("Coordinates out of range"));
            return;
        }
        broadcaster.updateDriverLocation(connection.userId(), latitude, longitude);
    }

    private void handleGetDriverLocations(RealtimeConnection connection) {
        if (connection.role() != UserRole.ADMIN) {
            broadcaster.reply(connection, RealtimeMessage.error("Only admins can read driver locations"));
            return;
        }
        broadcaster.reply(connection,
                new RealtimeMessage(MessageType.DRIVER_LOCATIONS, broadcaster.getDriverLocations()));
    }

    private void remove(WebSocketSession session) {
        RealtimeConnection connection = connections.remove(session.getId());
        if (connection != null) {
            broadcaster.unregister(connection);
        }
    }
}
