package com.dotplatform.realtime.registry;

import com.dotplatform.common.security.UserRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * {@link RealtimeConnection} over a Spring WebSocket session.
 *
 * <p>Sends go through {@link ConcurrentWebSocketSessionDecorator}: a thread that finds another
 * send in progress only buffers its message and returns. A client that stays blocked longer
 * than the send time limit, or lets the buffer overflow, makes the send throw and is then
 * evicted by the broadcaster.</p>
 */
@Slf4j
public class WebSocketConnection implements RealtimeConnection {

    private final WebSocketSession session;
    private final Long userId;
    private final UserRole role;

    public WebSocketConnection(WebSocketSession session, Long userId, UserRole role,
                               int sendTimeLimitMs, int bufferSizeLimitBytes) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimitBytes,
                ConcurrentWebSocketSessionDecorator.OverflowStrategy.TERMINATE);
        this.userId = userId;
        this.role = role;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public Long userId() {
        return userId;
    }

    @Override
    public UserRole role() {
        return role;
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String payload) throws IOException {
        session.sendMessage(new TextMessage(payload));
    }

    @Override
    public void ping() throws IOException {
        session.sendMessage(new PingMessage(ByteBuffer.allocate(0)));
    }

    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException e) {
            log.debug("Close failed: sessionId={}, cause={}", id(), e.toString());
        }
    }

    @Override
    public String toString() {
        return "WebSocketConnection[" + id() + ", userId=" + userId + ", role=" + role + "]";
    }
}
