package com.example.syncroom.ws;

import com.example.syncroom.store.RoomConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * Adapts a servlet WebSocket session to a room connection. Sends go through a decorator so
 * broadcasts from the heartbeat timer and from request threads never interleave frames.
 */
public class WebSocketRoomConnection implements RoomConnection {
    private static final Logger log = LoggerFactory.getLogger(WebSocketRoomConnection.class);

    static final int SEND_TIME_LIMIT_MS = 10_000;
    static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final WebSocketSession session;
    private final String identity;

    public WebSocketRoomConnection(WebSocketSession session, String identity) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        this.identity = identity;
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public String getIdentity() {
        return identity;
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String json) throws IOException {
        session.sendMessage(new TextMessage(json));
    }

    @Override
    public void close() {
        try {
            if (session.isOpen()) session.close(CloseStatus.GOING_AWAY);
        } catch (IOException e) {
            log.debug("close failed. sessionId={} cause={}", session.getId(), e.toString());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WebSocketRoomConnection)) return false;
        return getId().equals(((WebSocketRoomConnection) o).getId());
    }

    @Override
    public int hashCode() {
        return getId().hashCode();
    }
}
