package com.example.syncroom.ws;

import com.example.syncroom.model.PlaybackOp;
import com.example.syncroom.model.QueueOp;
import com.example.syncroom.model.Role;
import com.example.syncroom.model.RoomItem;
import com.example.syncroom.service.RoomClockCoordinator;
import com.example.syncroom.store.Room;
import com.example.syncroom.store.RoomRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * {@code /ws/room?roomId=...&user=...}. One connection per session; every inbound message is a
 * {@code {type, payload}} envelope.
 */
@Component
public class RoomWebSocketHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(RoomWebSocketHandler.class);

    static final String IDENTITY_HEADER = "cf-access-authenticated-user-email";
    static final String GUEST = "Guest";

    private static final String ATTR_ROOM = "syncroom.roomId";
    private static final String ATTR_CONNECTION = "syncroom.connection";

    private final ObjectMapper mapper = new ObjectMapper();
    private final RoomClockCoordinator coordinator;
    private final RoomRegistry registry;
    private final RoomBroadcaster broadcaster;
    private final Clock clock;

    public RoomWebSocketHandler(RoomClockCoordinator coordinator,
                                RoomRegistry registry,
                                RoomBroadcaster broadcaster,
                                Clock clock) {
        this.coordinator = coordinator;
        this.registry = registry;
        this.broadcaster = broadcaster;
        this.clock = clock;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String roomId = extractQueryParam(session.getUri(), "roomId");
        if (roomId == null || roomId.isBlank()) {
            log.info("ROOM ws rejected, no roomId. sessionId={}", session.getId());
            session.close(CloseStatus.BAD_DATA);
            return;
        }

        WebSocketRoomConnection connection = new WebSocketRoomConnection(session, resolveIdentity(session));
        session.getAttributes().put(ATTR_ROOM, roomId);
        session.getAttributes().put(ATTR_CONNECTION, connection);
        coordinator.join(roomId, connection);
        log.info("ROOM ws connected. sessionId={} roomId={} identity={}", session.getId(), roomId, connection.getIdentity());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        String roomId = (String) session.getAttributes().get(ATTR_ROOM);
        WebSocketRoomConnection connection = (WebSocketRoomConnection) session.getAttributes().get(ATTR_CONNECTION);
        if (roomId == null || connection == null) {
            session.close(CloseStatus.BAD_DATA);
            return;
        }

        JsonNode root;
        try {
            root = mapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            log.warn("malformed message dropped. sessionId={} roomId={} cause={}", session.getId(), roomId, e.getOriginalMessage());
            return;
        }

        String type = root.path("type").asText("");
        JsonNode payload = root.path("payload");
        try {
            dispatch(roomId, connection, type, payload);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            log.warn("invalid message dropped. sessionId={} roomId={} type={} cause={}", session.getId(), roomId, type, e.getMessage());
            sendError(roomId, connection, "invalid " + type + " message");
        }
    }

    void dispatch(String roomId, WebSocketRoomConnection connection, String type, JsonNode payload)
            throws JsonProcessingException {
        switch (type) {
            case "play":
                coordinator.mutate(roomId, PlaybackOp.play(payload.path("timestamp").asDouble(0)), connection);
                break;
            case "pause":
                coordinator.mutate(roomId, PlaybackOp.pause(payload.path("timestamp").asDouble(0)), connection);
                break;
            case "seek":
                coordinator.mutate(roomId, PlaybackOp.seek(payload.path("timestamp").asDouble(0)), connection);
                break;
            case "set_item":
                coordinator.mutate(roomId, PlaybackOp.setItem(readItem(payload)), connection);
                break;
            case "item_ended":
                coordinator.mutate(roomId, PlaybackOp.advance(textOrNull(payload, "itemId")), connection);
                break;
            case "queue_play":
                coordinator.mutate(roomId, PlaybackOp.playIndex(payload.path("index").asInt(-1)), connection);
                break;
            case "queue_add":
                coordinator.applyQueueOp(roomId, QueueOp.add(readItem(payload)));
                break;
            case "queue_remove":
                coordinator.applyQueueOp(roomId, QueueOp.remove(payload.path("index").asInt(-1)));
                break;
            case "queue_reorder":
                coordinator.applyQueueOp(roomId, QueueOp.reorder(
                        payload.path("oldIndex").asInt(-1), payload.path("newIndex").asInt(-1)));
                break;
            case "queue_pin":
                coordinator.applyQueueOp(roomId, QueueOp.pin(payload.path("index").asInt(-1)));
                break;
            case "promote": {
                Role role = Role.fromWire(payload.path("role").asText(null));
                if (!coordinator.promote(roomId, connection.getIdentity(), textOrNull(payload, "target"), role)) {
                    sendError(roomId, connection, "promote refused");
                }
                break;
            }
            case "toggle_permanent":
                if (!coordinator.togglePermanent(roomId, connection.getIdentity())) {
                    sendError(roomId, connection, "toggle_permanent refused");
                }
                break;
            case "ping":
                sendDirect(roomId, connection, SyncMessages.pong(clientSendTime(payload), clock.millis()));
                break;
            case "sync_request":
                coordinator.resync(roomId, connection);
                break;
            default:
                log.debug("unknown message type ignored. roomId={} type={}", roomId, type);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String roomId = (String) session.getAttributes().get(ATTR_ROOM);
        WebSocketRoomConnection connection = (WebSocketRoomConnection) session.getAttributes().get(ATTR_CONNECTION);
        if (roomId != null && connection != null) {
            coordinator.leave(roomId, connection);
        }
        log.info("ROOM ws disconnected. sessionId={} roomId={} status={}", session.getId(), roomId, status);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("ROOM ws transport error. sessionId={} cause={}", session.getId(), exception.toString());
    }

    private RoomItem readItem(JsonNode payload) throws JsonProcessingException {
        JsonNode node = payload.path("item");
        if (!node.isObject()) throw new IllegalArgumentException("item is required");
        RoomItem item = mapper.treeToValue(node, RoomItem.class);
        if (item.getOriginalUrl() == null || item.getOriginalUrl().isBlank()) {
            throw new IllegalArgumentException("item.originalUrl is required");
        }
        return item;
    }

    // echoed back untouched; numbers stay numbers
    private Object clientSendTime(JsonNode payload) {
        JsonNode t = payload.path("clientSendTime");
        if (t.isNumber()) return t.numberValue();
        return t.isMissingNode() || t.isNull() ? null : t.asText();
    }

    private void sendError(String roomId, WebSocketRoomConnection connection, String text) {
        sendDirect(roomId, connection, SyncMessages.error(text));
    }

    private void sendDirect(String roomId, WebSocketRoomConnection connection, Map<String, Object> message) {
        Room room = registry.get(roomId);
        if (room != null) broadcaster.sendTo(room, connection, message);
    }

    private static String textOrNull(JsonNode payload, String field) {
        JsonNode n = payload.path(field);
        return n.isTextual() && !n.asText().isBlank() ? n.asText() : null;
    }

    static String resolveIdentity(WebSocketSession session) {
        String header = session.getHandshakeHeaders().getFirst(IDENTITY_HEADER);
        if (header != null && !header.isBlank()) return header.trim();
        String user = extractQueryParam(session.getUri(), "user");
        if (user != null && !user.isBlank()) return user.trim();
        return GUEST;
    }

    static String extractQueryParam(URI uri, String name) {
        if (uri == null) return null;
        String query = uri.getRawQuery();
        if (query == null) return null;
        Map<String, String> map = new HashMap<>();
        for (String part : query.split("&")) {
            int idx = part.indexOf('=');
            if (idx > 0) {
                map.put(part.substring(0, idx), URLDecoder.decode(part.substring(idx + 1), StandardCharsets.UTF_8));
            }
        }
        return map.get(name);
    }
}
