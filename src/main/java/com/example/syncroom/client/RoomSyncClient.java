package com.example.syncroom.client;

import com.example.syncroom.model.RoomItem;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Room connection as seen from a viewer. Keeps the latency estimate fed with pings, reconnects
 * with capped backoff after an unexpected close, and asks for a fresh {@code sync} after every
 * reconnect instead of trusting local state.
 *
 * <p>Connection state is confined to the single-threaded {@code dispatcher}; socket callbacks are
 * handed over to it.
 */
public class RoomSyncClient {
    private static final Logger log = LoggerFactory.getLogger(RoomSyncClient.class);

    public static final long DEFAULT_PING_INTERVAL_MS = 5000;

    private static final int SEND_TIME_LIMIT_MS = 5000;
    private static final int BUFFER_SIZE_LIMIT = 256 * 1024;

    private final ObjectMapper mapper = new ObjectMapper();
    private final WebSocketClient webSocketClient;
    private final URI endpoint;
    private final WebSocketHttpHeaders headers;
    private final ScheduledExecutorService dispatcher;
    private final LatencyEstimator latency;
    private final ReconnectBackoff backoff;
    private final RoomEventListener listener;
    private final long pingIntervalMs;

    // dispatcher thread only
    private WebSocketSession session;
    private boolean everConnected;
    private boolean closedByUser;
    private ScheduledFuture<?> pingTask;
    private ScheduledFuture<?> reconnectTask;

    public RoomSyncClient(WebSocketClient webSocketClient,
                          URI endpoint,
                          WebSocketHttpHeaders headers,
                          ScheduledExecutorService dispatcher,
                          LatencyEstimator latency,
                          ReconnectPolicy policy,
                          RoomEventListener listener,
                          long pingIntervalMs) {
        this.webSocketClient = webSocketClient;
        this.endpoint = endpoint;
        this.headers = headers == null ? new WebSocketHttpHeaders() : headers;
        this.dispatcher = dispatcher;
        this.latency = latency;
        this.backoff = new ReconnectBackoff(policy);
        this.listener = listener;
        this.pingIntervalMs = pingIntervalMs;
    }

    public void connect() {
        dispatcher.execute(() -> {
            closedByUser = false;
            openSocket();
        });
    }

    public void close() {
        dispatcher.execute(() -> {
            closedByUser = true;
            cancel(reconnectTask);
            cancel(pingTask);
            if (session != null && session.isOpen()) {
                try {
                    session.close(CloseStatus.NORMAL);
                } catch (IOException e) {
                    log.debug("close failed: {}", e.toString());
                }
            }
            session = null;
        });
    }

    /** Queues an outbound {@code {type, payload}} message. Dropped while disconnected. */
    public void send(String type, Map<String, Object> payload) {
        dispatcher.execute(() -> sendNow(type, payload));
    }

    public int getReconnectAttempts() {
        return backoff.getAttempts();
    }

    // ---------- socket lifecycle, dispatcher thread ----------

    private void openSocket() {
        log.info("connecting. endpoint={} attempt={}", endpoint, backoff.getAttempts());
        webSocketClient.doHandshake(new Handler(), headers, endpoint).addCallback(
                s -> log.debug("handshake done. sessionId={}", s.getId()),
                err -> dispatcher.execute(() -> {
                    log.warn("connect failed. endpoint={} cause={}", endpoint, String.valueOf(err));
                    scheduleReconnect();
                }));
    }

    private void onOpen(WebSocketSession raw) {
        if (closedByUser) {
            try {
                raw.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                log.debug("close failed: {}", e.toString());
            }
            return;
        }
        session = new ConcurrentWebSocketSessionDecorator(raw, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        backoff.reset();
        boolean reconnect = everConnected;
        everConnected = true;
        log.info("connected. sessionId={} reconnect={}", raw.getId(), reconnect);

        if (reconnect) sendNow("sync_request", Collections.<String, Object>emptyMap());
        sendPing();
        cancel(pingTask);
        pingTask = dispatcher.scheduleAtFixedRate(this::sendPing, pingIntervalMs, pingIntervalMs, TimeUnit.MILLISECONDS);
    }

    private void onClosed(CloseStatus status) {
        cancel(pingTask);
        session = null;
        if (closedByUser) {
            log.info("closed. status={}", status);
            return;
        }
        log.warn("connection dropped. status={}", status);
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (closedByUser) return;
        if (reconnectTask != null && !reconnectTask.isDone()) return;
        long delay = backoff.nextDelayMs();
        if (delay < 0) {
            int attempts = backoff.getAttempts();
            log.warn("giving up reconnecting. attempts={}", attempts);
            listener.onConnectionLost(attempts);
            return;
        }
        log.info("reconnecting in {}ms. attempt={}", delay, backoff.getAttempts());
        reconnectTask = dispatcher.schedule(this::openSocket, delay, TimeUnit.MILLISECONDS);
    }

    private void sendPing() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("clientSendTime", latency.probeTime());
        sendNow("ping", payload);
    }

    private void sendNow(String type, Map<String, Object> payload) {
        WebSocketSession s = session;
        if (s == null || !s.isOpen()) {
            log.debug("not connected, dropping outbound message. type={}", type);
            return;
        }
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("type", type);
        envelope.put("payload", payload);
        try {
            s.sendMessage(new TextMessage(mapper.writeValueAsString(envelope)));
        } catch (IOException e) {
            log.warn("send failed. type={} cause={}", type, e.toString());
        }
    }

    private static void cancel(ScheduledFuture<?> f) {
        if (f != null) f.cancel(false);
    }

    // ---------- inbound ----------

    /**
     * Decodes one server message and routes it to the listener. Malformed input is logged and
     * dropped.
     */
    public void handleMessage(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("malformed server message dropped: {}", e.getOriginalMessage());
            return;
        }
        String type = root.path("type").asText("");
        JsonNode p = root.path("payload");
        try {
            switch (type) {
                case "sync":
                    listener.onSync(mapper.treeToValue(p, SyncPayload.class));
                    break;
                case "play":
                case "pause":
                case "seek":
                    listener.onCommand(type, p.path("timestamp").asDouble(0),
                            p.path("isPlaying").asBoolean("play".equals(type)),
                            p.path("isLive").asBoolean(false));
                    break;
                case "heartbeat":
                    listener.onHeartbeat(p.path("timestamp").asDouble(0), p.path("isPlaying").asBoolean(false));
                    break;
                case "set_item": {
                    JsonNode item = p.path("item");
                    RoomItem current = item.isObject() ? mapper.treeToValue(item, RoomItem.class) : null;
                    listener.onSetItem(current, p.path("timestamp").asDouble(0), p.path("isPlaying").asBoolean(false));
                    break;
                }
                case "pong":
                    if (p.path("clientSendTime").isNumber()) {
                        double ms = latency.onPong(p.path("clientSendTime").asLong());
                        log.debug("latency estimate {}ms", ms);
                    }
                    break;
                default:
                    listener.onMessage(type, p);
            }
        } catch (JsonProcessingException e) {
            log.warn("unreadable {} message dropped: {}", type, e.getOriginalMessage());
        }
    }

    private class Handler extends TextWebSocketHandler {

        @Override
        public void afterConnectionEstablished(WebSocketSession s) {
            dispatcher.execute(() -> onOpen(s));
        }

        @Override
        protected void handleTextMessage(WebSocketSession s, TextMessage message) {
            String json = message.getPayload();
            dispatcher.execute(() -> RoomSyncClient.this.handleMessage(json));
        }

        @Override
        public void handleTransportError(WebSocketSession s, Throwable exception) {
            log.warn("transport error. sessionId={} cause={}", s.getId(), exception.toString());
        }

        @Override
        public void afterConnectionClosed(WebSocketSession s, CloseStatus status) {
            dispatcher.execute(() -> onClosed(status));
        }
    }
}
