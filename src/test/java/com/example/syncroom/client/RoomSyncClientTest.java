package com.example.syncroom.client;

import com.example.syncroom.model.RoomItem;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.util.concurrent.ListenableFuture;
import org.springframework.util.concurrent.SettableListenableFuture;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketExtension;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.security.Principal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

public class RoomSyncClientTest {

    private ScheduledExecutorService dispatcher;
    private RecordingListener listener;
    private FailingWebSocketClient webSocketClient;

    @Before
    public void setUp() {
        dispatcher = Executors.newSingleThreadScheduledExecutor();
        listener = new RecordingListener();
        webSocketClient = new FailingWebSocketClient();
    }

    @After
    public void tearDown() {
        dispatcher.shutdownNow();
    }

    private RoomSyncClient client(LatencyEstimator latency, ReconnectPolicy policy) {
        return new RoomSyncClient(webSocketClient, URI.create("ws://localhost:1/ws/room?roomId=r"), null,
                dispatcher, latency, policy, listener, RoomSyncClient.DEFAULT_PING_INTERVAL_MS);
    }

    @Test
    public void syncIsDecodedWithItemAndRole() {
        RoomSyncClient c = client(new LatencyEstimator(() -> 0L), ReconnectPolicy.defaults());

        c.handleMessage("{\"type\":\"sync\",\"payload\":{\"roomId\":\"r\",\"timestamp\":12.5,\"isPlaying\":true,"
                + "\"currentItem\":{\"id\":\"i1\",\"originalUrl\":\"https://v.test/1\",\"isLive\":true},"
                + "\"queue\":[],\"playingIndex\":-1,\"you\":\"bob\",\"yourRole\":\"user\",\"serverTime\":5}}");

        assertEquals(1, listener.syncs.size());
        SyncPayload s = listener.syncs.get(0);
        assertEquals(12.5, s.getTimestamp(), 1e-9);
        assertTrue(s.isPlaying());
        assertEquals("i1", s.getCurrentItem().getId());
        assertTrue(s.getCurrentItem().isLive());
        assertEquals("user", s.getYourRole());
    }

    @Test
    public void commandsHeartbeatsAndItemsAreRouted() {
        RoomSyncClient c = client(new LatencyEstimator(() -> 0L), ReconnectPolicy.defaults());

        c.handleMessage("{\"type\":\"pause\",\"payload\":{\"timestamp\":3.0,\"isPlaying\":false}}");
        c.handleMessage("{\"type\":\"heartbeat\",\"payload\":{\"timestamp\":7.25,\"isPlaying\":true}}");
        c.handleMessage("{\"type\":\"set_item\",\"payload\":{\"item\":null,\"timestamp\":0,\"isPlaying\":false}}");
        c.handleMessage("{\"type\":\"queue_update\",\"payload\":{\"queue\":[]}}");

        assertEquals(List.of("pause@3.0"), listener.commands);
        assertEquals(List.of(7.25), listener.heartbeats);
        assertEquals(1, listener.itemChanges);
        assertNull(listener.lastItem);
        assertEquals(List.of("queue_update"), listener.others);
    }

    @Test
    public void pongFeedsLatency() {
        AtomicInteger now = new AtomicInteger(1_000);
        LatencyEstimator latency = new LatencyEstimator(now::get);
        RoomSyncClient c = client(latency, ReconnectPolicy.defaults());
        now.set(1_400);

        c.handleMessage("{\"type\":\"pong\",\"payload\":{\"clientSendTime\":1000,\"serverTime\":123}}");

        assertEquals(200.0, latency.getLatencyMs(), 1e-9);
    }

    @Test
    public void malformedInputIsDropped() {
        RoomSyncClient c = client(new LatencyEstimator(() -> 0L), ReconnectPolicy.defaults());

        c.handleMessage("not json");
        c.handleMessage("{\"type\":\"sync\",\"payload\":{\"timestamp\":\"soon\"}}");

        assertTrue(listener.syncs.isEmpty());
    }

    @Test
    public void givesUpAfterPolicyAttempts() throws Exception {
        RoomSyncClient c = client(new LatencyEstimator(() -> 0L), new ReconnectPolicy(1, 4, 2.0, 3));

        c.connect();

        assertTrue(listener.lost.await(5, TimeUnit.SECONDS));
        assertEquals(3, listener.lostAttempts);
        assertEquals("first try plus three retries", 4, webSocketClient.handshakes.get());
    }

    @Test
    public void socketMessagesReachListenerOnDispatcher() throws Exception {
        ConnectingWebSocketClient connecting = new ConnectingWebSocketClient();
        RoomSyncClient c = new RoomSyncClient(connecting, URI.create("ws://localhost:1/ws/room?roomId=r"), null,
                dispatcher, new LatencyEstimator(() -> 0L), ReconnectPolicy.defaults(), listener,
                RoomSyncClient.DEFAULT_PING_INTERVAL_MS);
        c.connect();
        assertTrue(connecting.handshakeSeen.await(5, TimeUnit.SECONDS));

        connecting.handler.afterConnectionEstablished(connecting.session);
        connecting.handler.handleMessage(connecting.session,
                new TextMessage("{\"type\":\"heartbeat\",\"payload\":{\"timestamp\":9.5,\"isPlaying\":true}}"));

        assertTrue(listener.heartbeat.await(5, TimeUnit.SECONDS));
        assertEquals(List.of(9.5), listener.heartbeats);
        assertTrue("ping after open", connecting.session.sent.get(0).contains("\"ping\""));
    }

    private static final class ConnectingWebSocketClient implements WebSocketClient {
        final StubSession session = new StubSession();
        final CountDownLatch handshakeSeen = new CountDownLatch(1);
        volatile WebSocketHandler handler;

        @Override
        public ListenableFuture<WebSocketSession> doHandshake(WebSocketHandler handler, String uriTemplate, Object... uriVars) {
            return doHandshake(handler, null, URI.create(uriTemplate));
        }

        @Override
        public ListenableFuture<WebSocketSession> doHandshake(WebSocketHandler handler, WebSocketHttpHeaders headers, URI uri) {
            this.handler = handler;
            SettableListenableFuture<WebSocketSession> f = new SettableListenableFuture<>();
            f.set(session);
            handshakeSeen.countDown();
            return f;
        }
    }

    private static final class StubSession implements WebSocketSession {
        final List<String> sent = new CopyOnWriteArrayList<>();
        volatile boolean open = true;

        @Override public String getId() { return "s1"; }
        @Override public URI getUri() { return URI.create("ws://localhost:1/ws/room?roomId=r"); }
        @Override public HttpHeaders getHandshakeHeaders() { return new HttpHeaders(); }
        @Override public Map<String, Object> getAttributes() { return new HashMap<>(); }
        @Override public Principal getPrincipal() { return null; }
        @Override public InetSocketAddress getLocalAddress() { return null; }
        @Override public InetSocketAddress getRemoteAddress() { return null; }
        @Override public String getAcceptedProtocol() { return null; }
        @Override public void setTextMessageSizeLimit(int messageSizeLimit) { }
        @Override public int getTextMessageSizeLimit() { return 64 * 1024; }
        @Override public void setBinaryMessageSizeLimit(int messageSizeLimit) { }
        @Override public int getBinaryMessageSizeLimit() { return 64 * 1024; }
        @Override public List<WebSocketExtension> getExtensions() { return new ArrayList<>(); }

        @Override
        public void sendMessage(WebSocketMessage<?> message) {
            sent.add(String.valueOf(message.getPayload()));
        }

        @Override public boolean isOpen() { return open; }
        @Override public void close() { open = false; }
        @Override public void close(CloseStatus status) { open = false; }
    }

    private static final class FailingWebSocketClient implements WebSocketClient {
        final AtomicInteger handshakes = new AtomicInteger();

        @Override
        public ListenableFuture<WebSocketSession> doHandshake(WebSocketHandler handler, String uriTemplate, Object... uriVars) {
            return doHandshake(handler, null, URI.create(uriTemplate));
        }

        @Override
        public ListenableFuture<WebSocketSession> doHandshake(WebSocketHandler handler, WebSocketHttpHeaders headers, URI uri) {
            handshakes.incrementAndGet();
            SettableListenableFuture<WebSocketSession> f = new SettableListenableFuture<>();
            f.setException(new IOException("connection refused"));
            return f;
        }
    }

    private static final class RecordingListener implements RoomEventListener {
        final List<SyncPayload> syncs = new ArrayList<>();
        final List<String> commands = new ArrayList<>();
        final List<Double> heartbeats = new ArrayList<>();
        final List<String> others = new ArrayList<>();
        final CountDownLatch lost = new CountDownLatch(1);
        final CountDownLatch heartbeat = new CountDownLatch(1);
        volatile int lostAttempts;
        int itemChanges;
        RoomItem lastItem;

        @Override
        public void onSync(SyncPayload sync) {
            syncs.add(sync);
        }

        @Override
        public void onCommand(String type, double timestamp, boolean playing, boolean live) {
            commands.add(type + "@" + timestamp);
        }

        @Override
        public void onHeartbeat(double timestamp, boolean playing) {
            heartbeats.add(timestamp);
            heartbeat.countDown();
        }

        @Override
        public void onSetItem(RoomItem item, double timestamp, boolean playing) {
            itemChanges++;
            lastItem = item;
        }

        @Override
        public void onMessage(String type, JsonNode payload) {
            others.add(type);
        }

        @Override
        public void onConnectionLost(int attempts) {
            lostAttempts = attempts;
            lost.countDown();
        }
    }
}
