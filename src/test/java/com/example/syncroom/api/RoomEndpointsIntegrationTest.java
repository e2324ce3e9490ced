package com.example.syncroom.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.junit4.SpringRunner;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

@RunWith(SpringRunner.class)
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
public class RoomEndpointsIntegrationTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<WebSocketSession> sessions = new ArrayList<>();

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate rest;

    @After
    public void closeSessions() throws Exception {
        for (WebSocketSession s : sessions) {
            if (s.isOpen()) s.close();
        }
    }

    private BlockingQueue<JsonNode> join(String roomId, String user, List<WebSocketSession> out) throws Exception {
        BlockingQueue<JsonNode> inbox = new LinkedBlockingQueue<>();
        TextWebSocketHandler handler = new TextWebSocketHandler() {
            @Override
            protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
                inbox.add(mapper.readTree(message.getPayload()));
            }
        };
        String uri = "ws://localhost:" + port + "/ws/room?roomId=" + roomId + "&user=" + user;
        WebSocketSession s = new StandardWebSocketClient().doHandshake(handler, uri).get(5, TimeUnit.SECONDS);
        sessions.add(s);
        out.add(s);
        return inbox;
    }

    private static JsonNode await(BlockingQueue<JsonNode> inbox, String type) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            JsonNode m = inbox.poll(100, TimeUnit.MILLISECONDS);
            if (m != null && type.equals(m.path("type").asText())) return m;
        }
        fail("no " + type + " message within 5s");
        return null;
    }

    @Test
    public void joinReceivesSyncAndRoomIsListed() throws Exception {
        List<WebSocketSession> mine = new ArrayList<>();
        BlockingQueue<JsonNode> inbox = join("it-list", "alice", mine);

        JsonNode sync = await(inbox, "sync");
        assertEquals("alice", sync.path("payload").path("you").asText());
        assertEquals("admin", sync.path("payload").path("yourRole").asText());

        JsonNode rooms = mapper.readTree(rest.getForObject("/api/rooms", String.class));
        boolean listed = false;
        for (JsonNode r : rooms) {
            if ("it-list".equals(r.path("id").asText())) {
                listed = true;
                assertEquals(1, r.path("activeUsers").asInt());
            }
        }
        assertTrue(listed);
    }

    @Test
    public void playIsRelayedToOtherMembers() throws Exception {
        List<WebSocketSession> mine = new ArrayList<>();
        BlockingQueue<JsonNode> alice = join("it-play", "alice", mine);
        await(alice, "sync");
        BlockingQueue<JsonNode> bob = join("it-play", "bob", mine);
        await(bob, "sync");

        mine.get(0).sendMessage(new TextMessage(
                "{\"type\":\"set_item\",\"payload\":{\"item\":{\"id\":\"v1\",\"originalUrl\":\"https://v.test/1\"}}}"));
        await(bob, "set_item");
        mine.get(0).sendMessage(new TextMessage("{\"type\":\"play\",\"payload\":{\"timestamp\":5}}"));

        JsonNode play = await(bob, "play");
        assertTrue(play.path("payload").path("isPlaying").asBoolean());
        assertEquals(5.0, play.path("payload").path("timestamp").asDouble(), 0.5);

        JsonNode snapshot = mapper.readTree(rest.getForObject("/api/rooms/it-play", String.class));
        assertTrue(snapshot.path("playing").asBoolean());
        assertEquals("v1", snapshot.path("currentItem").path("id").asText());
    }

    @Test
    public void pingIsAnsweredWithPong() throws Exception {
        List<WebSocketSession> mine = new ArrayList<>();
        BlockingQueue<JsonNode> inbox = join("it-ping", "carol", mine);
        await(inbox, "sync");

        mine.get(0).sendMessage(new TextMessage("{\"type\":\"ping\",\"payload\":{\"clientSendTime\":1234}}"));

        JsonNode pong = await(inbox, "pong");
        assertEquals(1234L, pong.path("payload").path("clientSendTime").asLong());
        assertTrue(pong.path("payload").path("serverTime").asLong() > 0);
    }

    @Test
    public void unknownRoomIs404() {
        ResponseEntity<String> r = rest.getForEntity("/api/rooms/does-not-exist", String.class);

        assertEquals(HttpStatus.NOT_FOUND, r.getStatusCode());
        assertTrue(r.getBody().contains("not_found"));
    }
}
