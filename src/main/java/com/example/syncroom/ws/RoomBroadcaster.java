package com.example.syncroom.ws;

import com.example.syncroom.store.Room;
import com.example.syncroom.store.RoomConnection;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fans messages out to the connections of a room. A failed send never aborts the fan-out:
 * the dead connection is dropped and the remaining members get a fresh member list.
 */
@Component
public class RoomBroadcaster {
    private static final Logger log = LoggerFactory.getLogger(RoomBroadcaster.class);

    private final ObjectMapper om = new ObjectMapper();
    private final Clock clock;

    public RoomBroadcaster(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param exclude connection that should not receive the message, may be null
     * @return number of connections the message reached
     */
    public int broadcast(Room room, Map<String, Object> message, RoomConnection exclude) {
        String json;
        try {
            json = om.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("unserializable message: " + message.get("type"), e);
        }

        int delivered = 0;
        List<RoomConnection> dead = new ArrayList<>();
        for (RoomConnection c : room.connections()) {
            if (c == exclude) continue;
            if (trySend(c, json)) {
                delivered++;
            } else {
                dead.add(c);
            }
        }

        if (!dead.isEmpty()) {
            dropDead(room, dead);
        }
        return delivered;
    }

    /** Sends to one connection; a failure drops it from the room like a broadcast failure. */
    public boolean sendTo(Room room, RoomConnection target, Map<String, Object> message) {
        String json;
        try {
            json = om.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("unserializable message: " + message.get("type"), e);
        }
        if (trySend(target, json)) return true;
        List<RoomConnection> dead = new ArrayList<>();
        dead.add(target);
        dropDead(room, dead);
        return false;
    }

    private boolean trySend(RoomConnection c, String json) {
        if (!c.isOpen()) return false;
        try {
            c.send(json);
            return true;
        } catch (Exception e) {
            log.warn("send failed, dropping connection. connectionId={} identity={} cause={}",
                    c.getId(), c.getIdentity(), e.toString());
            return false;
        }
    }

    private void dropDead(Room room, List<RoomConnection> dead) {
        long now = clock.millis();
        boolean changed = false;
        for (RoomConnection c : dead) {
            if (room.removeConnection(c, now)) changed = true;
            c.close();
        }
        if (changed && room.connectionCount() > 0) {
            // the notice itself may hit more dead connections; recursion ends once none are left
            broadcast(room, SyncMessages.userLeft(room.members()), null);
        }
    }
}
