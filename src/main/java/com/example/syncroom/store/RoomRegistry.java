package com.example.syncroom.store;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;

/**
 * In-memory map of live rooms. Creation, join bookkeeping and eviction for one room id are
 * serialized through the map's per-key atomic compute.
 */
public class RoomRegistry {
    private final ConcurrentMap<String, Room> rooms = new ConcurrentHashMap<>();

    public Room get(String roomId) {
        return rooms.get(roomId);
    }

    public boolean exists(String roomId) {
        return rooms.containsKey(roomId);
    }

    /**
     * Atomically get-or-create. {@code onRoom} runs inside the per-key critical section with
     * {@code created == true} for exactly one caller per room id.
     */
    public Room compute(String roomId, RoomFactory factory, RoomCallback onRoom) {
        return rooms.compute(roomId, (id, existing) -> {
            Room room = existing;
            boolean created = false;
            if (room == null) {
                room = factory.create(id);
                created = true;
            }
            onRoom.accept(room, created);
            return room;
        });
    }

    /** Installs an already built room (startup restore). Existing rooms win. */
    public Room putIfAbsent(Room room) {
        Room prior = rooms.putIfAbsent(room.getRoomId(), room);
        return prior == null ? room : prior;
    }

    /**
     * Removes the room if {@code shouldEvict} still holds inside the per-key critical section.
     *
     * @return the evicted room, or null
     */
    public Room evictIf(String roomId, Predicate<Room> shouldEvict) {
        final Room[] evicted = new Room[1];
        rooms.computeIfPresent(roomId, (id, room) -> {
            if (shouldEvict.test(room)) {
                evicted[0] = room;
                return null;
            }
            return room;
        });
        return evicted[0];
    }

    public List<Room> all() {
        return new ArrayList<>(rooms.values());
    }

    public int size() {
        return rooms.size();
    }

    public interface RoomFactory {
        Room create(String roomId);
    }

    public interface RoomCallback {
        void accept(Room room, boolean created);
    }
}
