package com.example.syncroom.service;

import com.example.syncroom.model.RoomSnapshot;

import java.util.List;

/**
 * Durable copy of room state so rooms survive a restart. Failures are the store's problem:
 * implementations log and carry on, they never throw into the coordinator.
 */
public interface RoomStateStore {

    void save(RoomSnapshot snapshot);

    void delete(String roomId);

    /** Stored rooms; {@code takenAtEpochMs} is the save time. */
    List<RoomSnapshot> loadAll();
}
