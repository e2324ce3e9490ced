package com.example.syncroom.client;

import com.example.syncroom.model.RoomItem;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Callbacks of {@link RoomSyncClient}, all invoked on the client's dispatch thread.
 */
public interface RoomEventListener {

    void onSync(SyncPayload sync);

    /** play / pause / seek. */
    void onCommand(String type, double timestamp, boolean playing, boolean live);

    void onHeartbeat(double timestamp, boolean playing);

    /** The playing item changed (set, advanced or picked from the queue); item may be null. */
    void onSetItem(RoomItem item, double timestamp, boolean playing);

    /** Everything else: queue, members, roles, settings, errors. */
    default void onMessage(String type, JsonNode payload) {
    }

    /** Reconnect attempts are used up; the client stays closed. */
    default void onConnectionLost(int attempts) {
    }
}
