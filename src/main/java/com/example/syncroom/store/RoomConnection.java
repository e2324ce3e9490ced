package com.example.syncroom.store;

import java.io.IOException;

/**
 * One live client of a room: the unit of broadcast fan-out.
 */
public interface RoomConnection {

    String getId();

    String getIdentity();

    boolean isOpen();

    void send(String json) throws IOException;

    void close();
}
