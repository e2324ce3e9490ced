package com.example.syncroom.model;

public class RoomSummary {
    private final String id;
    private final int activeUsers;
    private final String currentItem; // title, nullable
    private final int queueSize;

    public RoomSummary(String id, int activeUsers, String currentItem, int queueSize) {
        this.id = id;
        this.activeUsers = activeUsers;
        this.currentItem = currentItem;
        this.queueSize = queueSize;
    }

    public String getId() { return id; }
    public int getActiveUsers() { return activeUsers; }
    public String getCurrentItem() { return currentItem; }
    public int getQueueSize() { return queueSize; }
}
