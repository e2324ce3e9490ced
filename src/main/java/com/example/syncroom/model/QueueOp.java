package com.example.syncroom.model;

/** Queue edits. These never move the timeline anchor. */
public final class QueueOp {

    public enum Kind { ADD, REMOVE, REORDER, PIN }

    private final Kind kind;
    private final RoomItem item;
    private final int index;
    private final int newIndex;

    private QueueOp(Kind kind, RoomItem item, int index, int newIndex) {
        this.kind = kind;
        this.item = item;
        this.index = index;
        this.newIndex = newIndex;
    }

    public static QueueOp add(RoomItem item) {
        if (item == null) throw new IllegalArgumentException("item is required");
        return new QueueOp(Kind.ADD, item, -1, -1);
    }

    public static QueueOp remove(int index) {
        return new QueueOp(Kind.REMOVE, null, index, -1);
    }

    public static QueueOp reorder(int oldIndex, int newIndex) {
        return new QueueOp(Kind.REORDER, null, oldIndex, newIndex);
    }

    public static QueueOp pin(int index) {
        return new QueueOp(Kind.PIN, null, index, -1);
    }

    public Kind getKind() { return kind; }
    public RoomItem getItem() { return item; }
    public int getIndex() { return index; }
    public int getNewIndex() { return newIndex; }
}
