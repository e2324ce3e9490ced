package com.example.syncroom.model;

/**
 * A mutation of the room timeline. Every op is applied under the room's mutation lock and
 * produces exactly one broadcast.
 */
public final class PlaybackOp {

    public enum Kind {
        PLAY,
        PAUSE,
        SEEK,
        /** Prepend an item and start it from 0. */
        SET_ITEM,
        /** The playing item finished; move to the next one. */
        ADVANCE,
        /** Start a queued item by index. */
        PLAY_INDEX
    }

    private final Kind kind;
    private final double position;
    private final RoomItem item;
    private final int index;
    private final String finishedItemId;

    private PlaybackOp(Kind kind, double position, RoomItem item, int index, String finishedItemId) {
        this.kind = kind;
        this.position = position;
        this.item = item;
        this.index = index;
        this.finishedItemId = finishedItemId;
    }

    public static PlaybackOp play(double atPosition) {
        return new PlaybackOp(Kind.PLAY, atPosition, null, -1, null);
    }

    public static PlaybackOp pause(double atPosition) {
        return new PlaybackOp(Kind.PAUSE, atPosition, null, -1, null);
    }

    public static PlaybackOp seek(double toPosition) {
        return new PlaybackOp(Kind.SEEK, toPosition, null, -1, null);
    }

    public static PlaybackOp setItem(RoomItem item) {
        if (item == null) throw new IllegalArgumentException("item is required");
        return new PlaybackOp(Kind.SET_ITEM, 0, item, -1, null);
    }

    /**
     * @param finishedItemId id of the item the client saw finish; when several clients report the
     *                       same end only the first one advances. Null skips the check.
     */
    public static PlaybackOp advance(String finishedItemId) {
        return new PlaybackOp(Kind.ADVANCE, 0, null, -1, finishedItemId);
    }

    public static PlaybackOp playIndex(int index) {
        return new PlaybackOp(Kind.PLAY_INDEX, 0, null, index, null);
    }

    public Kind getKind() { return kind; }
    public double getPosition() { return position; }
    public RoomItem getItem() { return item; }
    public int getIndex() { return index; }
    public String getFinishedItemId() { return finishedItemId; }

    @Override
    public String toString() {
        return "PlaybackOp{" + kind + ", position=" + position + ", index=" + index + "}";
    }
}
