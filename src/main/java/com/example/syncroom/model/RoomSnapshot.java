package com.example.syncroom.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable copy of a room taken under its lock. {@code position} is already extrapolated to
 * {@code takenAtEpochMs}.
 */
public class RoomSnapshot {
    private final String roomId;
    private final boolean playing;
    private final double position;
    private final long lastMutationEpochMs;
    private final RoomItem currentItem;
    private final List<RoomItem> queue;
    private final int playingIndex;
    private final Map<String, Role> roles;
    private final List<Member> members;
    private final boolean permanent;
    private final long takenAtEpochMs;

    public RoomSnapshot(String roomId, boolean playing, double position, long lastMutationEpochMs,
                        RoomItem currentItem, List<RoomItem> queue, int playingIndex,
                        Map<String, Role> roles, List<Member> members, boolean permanent, long takenAtEpochMs) {
        this.roomId = roomId;
        this.playing = playing;
        this.position = position;
        this.lastMutationEpochMs = lastMutationEpochMs;
        this.currentItem = currentItem;
        this.queue = queue;
        this.playingIndex = playingIndex;
        this.roles = roles;
        this.members = members;
        this.permanent = permanent;
        this.takenAtEpochMs = takenAtEpochMs;
    }

    /** Caller must hold at least the room's read lock. */
    public static RoomSnapshot of(RoomAuthority a, List<Member> members, long nowEpochMs) {
        List<RoomItem> queueCopy = new ArrayList<>();
        for (RoomItem it : a.getQueue()) queueCopy.add(it.copy());
        RoomItem current = a.getCurrentItem() == null ? null : a.getCurrentItem().copy();
        return new RoomSnapshot(
                a.getRoomId(),
                a.isPlaying(),
                a.extrapolatedPosition(nowEpochMs),
                a.getLastMutationEpochMs(),
                current,
                Collections.unmodifiableList(queueCopy),
                a.getPlayingIndex(),
                Collections.unmodifiableMap(new LinkedHashMap<>(a.getRoles())),
                members == null ? Collections.<Member>emptyList() : Collections.unmodifiableList(new ArrayList<>(members)),
                a.isPermanent(),
                nowEpochMs
        );
    }

    public String getRoomId() { return roomId; }
    public boolean isPlaying() { return playing; }
    public double getPosition() { return position; }
    public long getLastMutationEpochMs() { return lastMutationEpochMs; }
    public RoomItem getCurrentItem() { return currentItem; }
    public List<RoomItem> getQueue() { return queue; }
    public int getPlayingIndex() { return playingIndex; }
    public Map<String, Role> getRoles() { return roles; }
    public List<Member> getMembers() { return members; }
    public boolean isPermanent() { return permanent; }
    public long getTakenAtEpochMs() { return takenAtEpochMs; }
}
