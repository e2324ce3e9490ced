package com.example.syncroom.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The single authoritative timeline of a room.
 *
 * <p>{@code position} and {@code lastMutationEpochMs} form one anchor: while playing, the
 * current position is {@code position + (now - lastMutationEpochMs)}. The anchor moves only on a
 * semantic change (play/pause toggled, a seek, a new item). Not thread-safe; every access goes
 * through the owning room's lock.
 */
public class RoomAuthority {
    private static final double RATE = 1.0;

    private final String roomId;

    private boolean playing;
    private double position;
    private long lastMutationEpochMs;
    private RoomItem currentItem;
    private final List<RoomItem> queue = new ArrayList<>();
    private int playingIndex = -1;
    private final Map<String, Role> roles = new LinkedHashMap<>();
    private boolean permanent;

    public RoomAuthority(String roomId, long nowEpochMs) {
        this.roomId = roomId;
        this.lastMutationEpochMs = nowEpochMs;
    }

    public String getRoomId() { return roomId; }
    public boolean isPlaying() { return playing; }
    public double getPosition() { return position; }
    public long getLastMutationEpochMs() { return lastMutationEpochMs; }
    public RoomItem getCurrentItem() { return currentItem; }
    public int getPlayingIndex() { return playingIndex; }
    public boolean isPermanent() { return permanent; }

    public List<RoomItem> getQueue() {
        return Collections.unmodifiableList(queue);
    }

    public Map<String, Role> getRoles() {
        return Collections.unmodifiableMap(roles);
    }

    /** Position projected to {@code nowEpochMs}. Live items are never extrapolated. */
    public double extrapolatedPosition(long nowEpochMs) {
        if (!playing || currentItem == null || currentItem.isLive()) return position;
        long elapsedMs = Math.max(0L, nowEpochMs - lastMutationEpochMs);
        return position + (elapsedMs / 1000.0) * RATE;
    }

    // ---------- timeline ----------

    /**
     * @return true if the anchor moved (a semantic change)
     */
    public boolean play(double atPosition, long nowEpochMs, double toleranceSeconds) {
        double target = clamp(atPosition);
        if (playing && Math.abs(target - extrapolatedPosition(nowEpochMs)) <= toleranceSeconds) {
            return false;
        }
        anchor(target, true, nowEpochMs);
        return true;
    }

    public boolean pause(double atPosition, long nowEpochMs, double toleranceSeconds) {
        double target = clamp(atPosition);
        if (!playing && Math.abs(target - position) <= toleranceSeconds) {
            return false;
        }
        anchor(target, false, nowEpochMs);
        return true;
    }

    /** A seek is always a semantic change, even to the current position. */
    public boolean seek(double toPosition, long nowEpochMs) {
        anchor(clamp(toPosition), playing, nowEpochMs);
        return true;
    }

    public RoomItem setItem(RoomItem item, long nowEpochMs) {
        RoomItem stored = item.copy();
        queue.add(0, stored);
        startItem(0, nowEpochMs);
        return stored;
    }

    /**
     * Drops the finished item unless pinned, then starts the next one. Pinned items advance
     * cyclically. With an empty queue the room ends up with no item, paused.
     */
    public RoomItem advance(long nowEpochMs) {
        int finished = playingIndex;
        boolean wasPinned = false;
        if (finished >= 0 && finished < queue.size()) {
            wasPinned = queue.get(finished).isPinned();
            if (!wasPinned) queue.remove(finished);
        }

        int next;
        if (wasPinned) {
            next = finished + 1 < queue.size() ? finished + 1 : 0;
        } else {
            next = (queue.isEmpty() || finished < 0) ? -1 : Math.min(finished, queue.size() - 1);
        }

        if (next >= 0) {
            startItem(next, nowEpochMs);
            return currentItem;
        }
        clearItem(nowEpochMs);
        return null;
    }

    /**
     * Starts a queued item. The previously playing item leaves the queue unless pinned.
     *
     * @return the started item, or null when the index is out of range
     */
    public RoomItem playIndex(int index, long nowEpochMs) {
        int target = index;
        int old = playingIndex;
        if (target < 0 || target >= queue.size()) return null;
        if (old >= 0 && old < queue.size() && old != target && !queue.get(old).isPinned()) {
            queue.remove(old);
            if (target > old) target -= 1;
        }
        startItem(target, nowEpochMs);
        return currentItem;
    }

    private void startItem(int index, long nowEpochMs) {
        playingIndex = index;
        currentItem = queue.get(index);
        anchor(0, true, nowEpochMs);
    }

    private void clearItem(long nowEpochMs) {
        playingIndex = -1;
        currentItem = null;
        anchor(0, false, nowEpochMs);
    }

    private void anchor(double newPosition, boolean nowPlaying, long nowEpochMs) {
        this.position = newPosition;
        this.playing = nowPlaying;
        this.lastMutationEpochMs = nowEpochMs;
    }

    // ---------- queue ----------

    public void addToQueue(RoomItem item) {
        queue.add(item.copy());
    }

    /** The playing item cannot be removed. */
    public boolean removeFromQueue(int index) {
        if (index < 0 || index >= queue.size() || index == playingIndex) return false;
        queue.remove(index);
        if (playingIndex > index) playingIndex -= 1;
        return true;
    }

    public boolean reorderQueue(int oldIndex, int newIndex) {
        if (oldIndex < 0 || oldIndex >= queue.size() || newIndex < 0 || newIndex >= queue.size()) return false;
        RoomItem moved = queue.remove(oldIndex);
        queue.add(newIndex, moved);

        if (playingIndex == oldIndex) {
            playingIndex = newIndex;
        } else if (oldIndex < playingIndex && playingIndex <= newIndex) {
            playingIndex -= 1;
        } else if (newIndex <= playingIndex && playingIndex < oldIndex) {
            playingIndex += 1;
        }
        return true;
    }

    public boolean togglePin(int index) {
        if (index < 0 || index >= queue.size()) return false;
        RoomItem item = queue.get(index);
        item.setPinned(!item.isPinned());
        return true;
    }

    // ---------- roles ----------

    /**
     * First identity in a room without roles becomes admin, later unknown identities become users.
     */
    public Role assignRole(String identity) {
        Role existing = roles.get(identity);
        if (existing != null) return existing;
        Role granted = roles.isEmpty() ? Role.ADMIN : Role.USER;
        roles.put(identity, granted);
        return granted;
    }

    public Role roleOf(String identity) {
        return roles.get(identity);
    }

    public void setRole(String identity, Role role) {
        roles.put(identity, role);
    }

    public boolean togglePermanent() {
        permanent = !permanent;
        return permanent;
    }

    /** Used when rebuilding a room from persisted state. */
    public void restore(boolean playing, double position, RoomItem currentItem, List<RoomItem> queue,
                        int playingIndex, Map<String, Role> roles, boolean permanent, long anchorEpochMs) {
        this.playing = playing;
        this.position = clamp(position);
        this.currentItem = null;
        this.queue.clear();
        if (queue != null) {
            for (RoomItem it : queue) this.queue.add(it.copy());
        }
        this.playingIndex = (playingIndex >= 0 && playingIndex < this.queue.size()) ? playingIndex : -1;
        if (this.playingIndex >= 0) {
            this.currentItem = this.queue.get(this.playingIndex);
        } else if (currentItem != null) {
            this.currentItem = currentItem.copy();
        }
        this.roles.clear();
        if (roles != null) this.roles.putAll(roles);
        this.permanent = permanent;
        this.lastMutationEpochMs = anchorEpochMs;
    }

    private static double clamp(double p) {
        if (Double.isNaN(p) || p < 0) return 0;
        return p;
    }
}
