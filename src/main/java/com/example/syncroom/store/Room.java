package com.example.syncroom.store;

import com.example.syncroom.model.Member;
import com.example.syncroom.model.RoomAuthority;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A live room: its authority, the lock guarding it, and the connected clients.
 */
public class Room {
    private final RoomAuthority authority;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Set<RoomConnection> connections = ConcurrentHashMap.newKeySet();

    // Outbound messages leave in revision order. A mutation takes sendLock before releasing the
    // write lock, so two mutations can never be broadcast out of order.
    private final ReentrantLock sendLock = new ReentrantLock(true);
    private long revision;         // guarded by lock
    private long lastSentRevision; // guarded by sendLock

    private volatile Long emptySinceEpochMs; // null while someone is connected
    private volatile ScheduledFuture<?> heartbeatTask;

    public Room(RoomAuthority authority) {
        this.authority = authority;
    }

    public String getRoomId() { return authority.getRoomId(); }

    /** Guarded by {@link #lock()}. */
    public RoomAuthority authority() { return authority; }

    public ReadWriteLock lock() { return lock; }

    public ReentrantLock sendLock() { return sendLock; }

    /** Caller holds the write lock. */
    public long bumpRevision() { return ++revision; }

    /** Caller holds the read or write lock. */
    public long getRevision() { return revision; }

    /** Caller holds sendLock. */
    public long getLastSentRevision() { return lastSentRevision; }

    /** Caller holds sendLock. */
    public void markSent(long rev) {
        if (rev > lastSentRevision) lastSentRevision = rev;
    }

    public void addConnection(RoomConnection c) {
        connections.add(c);
        emptySinceEpochMs = null;
    }

    /**
     * @return true if the connection was still registered
     */
    public boolean removeConnection(RoomConnection c, long nowEpochMs) {
        boolean removed = connections.remove(c);
        if (removed && connections.isEmpty()) {
            emptySinceEpochMs = nowEpochMs;
        }
        return removed;
    }

    public List<RoomConnection> connections() {
        return new ArrayList<>(connections);
    }

    public int connectionCount() {
        return connections.size();
    }

    /** Sorted distinct identities of the live connections. */
    public List<Member> members() {
        Set<String> ids = new TreeSet<>();
        for (RoomConnection c : connections) ids.add(c.getIdentity());
        List<Member> out = new ArrayList<>();
        for (String id : ids) out.add(new Member(id));
        return out;
    }

    public Long getEmptySinceEpochMs() { return emptySinceEpochMs; }

    public void markEmptySince(long nowEpochMs) {
        if (connections.isEmpty()) emptySinceEpochMs = nowEpochMs;
    }

    public ScheduledFuture<?> getHeartbeatTask() { return heartbeatTask; }
    public void setHeartbeatTask(ScheduledFuture<?> heartbeatTask) { this.heartbeatTask = heartbeatTask; }

    public void cancelHeartbeat() {
        ScheduledFuture<?> t = heartbeatTask;
        if (t != null) t.cancel(false);
        heartbeatTask = null;
    }
}
