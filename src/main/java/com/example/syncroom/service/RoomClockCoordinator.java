package com.example.syncroom.service;

import com.example.syncroom.config.SyncRoomProperties;
import com.example.syncroom.model.*;
import com.example.syncroom.store.Room;
import com.example.syncroom.store.RoomConnection;
import com.example.syncroom.store.RoomRegistry;
import com.example.syncroom.ws.RoomBroadcaster;
import com.example.syncroom.ws.SyncMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;

/**
 * Owns the authoritative timeline of every room.
 *
 * <p>Lock discipline per room: mutations run under the write lock and take the room's send lock
 * before releasing it, so broadcasts leave in mutation order. Reads that feed a response are
 * snapshots taken under the read lock. The heartbeat holds the read lock only for the snapshot
 * copy and drops itself if a newer mutation was already broadcast.
 */
@Service
public class RoomClockCoordinator {
    private static final Logger log = LoggerFactory.getLogger(RoomClockCoordinator.class);

    private static final int REJECTED = -1;
    private static final int APPLIED = 0;
    private static final int MOVED = 1;

    private final RoomRegistry registry;
    private final RoomBroadcaster broadcaster;
    private final RoomStateStore stateStore;
    private final SyncRoomProperties properties;
    private final Clock clock;
    private final TaskScheduler taskScheduler;

    public RoomClockCoordinator(RoomRegistry registry,
                                RoomBroadcaster broadcaster,
                                RoomStateStore stateStore,
                                SyncRoomProperties properties,
                                Clock clock,
                                @Qualifier("taskScheduler") TaskScheduler taskScheduler) {
        this.registry = registry;
        this.broadcaster = broadcaster;
        this.stateStore = stateStore;
        this.properties = properties;
        this.clock = clock;
        this.taskScheduler = taskScheduler;
    }

    // ---------- lifecycle ----------

    /**
     * Idempotent get-or-create. Exactly one caller per room id sees {@code created == true}, and
     * that caller's identity becomes the room's admin inside the same critical section.
     */
    public JoinResult ensureRoom(String roomId, String identity) {
        return attach(requireRoomId(roomId), identity, null);
    }

    /**
     * Registers a connection, sends it the full state and tells the room someone joined.
     */
    public JoinResult join(String roomId, RoomConnection connection) {
        if (connection == null) throw new IllegalArgumentException("connection is required");
        return attach(requireRoomId(roomId), connection.getIdentity(), connection);
    }

    private JoinResult attach(String roomId, String identity, RoomConnection connection) {
        final long now = clock.millis();
        final boolean[] created = new boolean[1];
        final Role[] role = new Role[1];
        final RoomSnapshot[] snap = new RoomSnapshot[1];
        final long[] rev = new long[1];

        Room room = registry.compute(roomId, this::newRoom, (r, isNew) -> {
            Lock w = r.lock().writeLock();
            w.lock();
            try {
                created[0] = isNew;
                if (identity != null) role[0] = r.authority().assignRole(identity);
                if (connection != null) {
                    r.addConnection(connection);
                    rev[0] = r.bumpRevision();
                    r.sendLock().lock();
                } else {
                    r.markEmptySince(now);
                }
                snap[0] = RoomSnapshot.of(r.authority(), r.members(), now);
            } finally {
                w.unlock();
            }
            if (isNew) scheduleHeartbeat(r);
        });

        if (connection != null) {
            try {
                broadcaster.sendTo(room, connection, SyncMessages.sync(snap[0], identity, role[0]));
                broadcaster.broadcast(room, SyncMessages.userJoined(identity, room.members()), null);
                room.markSent(rev[0]);
                persist(snap[0]);
            } finally {
                room.sendLock().unlock();
            }
            log.info("joined. roomId={} identity={} role={} created={} members={}",
                    roomId, identity, role[0], created[0], room.connectionCount());
        } else {
            room.sendLock().lock();
            try {
                persist(snap[0]);
            } finally {
                room.sendLock().unlock();
            }
            if (created[0]) log.info("room created. roomId={} admin={}", roomId, identity);
        }
        return new JoinResult(created[0], role[0], snap[0]);
    }

    // Caller holds the room's sendLock, so rows are written in revision order.
    private void persist(RoomSnapshot snap) {
        try {
            stateStore.save(snap);
        } catch (RuntimeException e) {
            log.warn("room state not saved. roomId={} cause={}", snap.getRoomId(), e.toString());
        }
    }

    private Room newRoom(String roomId) {
        return new Room(new RoomAuthority(roomId, clock.millis()));
    }

    public void leave(String roomId, RoomConnection connection) {
        Room room = registry.get(roomId);
        if (room == null || connection == null) return;
        room.sendLock().lock();
        try {
            if (room.removeConnection(connection, clock.millis()) && room.connectionCount() > 0) {
                broadcaster.broadcast(room, SyncMessages.userLeft(room.members()), null);
            }
        } finally {
            room.sendLock().unlock();
        }
        log.info("left. roomId={} identity={} remaining={}", roomId, connection.getIdentity(), room.connectionCount());
    }

    // ---------- timeline ----------

    /**
     * Applies one op and broadcasts the result exactly once. Play/pause/seek commands skip the
     * originating connection, which is already in that state; item changes go to everyone.
     */
    public MutationResult mutate(String roomId, PlaybackOp op, RoomConnection origin) {
        if (op == null) throw new IllegalArgumentException("op is required");
        final double tolerance = properties.getPositionToleranceSeconds();

        RoomConnection exclude;
        switch (op.getKind()) {
            case PLAY:
            case PAUSE:
            case SEEK:
                exclude = origin;
                break;
            default:
                exclude = null;
        }

        MutationResult result = apply(requireRoomId(roomId), (a, now) -> {
            switch (op.getKind()) {
                case PLAY:
                    return a.play(op.getPosition(), now, tolerance) ? MOVED : APPLIED;
                case PAUSE:
                    return a.pause(op.getPosition(), now, tolerance) ? MOVED : APPLIED;
                case SEEK:
                    a.seek(op.getPosition(), now);
                    return MOVED;
                case SET_ITEM: {
                    RoomItem item = op.getItem().copy();
                    if (item.getAddedBy() == null && origin != null) item.setAddedBy(origin.getIdentity());
                    a.setItem(item, now);
                    return MOVED;
                }
                case ADVANCE: {
                    String expected = op.getFinishedItemId();
                    RoomItem current = a.getCurrentItem();
                    if (expected != null && (current == null || !expected.equals(current.getId()))) {
                        return REJECTED;
                    }
                    a.advance(now);
                    return MOVED;
                }
                case PLAY_INDEX:
                    return a.playIndex(op.getIndex(), now) == null ? REJECTED : MOVED;
                default:
                    throw new IllegalArgumentException("unsupported op: " + op.getKind());
            }
        }, snap -> messageFor(op.getKind(), snap), exclude);

        if (result.isApplied()) {
            log.debug("mutated. roomId={} op={} moved={} position={}", roomId, op, result.isSemanticChange(),
                    result.getSnapshot().getPosition());
        }
        return result;
    }

    private static Map<String, Object> messageFor(PlaybackOp.Kind kind, RoomSnapshot snap) {
        switch (kind) {
            case PLAY:
                return SyncMessages.command(SyncMessages.PLAY, snap);
            case PAUSE:
                return SyncMessages.command(SyncMessages.PAUSE, snap);
            case SEEK:
                return SyncMessages.command(SyncMessages.SEEK, snap);
            default:
                return SyncMessages.setItem(snap);
        }
    }

    public MutationResult applyQueueOp(String roomId, QueueOp op) {
        if (op == null) throw new IllegalArgumentException("op is required");
        return apply(requireRoomId(roomId), (a, now) -> {
            switch (op.getKind()) {
                case ADD:
                    a.addToQueue(op.getItem());
                    return APPLIED;
                case REMOVE:
                    return a.removeFromQueue(op.getIndex()) ? APPLIED : REJECTED;
                case REORDER:
                    return a.reorderQueue(op.getIndex(), op.getNewIndex()) ? APPLIED : REJECTED;
                case PIN:
                    return a.togglePin(op.getIndex()) ? APPLIED : REJECTED;
                default:
                    throw new IllegalArgumentException("unsupported queue op: " + op.getKind());
            }
        }, SyncMessages::queueUpdate, null);
    }

    /** Only an admin may change roles. */
    public boolean promote(String roomId, String requester, String target, Role role) {
        if (target == null || target.isBlank() || role == null) return false;
        MutationResult r = apply(requireRoomId(roomId), (a, now) -> {
            if (a.roleOf(requester) != Role.ADMIN) return REJECTED;
            a.setRole(target, role);
            return APPLIED;
        }, snap -> SyncMessages.rolesUpdate(snap.getRoles()), null);
        if (r.isApplied()) log.info("role changed. roomId={} by={} target={} role={}", roomId, requester, target, role);
        return r.isApplied();
    }

    /** Only an admin may pin a room against eviction. */
    public boolean togglePermanent(String roomId, String requester) {
        MutationResult r = apply(requireRoomId(roomId), (a, now) -> {
            if (a.roleOf(requester) != Role.ADMIN) return REJECTED;
            a.togglePermanent();
            return APPLIED;
        }, snap -> SyncMessages.roomSettings(snap.isPermanent()), null);
        return r.isApplied();
    }

    private MutationResult apply(String roomId, Mutation mutation, MessageFactory message, RoomConnection exclude) {
        Room room = registry.get(roomId);
        if (room == null) {
            log.debug("mutation on unknown room ignored. roomId={}", roomId);
            return MutationResult.rejected(null);
        }

        long now = clock.millis();
        int outcome;
        long rev = 0;
        RoomSnapshot snap;
        Lock w = room.lock().writeLock();
        w.lock();
        try {
            outcome = mutation.apply(room.authority(), now);
            snap = RoomSnapshot.of(room.authority(), room.members(), now);
            if (outcome != REJECTED) {
                rev = room.bumpRevision();
                room.sendLock().lock();
            }
        } finally {
            w.unlock();
        }

        if (outcome == REJECTED) return MutationResult.rejected(snap);

        try {
            broadcaster.broadcast(room, message.create(snap), exclude);
            room.markSent(rev);
            persist(snap);
        } finally {
            room.sendLock().unlock();
        }
        return new MutationResult(true, outcome == MOVED, snap);
    }

    // ---------- reads ----------

    /**
     * Broadcasts the extrapolated position while the room is playing. Never touches the anchor.
     *
     * @return true if a heartbeat went out
     */
    public boolean heartbeat(String roomId) {
        Room room = registry.get(roomId);
        if (room == null) return false;

        RoomSnapshot snap;
        long rev;
        Lock r = room.lock().readLock();
        r.lock();
        try {
            snap = RoomSnapshot.of(room.authority(), null, clock.millis());
            rev = room.getRevision();
        } finally {
            r.unlock();
        }

        if (!snap.isPlaying() || room.connectionCount() == 0) return false;

        room.sendLock().lock();
        try {
            if (rev < room.getLastSentRevision()) {
                log.debug("stale heartbeat dropped. roomId={} rev={}", roomId, rev);
                return false;
            }
            broadcaster.broadcast(room, SyncMessages.heartbeat(snap), null);
            return true;
        } finally {
            room.sendLock().unlock();
        }
    }

    /** Answers a client's explicit request for fresh state, e.g. after a reconnect. */
    public boolean resync(String roomId, RoomConnection connection) {
        Room room = registry.get(roomId);
        if (room == null || connection == null) return false;

        RoomSnapshot snap;
        Role role;
        Lock r = room.lock().readLock();
        r.lock();
        try {
            snap = RoomSnapshot.of(room.authority(), room.members(), clock.millis());
            role = room.authority().roleOf(connection.getIdentity());
            room.sendLock().lock();
        } finally {
            r.unlock();
        }
        try {
            return broadcaster.sendTo(room, connection, SyncMessages.sync(snap, connection.getIdentity(), role));
        } finally {
            room.sendLock().unlock();
        }
    }

    /** @return null for an unknown room */
    public RoomSnapshot snapshot(String roomId) {
        Room room = registry.get(roomId);
        if (room == null) return null;
        Lock r = room.lock().readLock();
        r.lock();
        try {
            return RoomSnapshot.of(room.authority(), room.members(), clock.millis());
        } finally {
            r.unlock();
        }
    }

    /** Rooms with someone connected or something queued. */
    public List<RoomSummary> activeRooms() {
        List<RoomSummary> out = new ArrayList<>();
        for (Room room : registry.all()) {
            Lock r = room.lock().readLock();
            r.lock();
            try {
                RoomAuthority a = room.authority();
                int active = room.connectionCount();
                if (active > 0 || a.getCurrentItem() != null || !a.getQueue().isEmpty()) {
                    String title = a.getCurrentItem() == null ? null : a.getCurrentItem().getTitle();
                    out.add(new RoomSummary(room.getRoomId(), active, title, a.getQueue().size()));
                }
            } finally {
                r.unlock();
            }
        }
        return out;
    }

    // ---------- timers ----------

    private void scheduleHeartbeat(Room room) {
        if (taskScheduler == null) return;
        Duration period = properties.getHeartbeatInterval();
        String roomId = room.getRoomId();
        room.setHeartbeatTask(taskScheduler.scheduleAtFixedRate(
                () -> safeHeartbeat(roomId),
                Instant.ofEpochMilli(clock.millis()).plus(period),
                period));
    }

    private void safeHeartbeat(String roomId) {
        try {
            heartbeat(roomId);
        } catch (Exception e) {
            log.warn("heartbeat failed. roomId={} cause={}", roomId, e.toString());
        }
    }

    /**
     * Removes rooms that have been empty longer than the TTL, unless permanent.
     *
     * @return number of rooms evicted
     */
    public int evictStaleRooms() {
        long now = clock.millis();
        long ttlMs = properties.getRoomTtl().toMillis();
        int evicted = 0;
        for (Room candidate : registry.all()) {
            Room gone = registry.evictIf(candidate.getRoomId(), room -> {
                Long emptySince = room.getEmptySinceEpochMs();
                if (room.connectionCount() > 0 || emptySince == null || now - emptySince <= ttlMs) return false;
                Lock r = room.lock().readLock();
                r.lock();
                try {
                    return !room.authority().isPermanent();
                } finally {
                    r.unlock();
                }
            });
            if (gone != null) {
                gone.cancelHeartbeat();
                stateStore.delete(gone.getRoomId());
                evicted++;
                log.info("evicted stale room. roomId={}", gone.getRoomId());
            }
        }
        return evicted;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        int restored = restoreRooms();
        log.info("restored {} rooms from storage", restored);
    }

    /**
     * Rebuilds rooms from storage. A room that was playing resumes at the saved position plus
     * the time spent down.
     */
    public int restoreRooms() {
        long now = clock.millis();
        int restored = 0;
        for (RoomSnapshot s : stateStore.loadAll()) {
            RoomItem item = s.getCurrentItem();
            double position = s.getPosition();
            if (s.isPlaying() && item != null && !item.isLive()) {
                position += Math.max(0L, now - s.getTakenAtEpochMs()) / 1000.0;
            }
            RoomAuthority a = new RoomAuthority(s.getRoomId(), now);
            a.restore(s.isPlaying(), position, item, s.getQueue(), s.getPlayingIndex(), s.getRoles(), s.isPermanent(), now);
            Room room = new Room(a);
            room.markEmptySince(now);
            if (registry.putIfAbsent(room) == room) {
                scheduleHeartbeat(room);
                restored++;
            }
        }
        return restored;
    }

    private static String requireRoomId(String roomId) {
        if (roomId == null || roomId.isBlank()) throw new IllegalArgumentException("roomId is required");
        return roomId;
    }

    private interface Mutation {
        int apply(RoomAuthority authority, long nowEpochMs);
    }

    private interface MessageFactory {
        Map<String, Object> create(RoomSnapshot snapshot);
    }
}
