package com.example.syncroom.ws;

import com.example.syncroom.model.Member;
import com.example.syncroom.model.Role;
import com.example.syncroom.model.RoomItem;
import com.example.syncroom.model.RoomSnapshot;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builders for the {@code {type, payload}} envelopes the server sends.
 */
public final class SyncMessages {

    public static final String SYNC = "sync";
    public static final String PLAY = "play";
    public static final String PAUSE = "pause";
    public static final String SEEK = "seek";
    public static final String HEARTBEAT = "heartbeat";
    public static final String PING = "ping";
    public static final String PONG = "pong";
    public static final String SET_ITEM = "set_item";
    public static final String QUEUE_UPDATE = "queue_update";
    public static final String USER_JOINED = "user_joined";
    public static final String USER_LEFT = "user_left";
    public static final String ROLES_UPDATE = "roles_update";
    public static final String ROOM_SETTINGS_UPDATE = "room_settings_update";
    public static final String ERROR = "error";

    private SyncMessages() {}

    public static Map<String, Object> envelope(String type, Map<String, Object> payload) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", type);
        m.put("payload", payload);
        return m;
    }

    /** Full state for a (re)joining client. */
    public static Map<String, Object> sync(RoomSnapshot s, String identity, Role role) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("roomId", s.getRoomId());
        p.put("timestamp", s.getPosition());
        p.put("isPlaying", s.isPlaying());
        p.put("currentItem", s.getCurrentItem());
        p.put("queue", s.getQueue());
        p.put("playingIndex", s.getPlayingIndex());
        p.put("members", s.getMembers());
        p.put("roles", s.getRoles());
        p.put("permanent", s.isPermanent());
        p.put("you", identity);
        p.put("yourRole", role);
        p.put("serverTime", s.getTakenAtEpochMs());
        return envelope(SYNC, p);
    }

    /** play / pause / seek. */
    public static Map<String, Object> command(String type, RoomSnapshot s) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("timestamp", s.getPosition());
        p.put("isPlaying", s.isPlaying());
        RoomItem current = s.getCurrentItem();
        p.put("isLive", current != null && current.isLive());
        return envelope(type, p);
    }

    public static Map<String, Object> heartbeat(RoomSnapshot s) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("timestamp", s.getPosition());
        p.put("isPlaying", s.isPlaying());
        p.put("serverTime", s.getTakenAtEpochMs());
        return envelope(HEARTBEAT, p);
    }

    public static Map<String, Object> pong(Object clientSendTime, long serverTimeEpochMs) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("clientSendTime", clientSendTime);
        p.put("serverTime", serverTimeEpochMs);
        return envelope(PONG, p);
    }

    public static Map<String, Object> setItem(RoomSnapshot s) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("item", s.getCurrentItem());
        p.put("queue", s.getQueue());
        p.put("playingIndex", s.getPlayingIndex());
        p.put("timestamp", s.getPosition());
        p.put("isPlaying", s.isPlaying());
        return envelope(SET_ITEM, p);
    }

    public static Map<String, Object> queueUpdate(RoomSnapshot s) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("queue", s.getQueue());
        p.put("playingIndex", s.getPlayingIndex());
        return envelope(QUEUE_UPDATE, p);
    }

    public static Map<String, Object> userJoined(String identity, List<Member> members) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("identity", identity);
        p.put("members", members);
        return envelope(USER_JOINED, p);
    }

    public static Map<String, Object> userLeft(List<Member> members) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("members", members);
        return envelope(USER_LEFT, p);
    }

    public static Map<String, Object> rolesUpdate(Map<String, Role> roles) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("roles", roles);
        return envelope(ROLES_UPDATE, p);
    }

    public static Map<String, Object> roomSettings(boolean permanent) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("permanent", permanent);
        return envelope(ROOM_SETTINGS_UPDATE, p);
    }

    public static Map<String, Object> error(String message) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("message", message);
        return envelope(ERROR, p);
    }
}
