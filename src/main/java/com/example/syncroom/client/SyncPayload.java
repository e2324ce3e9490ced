package com.example.syncroom.client;

import com.example.syncroom.model.RoomItem;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Client view of the server's {@code sync} message.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncPayload {
    private String roomId;
    private double timestamp;
    private boolean playing;
    private RoomItem currentItem;
    private List<RoomItem> queue = new ArrayList<>();
    private int playingIndex = -1;
    private String you;
    private String yourRole;
    private boolean permanent;
    private long serverTime;

    public String getRoomId() { return roomId; }
    public void setRoomId(String roomId) { this.roomId = roomId; }

    public double getTimestamp() { return timestamp; }
    public void setTimestamp(double timestamp) { this.timestamp = timestamp; }

    @JsonProperty("isPlaying")
    public boolean isPlaying() { return playing; }
    @JsonProperty("isPlaying")
    public void setPlaying(boolean playing) { this.playing = playing; }

    public RoomItem getCurrentItem() { return currentItem; }
    public void setCurrentItem(RoomItem currentItem) { this.currentItem = currentItem; }

    public List<RoomItem> getQueue() { return queue; }
    public void setQueue(List<RoomItem> queue) { this.queue = queue; }

    public int getPlayingIndex() { return playingIndex; }
    public void setPlayingIndex(int playingIndex) { this.playingIndex = playingIndex; }

    public String getYou() { return you; }
    public void setYou(String you) { this.you = you; }

    public String getYourRole() { return yourRole; }
    public void setYourRole(String yourRole) { this.yourRole = yourRole; }

    public boolean isPermanent() { return permanent; }
    public void setPermanent(boolean permanent) { this.permanent = permanent; }

    public long getServerTime() { return serverTime; }
    public void setServerTime(long serverTime) { this.serverTime = serverTime; }
}
