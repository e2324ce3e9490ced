package com.example.syncroom.persistence;

import javax.persistence.*;

@Entity
@Table(name = "sr_room_state")
public class RoomStateEntity {

    @Id
    @Column(length = 128)
    private String roomId;

    private boolean playing;

    private double position;

    private int playingIndex;

    @Lob
    @Column(name = "current_item_json")
    private String currentItemJson;

    @Lob
    @Column(name = "queue_json")
    private String queueJson;

    @Lob
    @Column(name = "roles_json")
    private String rolesJson;

    private boolean permanent;

    private long savedAtEpochMs;

    protected RoomStateEntity() {}

    public RoomStateEntity(String roomId, boolean playing, double position, int playingIndex,
                           String currentItemJson, String queueJson, String rolesJson,
                           boolean permanent, long savedAtEpochMs) {
        this.roomId = roomId;
        this.playing = playing;
        this.position = position;
        this.playingIndex = playingIndex;
        this.currentItemJson = currentItemJson;
        this.queueJson = queueJson;
        this.rolesJson = rolesJson;
        this.permanent = permanent;
        this.savedAtEpochMs = savedAtEpochMs;
    }

    public String getRoomId() { return roomId; }
    public boolean isPlaying() { return playing; }
    public double getPosition() { return position; }
    public int getPlayingIndex() { return playingIndex; }
    public String getCurrentItemJson() { return currentItemJson; }
    public String getQueueJson() { return queueJson; }
    public String getRolesJson() { return rolesJson; }
    public boolean isPermanent() { return permanent; }
    public long getSavedAtEpochMs() { return savedAtEpochMs; }
}
