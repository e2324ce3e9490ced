package com.example.syncroom.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of a room queue. Mutable bean so it can be bound straight from inbound JSON;
 * the coordinator always stores and hands out copies.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RoomItem {
    private String id;
    private String originalUrl;
    private String title;
    private String thumbnail;
    private String addedBy;
    private boolean live;
    private boolean pinned;

    public RoomItem() {}

    public RoomItem(String id, String originalUrl, String title, boolean live) {
        this.id = id;
        this.originalUrl = originalUrl;
        this.title = title;
        this.live = live;
    }

    public RoomItem copy() {
        RoomItem c = new RoomItem(id, originalUrl, title, live);
        c.thumbnail = thumbnail;
        c.addedBy = addedBy;
        c.pinned = pinned;
        return c;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getOriginalUrl() { return originalUrl; }
    public void setOriginalUrl(String originalUrl) { this.originalUrl = originalUrl; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getThumbnail() { return thumbnail; }
    public void setThumbnail(String thumbnail) { this.thumbnail = thumbnail; }

    public String getAddedBy() { return addedBy; }
    public void setAddedBy(String addedBy) { this.addedBy = addedBy; }

    @JsonProperty("isLive")
    public boolean isLive() { return live; }
    @JsonProperty("isLive")
    public void setLive(boolean live) { this.live = live; }

    public boolean isPinned() { return pinned; }
    public void setPinned(boolean pinned) { this.pinned = pinned; }
}
