package com.example.syncroom.client.media;

import java.util.Collections;
import java.util.List;

/**
 * Result of resolving a queue item into playable urls.
 */
public class ResolvedMedia {
    private final StreamType streamType;
    private final String streamUrl;
    private final String videoUrl;
    private final String audioUrl;
    private final List<String> availableQualities;
    private final String quality;
    private final boolean live;

    private ResolvedMedia(StreamType streamType, String streamUrl, String videoUrl, String audioUrl,
                          List<String> availableQualities, String quality, boolean live) {
        this.streamType = streamType;
        this.streamUrl = streamUrl;
        this.videoUrl = videoUrl;
        this.audioUrl = audioUrl;
        this.availableQualities = availableQualities == null
                ? Collections.<String>emptyList()
                : Collections.unmodifiableList(availableQualities);
        this.quality = quality;
        this.live = live;
    }

    public static ResolvedMedia single(String streamUrl, List<String> qualities, String quality, boolean live) {
        if (streamUrl == null) throw new IllegalArgumentException("streamUrl is required");
        return new ResolvedMedia(StreamType.SINGLE, streamUrl, null, null, qualities, quality, live);
    }

    public static ResolvedMedia dual(String videoUrl, String audioUrl, List<String> qualities, String quality, boolean live) {
        if (videoUrl == null || audioUrl == null) throw new IllegalArgumentException("videoUrl and audioUrl are required");
        return new ResolvedMedia(StreamType.DUAL, null, videoUrl, audioUrl, qualities, quality, live);
    }

    public StreamType getStreamType() { return streamType; }
    public String getStreamUrl() { return streamUrl; }
    public String getVideoUrl() { return videoUrl; }
    public String getAudioUrl() { return audioUrl; }
    public List<String> getAvailableQualities() { return availableQualities; }
    public String getQuality() { return quality; }
    public boolean isLive() { return live; }
}
