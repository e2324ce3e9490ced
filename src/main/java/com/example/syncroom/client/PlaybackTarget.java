package com.example.syncroom.client;

import java.util.concurrent.CompletableFuture;

/**
 * What the drift corrector drives: a single element or a synchronized video/audio pair.
 */
public interface PlaybackTarget {

    double getCurrentTime();

    /** True while local playback is running. */
    boolean isPlaying();

    void seek(double seconds);

    CompletableFuture<Void> play();

    CompletableFuture<Void> pause();

    double getPlaybackRate();

    /** Room-level rate. Dual-stream targets apply their own secondary nudges relative to it. */
    void setPlaybackRate(double rate);

    void setMuted(boolean muted);

    void setVolume(double volume);
}
