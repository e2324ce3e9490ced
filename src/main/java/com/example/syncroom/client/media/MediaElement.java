package com.example.syncroom.client.media;

import java.util.concurrent.CompletableFuture;

/**
 * One local playback engine (a video-only, audio-only or muxed element).
 *
 * <p>{@link #play()} is asynchronous and may complete exceptionally with a
 * {@link MediaPlaybackException}. Callers never issue play/pause directly; they go through a
 * {@link PlaybackGate}.
 */
public interface MediaElement {

    /** Replaces the source. A null url unloads the element. */
    void load(String url);

    double getCurrentTime();

    void setCurrentTime(double seconds);

    boolean isPaused();

    boolean isSeeking();

    CompletableFuture<Void> play();

    void pause();

    double getPlaybackRate();

    void setPlaybackRate(double rate);

    /** Seconds of content buffered ahead of the current time, 0 when nothing is buffered. */
    double getBufferedAhead();

    /** Completes once the element has enough data to start playing at the current time. */
    CompletableFuture<Void> whenReadyToPlay();

    boolean isMuted();

    void setMuted(boolean muted);

    void setVolume(double volume);
}
