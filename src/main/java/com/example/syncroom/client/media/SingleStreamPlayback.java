package com.example.syncroom.client.media;

import com.example.syncroom.client.PlaybackTarget;

import java.util.concurrent.CompletableFuture;

public class SingleStreamPlayback implements PlaybackTarget {

    private final MediaElement element;
    private final PlaybackGate gate;

    public SingleStreamPlayback(MediaElement element) {
        this.element = element;
        this.gate = new PlaybackGate("single", element);
    }

    public void load(String url) {
        element.load(url);
        element.setPlaybackRate(1.0);
    }

    @Override
    public double getCurrentTime() {
        return element.getCurrentTime();
    }

    @Override
    public boolean isPlaying() {
        return !element.isPaused();
    }

    @Override
    public void seek(double seconds) {
        element.setCurrentTime(Math.max(0, seconds));
    }

    @Override
    public CompletableFuture<Void> play() {
        return gate.playSafely();
    }

    @Override
    public CompletableFuture<Void> pause() {
        return gate.pause();
    }

    @Override
    public double getPlaybackRate() {
        return element.getPlaybackRate();
    }

    @Override
    public void setPlaybackRate(double rate) {
        element.setPlaybackRate(rate);
    }

    @Override
    public void setMuted(boolean muted) {
        element.setMuted(muted);
    }

    @Override
    public void setVolume(double volume) {
        element.setVolume(volume);
    }
}
