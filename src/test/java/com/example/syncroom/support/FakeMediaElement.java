package com.example.syncroom.support;

import com.example.syncroom.client.media.MediaElement;
import com.example.syncroom.client.media.MediaPlaybackException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;

/**
 * Scriptable element. Time only moves when a test sets it. play() resolves immediately unless a
 * pending or failing outcome has been queued.
 */
public class FakeMediaElement implements MediaElement {
    public String url;
    public double currentTime;
    public boolean paused = true;
    public boolean seeking;
    public double rate = 1.0;
    public double bufferedAhead = 10.0;
    public boolean muted;
    public double volume = 1.0;
    public boolean readyFails;

    public int playCalls;
    public int pauseCalls;
    public int seekCalls;

    private final Deque<CompletableFuture<Void>> scriptedPlays = new ArrayDeque<>();

    /** Next play() returns this future; the element starts playing when it completes normally. */
    public CompletableFuture<Void> holdNextPlay() {
        CompletableFuture<Void> f = new CompletableFuture<>();
        scriptedPlays.add(f);
        return f;
    }

    public void failNextPlay(MediaPlaybackException.Reason reason) {
        CompletableFuture<Void> f = new CompletableFuture<>();
        f.completeExceptionally(new MediaPlaybackException(reason, "scripted " + reason));
        scriptedPlays.add(f);
    }

    @Override
    public void load(String url) {
        this.url = url;
        this.currentTime = 0;
        this.paused = true;
    }

    @Override
    public double getCurrentTime() {
        return currentTime;
    }

    @Override
    public void setCurrentTime(double seconds) {
        seekCalls++;
        currentTime = seconds;
    }

    @Override
    public boolean isPaused() {
        return paused;
    }

    @Override
    public boolean isSeeking() {
        return seeking;
    }

    @Override
    public CompletableFuture<Void> play() {
        playCalls++;
        CompletableFuture<Void> scripted = scriptedPlays.poll();
        if (scripted == null) {
            paused = false;
            return CompletableFuture.completedFuture(null);
        }
        return scripted.thenRun(() -> paused = false);
    }

    @Override
    public void pause() {
        pauseCalls++;
        paused = true;
    }

    @Override
    public double getPlaybackRate() {
        return rate;
    }

    @Override
    public void setPlaybackRate(double rate) {
        this.rate = rate;
    }

    @Override
    public double getBufferedAhead() {
        return bufferedAhead;
    }

    @Override
    public CompletableFuture<Void> whenReadyToPlay() {
        if (readyFails) {
            CompletableFuture<Void> f = new CompletableFuture<>();
            f.completeExceptionally(new MediaPlaybackException(MediaPlaybackException.Reason.FAILED, "never ready"));
            return f;
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public boolean isMuted() {
        return muted;
    }

    @Override
    public void setMuted(boolean muted) {
        this.muted = muted;
    }

    @Override
    public void setVolume(double volume) {
        this.volume = volume;
    }
}
