package com.example.syncroom.client.media;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Serializes play/pause on one element. A play while another play is pending joins the pending
 * one; a pause waits for the pending play to settle before pausing. The last request wins: a
 * queued pause is dropped if play was asked for again before it ran.
 */
public class PlaybackGate {
    private static final Logger log = LoggerFactory.getLogger(PlaybackGate.class);

    private final String name;
    private final MediaElement element;

    private CompletableFuture<Void> pendingPlay; // guarded by this
    private boolean wantPlaying;                 // guarded by this

    public PlaybackGate(String name, MediaElement element) {
        this.name = name;
        this.element = element;
    }

    public MediaElement element() {
        return element;
    }

    public synchronized boolean isPlayPending() {
        return pendingPlay != null && !pendingPlay.isDone();
    }

    /** Raw serialized play; the returned future fails with the element's error. */
    public synchronized CompletableFuture<Void> play() {
        wantPlaying = true;
        if (pendingPlay != null && !pendingPlay.isDone()) return pendingPlay;
        CompletableFuture<Void> p;
        try {
            p = element.play();
        } catch (RuntimeException e) {
            p = new CompletableFuture<>();
            p.completeExceptionally(e);
        }
        pendingPlay = p;
        return p;
    }

    /**
     * Play that never fails. Autoplay refusal mutes the element and retries once; an aborted play
     * is dropped; any other failure is logged and left for the next tick.
     */
    public CompletableFuture<Void> playSafely() {
        return play().handle((v, err) -> err)
                .thenCompose(err -> {
                    if (err == null) return CompletableFuture.<Void>completedFuture(null);
                    MediaPlaybackException.Reason reason = MediaPlaybackException.reasonOf(err);
                    if (reason == MediaPlaybackException.Reason.NOT_ALLOWED) {
                        log.info("autoplay refused, retrying muted. element={}", name);
                        element.setMuted(true);
                        return play().handle((v2, err2) -> {
                            if (err2 != null) log.warn("muted play failed. element={} cause={}", name, err2.toString());
                            return (Void) null;
                        });
                    }
                    if (reason == MediaPlaybackException.Reason.FAILED) {
                        log.warn("play failed. element={} cause={}", name, err.toString());
                    }
                    return CompletableFuture.<Void>completedFuture(null);
                });
    }

    public CompletableFuture<Void> pause() {
        CompletableFuture<Void> inflight;
        synchronized (this) {
            wantPlaying = false;
            inflight = pendingPlay;
        }
        if (inflight == null || inflight.isDone()) {
            element.pause();
            return CompletableFuture.completedFuture(null);
        }
        return inflight.handle((v, err) -> (Void) null).thenRun(this::pauseIfStillWanted);
    }

    private void pauseIfStillWanted() {
        synchronized (this) {
            if (wantPlaying) {
                log.debug("queued pause dropped, play was requested since. element={}", name);
                return;
            }
        }
        element.pause();
    }
}
