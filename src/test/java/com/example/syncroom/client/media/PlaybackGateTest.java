package com.example.syncroom.client.media;

import com.example.syncroom.support.FakeMediaElement;
import org.junit.Before;
import org.junit.Test;

import java.util.concurrent.CompletableFuture;

import static org.junit.Assert.*;

public class PlaybackGateTest {

    private FakeMediaElement element;
    private PlaybackGate gate;

    @Before
    public void setUp() {
        element = new FakeMediaElement();
        gate = new PlaybackGate("test", element);
    }

    @Test
    public void secondPlayJoinsPendingOne() {
        CompletableFuture<Void> held = element.holdNextPlay();

        CompletableFuture<Void> first = gate.play();
        CompletableFuture<Void> second = gate.play();

        assertSame(first, second);
        assertEquals(1, element.playCalls);
        assertTrue(gate.isPlayPending());

        held.complete(null);
        assertFalse(gate.isPlayPending());
        assertFalse(element.paused);
    }

    @Test
    public void pauseWaitsForPendingPlay() {
        CompletableFuture<Void> held = element.holdNextPlay();
        gate.play();

        CompletableFuture<Void> paused = gate.pause();

        assertEquals(0, element.pauseCalls);
        assertFalse(paused.isDone());

        held.complete(null);
        assertTrue(paused.isDone());
        assertEquals(1, element.pauseCalls);
        assertTrue(element.paused);
    }

    @Test
    public void playAfterQueuedPauseWins() {
        CompletableFuture<Void> held = element.holdNextPlay();
        gate.play();
        gate.pause();

        gate.playSafely();
        held.complete(null);

        assertFalse(element.paused);
        assertEquals(1, element.playCalls);
        assertEquals(0, element.pauseCalls);
    }

    @Test
    public void pauseAfterJoinedPlayStillPauses() {
        CompletableFuture<Void> held = element.holdNextPlay();
        gate.play();
        gate.pause();
        gate.play();
        gate.pause();

        held.complete(null);

        assertTrue(element.paused);
    }

    @Test
    public void pauseStillRunsWhenPendingPlayFails() {
        CompletableFuture<Void> held = element.holdNextPlay();
        gate.play();
        CompletableFuture<Void> paused = gate.pause();

        held.completeExceptionally(new MediaPlaybackException(MediaPlaybackException.Reason.ABORTED, "load"));

        assertTrue(paused.isDone());
        assertFalse(paused.isCompletedExceptionally());
        assertEquals(1, element.pauseCalls);
    }

    @Test
    public void autoplayRefusalMutesAndRetriesOnce() {
        element.failNextPlay(MediaPlaybackException.Reason.NOT_ALLOWED);

        gate.playSafely().join();

        assertTrue(element.muted);
        assertEquals(2, element.playCalls);
        assertFalse(element.paused);
    }

    @Test
    public void abortedPlayIsNotRetried() {
        element.failNextPlay(MediaPlaybackException.Reason.ABORTED);

        gate.playSafely().join();

        assertEquals(1, element.playCalls);
        assertFalse(element.muted);
        assertTrue(element.paused);
    }

    @Test
    public void failedPlayNeverPropagates() {
        element.failNextPlay(MediaPlaybackException.Reason.FAILED);

        CompletableFuture<Void> f = gate.playSafely();

        assertTrue(f.isDone());
        assertFalse(f.isCompletedExceptionally());
        assertTrue(element.paused);
    }

    @Test
    public void wrappedFailuresKeepTheirReason() {
        Throwable wrapped = new java.util.concurrent.CompletionException(
                new MediaPlaybackException(MediaPlaybackException.Reason.NOT_ALLOWED, "policy"));

        assertEquals(MediaPlaybackException.Reason.NOT_ALLOWED, MediaPlaybackException.reasonOf(wrapped));
        assertEquals(MediaPlaybackException.Reason.FAILED, MediaPlaybackException.reasonOf(new IllegalStateException()));
    }
}
