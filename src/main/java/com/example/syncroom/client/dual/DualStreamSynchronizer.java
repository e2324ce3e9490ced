package com.example.syncroom.client.dual;

import com.example.syncroom.client.PlaybackTarget;
import com.example.syncroom.client.media.MediaElement;
import com.example.syncroom.client.media.PlaybackGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Keeps a secondary (audio-only) element aligned to a primary (video-only) element.
 *
 * <p>Driven by {@link #tick()} from a wall-clock loop. Each tick, while the primary plays:
 * <ol>
 *   <li>low buffer on either element pauses the secondary before the primary stalls, and
 *       resumes it at the primary's time once the buffer recovers;</li>
 *   <li>a secondary that stopped on its own is resumed, spaced and capped per episode;</li>
 *   <li>drift within {@code driftThreshold} restores the base rate, drift up to
 *       {@code heavySyncThreshold} nudges the secondary rate, anything larger runs a heavy
 *       resync (pause both, seek both, wait for ready, resume) behind an exponential cooldown.</li>
 * </ol>
 *
 * <p>All state is guarded by this object's monitor. Asynchronous completions are posted back
 * to the loop executor and discarded if a newer {@link #load} happened in the meantime.
 */
public class DualStreamSynchronizer implements PlaybackTarget {
    private static final Logger log = LoggerFactory.getLogger(DualStreamSynchronizer.class);

    static final double AHEAD_RATE = 0.97;
    static final double BEHIND_RATE = 1.03;
    static final String EXHAUSTED_NOTICE = "Audio and video could not be resynchronized. Try reloading.";

    private final MediaElement primary;
    private final MediaElement secondary;
    private final PlaybackGate primaryGate;
    private final PlaybackGate secondaryGate;
    private final DualStreamConfig config;
    private final LongSupplier clockMs;
    private final Executor loopExecutor;
    private final SyncNoticeListener noticeListener;

    private final DualStreamState state = new DualStreamState();
    private double baseRate = 1.0;

    public DualStreamSynchronizer(MediaElement primary,
                                  MediaElement secondary,
                                  DualStreamConfig config,
                                  LongSupplier clockMs,
                                  Executor loopExecutor,
                                  SyncNoticeListener noticeListener) {
        this.primary = primary;
        this.secondary = secondary;
        this.primaryGate = new PlaybackGate("video", primary);
        this.secondaryGate = new PlaybackGate("audio", secondary);
        this.config = config;
        this.clockMs = clockMs;
        this.loopExecutor = loopExecutor;
        this.noticeListener = noticeListener;
    }

    /**
     * Loads new media. Resets health and failure counters and invalidates any heavy resync still
     * in flight for the previous media.
     *
     * @return the new generation
     */
    public synchronized long load(String videoUrl, String audioUrl) {
        state.resetForLoad();
        primary.load(videoUrl);
        secondary.load(audioUrl);
        primary.setPlaybackRate(baseRate);
        secondary.setPlaybackRate(baseRate);
        log.debug("dual stream loaded. generation={}", state.generation);
        return state.generation;
    }

    public synchronized DualStreamState getState() {
        return state.copy();
    }

    // ---------- loop ----------

    public synchronized void tick() {
        if (state.syncing) return;
        if (primary.isPaused() || primary.isSeeking() || secondary.isSeeking()) return;

        long now = clockMs.getAsLong();

        double minBuffer = Math.min(primary.getBufferedAhead(), secondary.getBufferedAhead());
        if (minBuffer < config.getBufferThresholdSeconds()) {
            if (!state.secondaryHeldForBuffer) {
                log.debug("low buffer, holding secondary. minBuffer={}", minBuffer);
                secondaryGate.pause();
                state.secondaryHeldForBuffer = true;
                state.buffering = true;
            }
            return;
        }
        if (state.secondaryHeldForBuffer) {
            log.debug("buffer recovered, resuming secondary. minBuffer={}", minBuffer);
            state.secondaryHeldForBuffer = false;
            state.buffering = false;
            secondary.setCurrentTime(primary.getCurrentTime());
            secondaryGate.playSafely();
            return;
        }

        if (secondaryGate.isPlayPending()) return;
        if (secondary.isPaused()) {
            passiveRecovery(now);
            return;
        }
        state.recoveryAttempts = 0;

        double drift = secondary.getCurrentTime() - primary.getCurrentTime();
        state.lastDrift = drift;
        double abs = Math.abs(drift);

        if (abs <= config.getDriftThresholdSeconds()) {
            secondary.setPlaybackRate(baseRate);
        } else if (abs <= config.getHeavySyncThresholdSeconds()
                || state.syncHealth == SyncHealth.FAILED
                || !cooldownElapsed(now)) {
            secondary.setPlaybackRate(baseRate * (drift > 0 ? AHEAD_RATE : BEHIND_RATE));
        } else {
            log.debug("heavy resync triggered. drift={}", drift);
            heavyResync();
        }
    }

    private boolean cooldownElapsed(long now) {
        return state.lastHeavySyncTime == DualStreamState.NEVER
                || now - state.lastHeavySyncTime >= config.cooldownMs(state.consecutiveFailureCount);
    }

    private void passiveRecovery(long now) {
        if (state.recoveryAttempts >= config.getMaxRecoveryAttempts()) return;
        if (state.lastRecoveryAttempt != DualStreamState.NEVER
                && now - state.lastRecoveryAttempt < config.getRecoverySpacingMs()) {
            return;
        }
        state.recoveryAttempts++;
        state.lastRecoveryAttempt = now;
        if (state.recoveryAttempts == config.getMaxRecoveryAttempts()) {
            log.warn("secondary recovery attempts used up for this episode. attempts={}", state.recoveryAttempts);
        } else {
            log.debug("secondary stopped while primary plays, resuming. attempt={}", state.recoveryAttempts);
        }
        secondary.setCurrentTime(primary.getCurrentTime());
        secondaryGate.playSafely();
    }

    // ---------- heavy resync ----------

    /**
     * Pause both, seek both to the primary's time, wait for both to be ready, resume. The result
     * completes with true on success; a refused or stale attempt yields false. Playback is resumed
     * on every exit path if it was running before.
     */
    public synchronized CompletableFuture<Boolean> heavyResync() {
        if (state.syncing || state.syncHealth == SyncHealth.FAILED) {
            return CompletableFuture.completedFuture(false);
        }
        final long generation = state.generation;
        final boolean wasPlaying = !primary.isPaused();
        final double target = primary.getCurrentTime();

        state.syncing = true;
        state.buffering = true;
        state.syncHealth = SyncHealth.RECOVERING;
        state.lastHeavySyncTime = clockMs.getAsLong();
        if (wasPlaying) state.playing = true;

        CompletableFuture<Void> ready = CompletableFuture.allOf(primaryGate.pause(), secondaryGate.pause())
                .thenComposeAsync(v -> seekBothAndAwaitReady(generation, target), loopExecutor)
                .orTimeout(config.getHeavySyncTimeoutMs(), TimeUnit.MILLISECONDS);

        return ready.handleAsync((v, err) -> finishHeavyResync(generation, err), loopExecutor);
    }

    private synchronized CompletableFuture<Void> seekBothAndAwaitReady(long generation, double target) {
        if (generation != state.generation) return CompletableFuture.completedFuture(null);
        primary.setCurrentTime(target);
        secondary.setCurrentTime(target);
        return CompletableFuture.allOf(primary.whenReadyToPlay(), secondary.whenReadyToPlay());
    }

    private synchronized boolean finishHeavyResync(long generation, Throwable err) {
        if (generation != state.generation) {
            log.debug("stale heavy resync ignored. generation={} current={}", generation, state.generation);
            return false;
        }
        state.syncing = false;
        state.buffering = false;

        boolean ok = err == null;
        if (ok) {
            state.consecutiveFailureCount = 0;
            state.syncHealth = SyncHealth.GOOD;
            log.debug("heavy resync done");
        } else {
            state.consecutiveFailureCount++;
            log.warn("heavy resync failed. attempt={} cause={}", state.consecutiveFailureCount, err.toString());
            if (state.consecutiveFailureCount >= config.getMaxConsecutiveFailures()) {
                state.syncHealth = SyncHealth.FAILED;
                log.warn("heavy resync exhausted, continuing unsynchronized. failures={}", state.consecutiveFailureCount);
                if (noticeListener != null) noticeListener.onSyncExhausted(EXHAUSTED_NOTICE);
            }
        }

        secondary.setPlaybackRate(baseRate);
        if (state.playing) {
            primaryGate.playSafely();
            secondaryGate.playSafely();
        }
        return ok;
    }

    // ---------- visibility ----------

    /**
     * Becoming visible again resets the secondary rate and, if the runtime suspended the
     * secondary in the background, realigns and resumes it.
     */
    public synchronized void onVisibilityChanged(boolean visible) {
        if (!visible) return;
        secondary.setPlaybackRate(baseRate);
        state.recoveryAttempts = 0;
        state.lastRecoveryAttempt = DualStreamState.NEVER;
        if (!state.syncing && !primary.isPaused() && secondary.isPaused()) {
            log.debug("visible again, realigning secondary");
            secondary.setCurrentTime(primary.getCurrentTime());
            secondaryGate.playSafely();
        }
    }

    // ---------- PlaybackTarget ----------

    @Override
    public synchronized double getCurrentTime() {
        return primary.getCurrentTime();
    }

    @Override
    public synchronized boolean isPlaying() {
        return !primary.isPaused();
    }

    @Override
    public synchronized void seek(double seconds) {
        double t = Math.max(0, seconds);
        primary.setCurrentTime(t);
        secondary.setCurrentTime(t);
    }

    @Override
    public synchronized CompletableFuture<Void> play() {
        state.playing = true;
        state.secondaryHeldForBuffer = false;
        secondary.setCurrentTime(primary.getCurrentTime());
        return CompletableFuture.allOf(primaryGate.playSafely(), secondaryGate.playSafely());
    }

    @Override
    public synchronized CompletableFuture<Void> pause() {
        state.playing = false;
        return CompletableFuture.allOf(primaryGate.pause(), secondaryGate.pause());
    }

    @Override
    public synchronized double getPlaybackRate() {
        return baseRate;
    }

    @Override
    public synchronized void setPlaybackRate(double rate) {
        baseRate = rate;
        primary.setPlaybackRate(rate);
        secondary.setPlaybackRate(rate);
    }

    /** The primary carries no audio; mute and volume act on the secondary. */
    @Override
    public synchronized void setMuted(boolean muted) {
        secondary.setMuted(muted);
    }

    @Override
    public synchronized void setVolume(double volume) {
        secondary.setVolume(volume);
    }
}
