package com.example.syncroom.client.dual;

/**
 * Mutable state of one dual-stream session. Owned by {@link DualStreamSynchronizer} and only
 * touched under its monitor; {@link #copy()} hands out a consistent view.
 */
public class DualStreamState {
    static final long NEVER = -1L;

    boolean playing;
    boolean buffering;
    boolean syncing;
    double lastDrift;
    SyncHealth syncHealth = SyncHealth.GOOD;
    int consecutiveFailureCount;
    long lastHeavySyncTime = NEVER;

    // secondary was paused by the low-buffer check, not by the user or the runtime
    boolean secondaryHeldForBuffer;
    int recoveryAttempts;
    long lastRecoveryAttempt = NEVER;

    long generation;

    void resetForLoad() {
        buffering = false;
        syncing = false;
        lastDrift = 0;
        syncHealth = SyncHealth.GOOD;
        consecutiveFailureCount = 0;
        lastHeavySyncTime = NEVER;
        secondaryHeldForBuffer = false;
        recoveryAttempts = 0;
        lastRecoveryAttempt = NEVER;
        generation++;
    }

    DualStreamState copy() {
        DualStreamState c = new DualStreamState();
        c.playing = playing;
        c.buffering = buffering;
        c.syncing = syncing;
        c.lastDrift = lastDrift;
        c.syncHealth = syncHealth;
        c.consecutiveFailureCount = consecutiveFailureCount;
        c.lastHeavySyncTime = lastHeavySyncTime;
        c.secondaryHeldForBuffer = secondaryHeldForBuffer;
        c.recoveryAttempts = recoveryAttempts;
        c.lastRecoveryAttempt = lastRecoveryAttempt;
        c.generation = generation;
        return c;
    }

    public boolean isPlaying() { return playing; }
    public boolean isBuffering() { return buffering; }
    public boolean isSyncing() { return syncing; }
    public double getLastDrift() { return lastDrift; }
    public SyncHealth getSyncHealth() { return syncHealth; }
    public int getConsecutiveFailureCount() { return consecutiveFailureCount; }
    public long getLastHeavySyncTime() { return lastHeavySyncTime; }
    public int getRecoveryAttempts() { return recoveryAttempts; }
    public long getGeneration() { return generation; }
}
