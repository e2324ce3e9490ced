package com.example.syncroom.client.dual;

/**
 * Tuning of the video/audio synchronizer.
 */
public final class DualStreamConfig {
    private final double bufferThresholdSeconds;
    private final double driftThresholdSeconds;
    private final double heavySyncThresholdSeconds;
    private final int tickHz;
    private final long heavySyncCooldownBaseMs;
    private final int cooldownMaxExponent;
    private final long heavySyncTimeoutMs;
    private final int maxConsecutiveFailures;
    private final long recoverySpacingMs;
    private final int maxRecoveryAttempts;

    private DualStreamConfig(Builder b) {
        this.bufferThresholdSeconds = b.bufferThresholdSeconds;
        this.driftThresholdSeconds = b.driftThresholdSeconds;
        this.heavySyncThresholdSeconds = b.heavySyncThresholdSeconds;
        this.tickHz = b.tickHz;
        this.heavySyncCooldownBaseMs = b.heavySyncCooldownBaseMs;
        this.cooldownMaxExponent = b.cooldownMaxExponent;
        this.heavySyncTimeoutMs = b.heavySyncTimeoutMs;
        this.maxConsecutiveFailures = b.maxConsecutiveFailures;
        this.recoverySpacingMs = b.recoverySpacingMs;
        this.maxRecoveryAttempts = b.maxRecoveryAttempts;
    }

    public static DualStreamConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public double getBufferThresholdSeconds() { return bufferThresholdSeconds; }
    public double getDriftThresholdSeconds() { return driftThresholdSeconds; }
    public double getHeavySyncThresholdSeconds() { return heavySyncThresholdSeconds; }
    public int getTickHz() { return tickHz; }
    public long getTickIntervalMs() { return 1000L / tickHz; }
    public long getHeavySyncCooldownBaseMs() { return heavySyncCooldownBaseMs; }
    public int getCooldownMaxExponent() { return cooldownMaxExponent; }
    public long getHeavySyncTimeoutMs() { return heavySyncTimeoutMs; }
    public int getMaxConsecutiveFailures() { return maxConsecutiveFailures; }
    public long getRecoverySpacingMs() { return recoverySpacingMs; }
    public int getMaxRecoveryAttempts() { return maxRecoveryAttempts; }

    /** base * 2^min(failures, maxExponent) */
    public long cooldownMs(int consecutiveFailures) {
        int exp = Math.min(Math.max(0, consecutiveFailures), cooldownMaxExponent);
        return heavySyncCooldownBaseMs << exp;
    }

    public static final class Builder {
        private double bufferThresholdSeconds = 0.3;
        private double driftThresholdSeconds = 0.15;
        private double heavySyncThresholdSeconds = 0.5;
        private int tickHz = 4;
        private long heavySyncCooldownBaseMs = 2000;
        private int cooldownMaxExponent = 4;
        private long heavySyncTimeoutMs = 3000;
        private int maxConsecutiveFailures = 5;
        private long recoverySpacingMs = 100;
        private int maxRecoveryAttempts = 3;

        public Builder bufferThresholdSeconds(double v) { this.bufferThresholdSeconds = v; return this; }
        public Builder driftThresholdSeconds(double v) { this.driftThresholdSeconds = v; return this; }
        public Builder heavySyncThresholdSeconds(double v) { this.heavySyncThresholdSeconds = v; return this; }
        public Builder tickHz(int v) { this.tickHz = v; return this; }
        public Builder heavySyncCooldownBaseMs(long v) { this.heavySyncCooldownBaseMs = v; return this; }
        public Builder cooldownMaxExponent(int v) { this.cooldownMaxExponent = v; return this; }
        public Builder heavySyncTimeoutMs(long v) { this.heavySyncTimeoutMs = v; return this; }
        public Builder maxConsecutiveFailures(int v) { this.maxConsecutiveFailures = v; return this; }
        public Builder recoverySpacingMs(long v) { this.recoverySpacingMs = v; return this; }
        public Builder maxRecoveryAttempts(int v) { this.maxRecoveryAttempts = v; return this; }

        public DualStreamConfig build() {
            if (tickHz <= 0) throw new IllegalArgumentException("tickHz must be positive");
            if (driftThresholdSeconds > heavySyncThresholdSeconds) {
                throw new IllegalArgumentException("driftThreshold must not exceed heavySyncThreshold");
            }
            if (maxConsecutiveFailures <= 0) throw new IllegalArgumentException("maxConsecutiveFailures must be positive");
            return new DualStreamConfig(this);
        }
    }
}
