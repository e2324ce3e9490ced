package com.example.syncroom.client;

public final class ReconnectPolicy {
    private final long initialDelayMs;
    private final long maxDelayMs;
    private final double factor;
    private final int maxAttempts;

    public ReconnectPolicy(long initialDelayMs, long maxDelayMs, double factor, int maxAttempts) {
        if (initialDelayMs <= 0 || maxDelayMs < initialDelayMs) {
            throw new IllegalArgumentException("need 0 < initialDelay <= maxDelay");
        }
        if (factor <= 1.0) throw new IllegalArgumentException("factor must be > 1");
        if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be positive");
        this.initialDelayMs = initialDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.factor = factor;
        this.maxAttempts = maxAttempts;
    }

    /** 1s doubling to 30s, 10 attempts. */
    public static ReconnectPolicy defaults() {
        return new ReconnectPolicy(1000, 30_000, 2.0, 10);
    }

    public long getInitialDelayMs() { return initialDelayMs; }
    public long getMaxDelayMs() { return maxDelayMs; }
    public double getFactor() { return factor; }
    public int getMaxAttempts() { return maxAttempts; }

    /** Delay before attempt {@code n} (0-based), capped. */
    public long delayForAttempt(int n) {
        double d = initialDelayMs * Math.pow(factor, n);
        return d >= maxDelayMs ? maxDelayMs : (long) d;
    }
}
