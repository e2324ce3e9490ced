package com.example.syncroom.client;

import java.util.function.LongSupplier;

/**
 * Smoothed one-way latency from ping/pong round trips: an EWMA of RTT/2. The first sample is
 * taken as is so the estimate does not warm up from zero.
 */
public class LatencyEstimator {
    static final double ALPHA = 0.2;

    private final LongSupplier clockMs;

    private double latencyMs;   // guarded by this
    private boolean seeded;     // guarded by this

    public LatencyEstimator(LongSupplier clockMs) {
        this.clockMs = clockMs;
    }

    /** Timestamp to put in an outbound ping. */
    public long probeTime() {
        return clockMs.getAsLong();
    }

    /**
     * @param clientSendTimeMs the value echoed back by the server's pong
     */
    public synchronized double onPong(long clientSendTimeMs) {
        long rtt = Math.max(0L, clockMs.getAsLong() - clientSendTimeMs);
        return addSample(rtt / 2.0);
    }

    synchronized double addSample(double halfRttMs) {
        double sample = Math.max(0.0, halfRttMs);
        if (!seeded) {
            latencyMs = sample;
            seeded = true;
        } else {
            latencyMs = latencyMs * (1.0 - ALPHA) + sample * ALPHA;
        }
        return latencyMs;
    }

    public synchronized boolean hasSample() {
        return seeded;
    }

    public synchronized double getLatencyMs() {
        return latencyMs;
    }

    public synchronized double getLatencySeconds() {
        return latencyMs / 1000.0;
    }

    /** Forget everything, e.g. after a reconnect to a different server. */
    public synchronized void reset() {
        latencyMs = 0;
        seeded = false;
    }
}
