package com.example.syncroom.client;

/**
 * Outcome of one heartbeat evaluation: the observation it was based on and what was done.
 */
public final class Correction {

    public enum Action {
        /** Not evaluated: local playback is paused. */
        NONE,
        /** Hard seek to the compensated position, rate back to 1.0. */
        SEEK,
        /** Rate set; 1.0 means converged. */
        RATE
    }

    private static final Correction NONE = new Correction(Action.NONE, 0, 0, 0, 1.0);

    private final Action action;
    private final double localTime;
    private final double compensatedTime;
    private final double drift;
    private final double rate;

    public Correction(Action action, double localTime, double compensatedTime, double drift, double rate) {
        this.action = action;
        this.localTime = localTime;
        this.compensatedTime = compensatedTime;
        this.drift = drift;
        this.rate = rate;
    }

    public static Correction none() {
        return NONE;
    }

    public Action getAction() { return action; }
    public double getLocalTime() { return localTime; }
    public double getCompensatedTime() { return compensatedTime; }

    /** compensated - local; positive means local playback is behind. */
    public double getDrift() { return drift; }

    public double getRate() { return rate; }

    @Override
    public String toString() {
        return "Correction{" + action + ", drift=" + drift + ", rate=" + rate + "}";
    }
}
