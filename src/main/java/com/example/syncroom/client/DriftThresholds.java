package com.example.syncroom.client;

/**
 * Tuning of the drift corrector. Immutable; use the withers to derive variants.
 */
public final class DriftThresholds {
    private final double hardSeekSeconds;
    private final double rateBandSeconds;
    private final double catchUpRate;
    private final double slowDownRate;
    private final double snapshotSeekSeconds;

    public DriftThresholds(double hardSeekSeconds, double rateBandSeconds, double catchUpRate,
                           double slowDownRate, double snapshotSeekSeconds) {
        if (rateBandSeconds < 0 || hardSeekSeconds < rateBandSeconds) {
            throw new IllegalArgumentException("need 0 <= rateBand <= hardSeek");
        }
        this.hardSeekSeconds = hardSeekSeconds;
        this.rateBandSeconds = rateBandSeconds;
        this.catchUpRate = catchUpRate;
        this.slowDownRate = slowDownRate;
        this.snapshotSeekSeconds = snapshotSeekSeconds;
    }

    public static DriftThresholds defaults() {
        return new DriftThresholds(3.0, 0.5, 1.05, 0.95, 4.0);
    }

    public double getHardSeekSeconds() { return hardSeekSeconds; }
    public double getRateBandSeconds() { return rateBandSeconds; }
    public double getCatchUpRate() { return catchUpRate; }
    public double getSlowDownRate() { return slowDownRate; }

    /** A full sync only seeks when local time is further than this from the snapshot. */
    public double getSnapshotSeekSeconds() { return snapshotSeekSeconds; }

    public DriftThresholds withHardSeekSeconds(double v) {
        return new DriftThresholds(v, rateBandSeconds, catchUpRate, slowDownRate, snapshotSeekSeconds);
    }

    public DriftThresholds withRateBandSeconds(double v) {
        return new DriftThresholds(hardSeekSeconds, v, catchUpRate, slowDownRate, snapshotSeekSeconds);
    }

    public DriftThresholds withRates(double catchUp, double slowDown) {
        return new DriftThresholds(hardSeekSeconds, rateBandSeconds, catchUp, slowDown, snapshotSeekSeconds);
    }

    public DriftThresholds withSnapshotSeekSeconds(double v) {
        return new DriftThresholds(hardSeekSeconds, rateBandSeconds, catchUpRate, slowDownRate, v);
    }
}
