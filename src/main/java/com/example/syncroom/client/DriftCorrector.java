package com.example.syncroom.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reconciles local playback against the room. Commands are obeyed literally; heartbeats are
 * advisory and corrected with a rate nudge unless the drift is large enough to warrant a seek.
 */
public class DriftCorrector {
    private static final Logger log = LoggerFactory.getLogger(DriftCorrector.class);

    private final PlaybackTarget target;
    private final LatencyEstimator latency;
    private final DriftThresholds thresholds;

    private volatile Correction last = Correction.none();

    public DriftCorrector(PlaybackTarget target, LatencyEstimator latency, DriftThresholds thresholds) {
        this.target = target;
        this.latency = latency;
        this.thresholds = thresholds;
    }

    /**
     * Applies play / pause / seek. A live item commanded to position 0 stays at the live edge.
     */
    public void onCommand(String type, double timestamp, boolean live) {
        boolean keepLiveEdge = live && timestamp == 0;
        switch (type) {
            case "play":
                if (!keepLiveEdge) target.seek(timestamp);
                target.play();
                break;
            case "pause":
                target.pause();
                if (!keepLiveEdge) target.seek(timestamp);
                break;
            case "seek":
                if (!keepLiveEdge) target.seek(timestamp);
                break;
            default:
                throw new IllegalArgumentException("not a command: " + type);
        }
        target.setPlaybackRate(1.0);
    }

    /**
     * Cold start from a full snapshot. Seeks only when local time is far from the snapshot so a
     * rejoin does not cause a visible jump.
     */
    public void onSync(double timestamp, boolean playing, boolean live) {
        if (playing) {
            target.play();
        } else {
            target.pause();
        }
        if (!live || timestamp != 0) {
            double diff = Math.abs(target.getCurrentTime() - timestamp);
            if (diff > thresholds.getSnapshotSeekSeconds()) {
                target.seek(timestamp);
            }
        }
        target.setPlaybackRate(1.0);
    }

    /**
     * Evaluated only while local playback is running.
     */
    public Correction onHeartbeat(double timestamp, boolean roomPlaying) {
        if (!roomPlaying || !target.isPlaying()) return Correction.none();

        double local = target.getCurrentTime();
        double compensated = timestamp + latency.getLatencySeconds();
        Correction c = evaluate(local, compensated, thresholds);

        if (c.getAction() == Correction.Action.SEEK) {
            log.debug("hard resync. drift={} target={}", c.getDrift(), compensated);
            target.seek(compensated);
        }
        target.setPlaybackRate(c.getRate());
        last = c;
        return c;
    }

    public Correction lastCorrection() {
        return last;
    }

    static Correction evaluate(double local, double compensated, DriftThresholds t) {
        double drift = compensated - local;
        if (Math.abs(drift) > t.getHardSeekSeconds()) {
            return new Correction(Correction.Action.SEEK, local, compensated, drift, 1.0);
        }
        double rate;
        if (drift > t.getRateBandSeconds()) {
            rate = t.getCatchUpRate();
        } else if (drift < -t.getRateBandSeconds()) {
            rate = t.getSlowDownRate();
        } else {
            rate = 1.0;
        }
        return new Correction(Correction.Action.RATE, local, compensated, drift, rate);
    }
}
