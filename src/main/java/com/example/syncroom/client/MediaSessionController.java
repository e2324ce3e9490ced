package com.example.syncroom.client;

import com.example.syncroom.client.dual.DualStreamConfig;
import com.example.syncroom.client.dual.DualStreamSyncLoop;
import com.example.syncroom.client.dual.DualStreamSynchronizer;
import com.example.syncroom.client.dual.SyncNoticeListener;
import com.example.syncroom.client.media.MediaElement;
import com.example.syncroom.client.media.MediaResolver;
import com.example.syncroom.client.media.QualitySwitchNotifier;
import com.example.syncroom.client.media.ResolvedMedia;
import com.example.syncroom.client.media.SingleStreamPlayback;
import com.example.syncroom.client.media.StreamType;
import com.example.syncroom.model.RoomItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.LongSupplier;

/**
 * Glues room events to local playback: resolves the current item, picks single or dual-stream
 * playback, and routes commands and heartbeats to a drift corrector over the active target.
 */
public class MediaSessionController implements RoomEventListener {
    private static final Logger log = LoggerFactory.getLogger(MediaSessionController.class);

    private final MediaResolver resolver;
    private final QualitySwitchNotifier qualityNotifier;
    private final LatencyEstimator latency;
    private final DriftThresholds thresholds;

    private final MediaElement audio;
    private final SingleStreamPlayback single;
    private final DualStreamSynchronizer dual;
    private final DualStreamSyncLoop dualLoop;

    private PlaybackTarget active;
    private DriftCorrector corrector;
    private RoomItem currentItem;
    private ResolvedMedia currentMedia;
    private String preferredQuality;
    private boolean live;

    public MediaSessionController(MediaResolver resolver,
                                  QualitySwitchNotifier qualityNotifier,
                                  MediaElement video,
                                  MediaElement audio,
                                  LatencyEstimator latency,
                                  DriftThresholds thresholds,
                                  DualStreamConfig dualConfig,
                                  ScheduledExecutorService loopExecutor,
                                  LongSupplier clockMs,
                                  SyncNoticeListener noticeListener) {
        this.resolver = resolver;
        this.qualityNotifier = qualityNotifier;
        this.latency = latency;
        this.thresholds = thresholds;
        this.audio = audio;
        this.single = new SingleStreamPlayback(video);
        this.dual = new DualStreamSynchronizer(video, audio, dualConfig, clockMs, loopExecutor, noticeListener);
        this.dualLoop = new DualStreamSyncLoop(loopExecutor, dual, dualConfig);
        activate(single);
    }

    // ---------- room events ----------

    @Override
    public synchronized void onSync(SyncPayload sync) {
        RoomItem item = sync.getCurrentItem();
        if (item != null && !sameItem(item, currentItem)) {
            load(item, preferredQuality);
        }
        corrector.onSync(sync.getTimestamp(), sync.isPlaying(), live);
    }

    @Override
    public synchronized void onCommand(String type, double timestamp, boolean playing, boolean commandLive) {
        corrector.onCommand(type, timestamp, commandLive || live);
    }

    @Override
    public synchronized void onHeartbeat(double timestamp, boolean playing) {
        Correction c = corrector.onHeartbeat(timestamp, playing);
        if (c.getAction() == Correction.Action.SEEK) {
            log.info("hard resync to room. drift={}", c.getDrift());
        }
    }

    @Override
    public synchronized void onSetItem(RoomItem item, double timestamp, boolean playing) {
        if (item == null) {
            unload();
            return;
        }
        load(item, preferredQuality);
        corrector.onSync(timestamp, playing, live);
    }

    @Override
    public void onConnectionLost(int attempts) {
        log.warn("room connection lost, playback continues unsynchronized. attempts={}", attempts);
    }

    // ---------- viewer controls ----------

    /**
     * Reloads the current item at another quality, keeping position and play state.
     */
    public synchronized void switchQuality(String quality) {
        preferredQuality = quality;
        if (currentItem == null) return;
        double at = active.getCurrentTime();
        boolean wasPlaying = active.isPlaying();
        qualityNotifier.onQualitySwitch(currentItem.getOriginalUrl(), quality);
        load(currentItem, quality);
        active.seek(at);
        if (wasPlaying) active.play();
    }

    public synchronized void onVisibilityChanged(boolean visible) {
        if (active == dual) dual.onVisibilityChanged(visible);
    }

    public synchronized PlaybackTarget activeTarget() {
        return active;
    }

    public synchronized ResolvedMedia currentMedia() {
        return currentMedia;
    }

    public synchronized void shutdown() {
        dualLoop.stop();
    }

    // ---------- loading ----------

    private void load(RoomItem item, String quality) {
        ResolvedMedia media;
        try {
            media = resolver.resolve(item.getOriginalUrl(), quality);
        } catch (IOException | RuntimeException e) {
            log.warn("could not resolve item. url={} cause={}", item.getOriginalUrl(), e.toString());
            return;
        }
        currentItem = item;
        currentMedia = media;
        live = item.isLive() || media.isLive();

        if (media.getStreamType() == StreamType.DUAL) {
            single.pause();
            dual.load(media.getVideoUrl(), media.getAudioUrl());
            activate(dual);
            dualLoop.start();
        } else {
            dualLoop.stop();
            audio.pause();
            audio.load(null);
            single.load(media.getStreamUrl());
            activate(single);
        }
        log.info("loaded item. id={} streamType={} quality={} live={}",
                item.getId(), media.getStreamType(), media.getQuality(), live);
    }

    private void unload() {
        dualLoop.stop();
        active.pause();
        currentItem = null;
        currentMedia = null;
        live = false;
    }

    private void activate(PlaybackTarget target) {
        active = target;
        corrector = new DriftCorrector(target, latency, thresholds);
    }

    private static boolean sameItem(RoomItem a, RoomItem b) {
        if (b == null) return false;
        if (a.getId() != null && b.getId() != null) return a.getId().equals(b.getId());
        return Objects.equals(a.getOriginalUrl(), b.getOriginalUrl());
    }
}
