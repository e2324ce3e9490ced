package com.example.syncroom.client.dual;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Wall-clock driver for {@link DualStreamSynchronizer#tick()}. Keeps ticking while the view is
 * hidden, unlike a frame callback.
 */
public class DualStreamSyncLoop {
    private static final Logger log = LoggerFactory.getLogger(DualStreamSyncLoop.class);

    private final ScheduledExecutorService executor;
    private final DualStreamSynchronizer synchronizer;
    private final long intervalMs;

    private ScheduledFuture<?> task; // guarded by this

    public DualStreamSyncLoop(ScheduledExecutorService executor, DualStreamSynchronizer synchronizer, DualStreamConfig config) {
        this.executor = executor;
        this.synchronizer = synchronizer;
        this.intervalMs = config.getTickIntervalMs();
    }

    public synchronized void start() {
        if (task != null) return;
        task = executor.scheduleAtFixedRate(this::safeTick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.debug("dual stream loop started. intervalMs={}", intervalMs);
    }

    public synchronized void stop() {
        if (task == null) return;
        task.cancel(false);
        task = null;
        log.debug("dual stream loop stopped");
    }

    public synchronized boolean isRunning() {
        return task != null;
    }

    // an exception escaping a periodic task cancels it for good
    private void safeTick() {
        try {
            synchronizer.tick();
        } catch (RuntimeException e) {
            log.warn("dual stream tick failed: {}", e.toString());
        }
    }
}
