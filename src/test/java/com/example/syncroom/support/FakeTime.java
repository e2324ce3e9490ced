package com.example.syncroom.support;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicLong;

/** Manually advanced clock, usable as a {@link Clock} or as {@code time::now}. */
public final class FakeTime extends Clock {
    private final AtomicLong nowMs;

    public FakeTime(long initialMs) {
        this.nowMs = new AtomicLong(initialMs);
    }

    public long now() {
        return nowMs.get();
    }

    public void advance(long deltaMs) {
        nowMs.addAndGet(deltaMs);
    }

    @Override
    public long millis() {
        return nowMs.get();
    }

    @Override
    public Instant instant() {
        return Instant.ofEpochMilli(nowMs.get());
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }
}
