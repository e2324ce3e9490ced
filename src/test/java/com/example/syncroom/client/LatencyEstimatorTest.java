package com.example.syncroom.client;

import com.example.syncroom.support.FakeTime;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class LatencyEstimatorTest {

    @Test
    public void firstSampleSeedsEstimateDirectly() {
        FakeTime time = new FakeTime(0L);
        LatencyEstimator latency = new LatencyEstimator(time::now);
        assertFalse(latency.hasSample());

        long sent = latency.probeTime();
        time.advance(300L);
        latency.onPong(sent);

        assertTrue(latency.hasSample());
        assertEquals(150.0, latency.getLatencyMs(), 1e-9);
        assertEquals(0.15, latency.getLatencySeconds(), 1e-9);
    }

    @Test
    public void laterSamplesAreSmoothed() {
        LatencyEstimator latency = new LatencyEstimator(() -> 0L);
        latency.addSample(100.0);

        latency.addSample(200.0);

        assertEquals(100.0 * 0.8 + 200.0 * 0.2, latency.getLatencyMs(), 1e-9);
    }

    @Test
    public void pongFromTheFutureNeverMakesLatencyNegative() {
        FakeTime time = new FakeTime(1_000L);
        LatencyEstimator latency = new LatencyEstimator(time::now);

        latency.onPong(5_000L);

        assertEquals(0.0, latency.getLatencyMs(), 1e-9);
    }

    @Test
    public void resetForgetsSeed() {
        LatencyEstimator latency = new LatencyEstimator(() -> 0L);
        latency.addSample(80.0);
        latency.reset();

        latency.addSample(20.0);

        assertEquals(20.0, latency.getLatencyMs(), 1e-9);
    }
}
