package com.example.syncroom.client;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ReconnectBackoffTest {

    @Test
    public void delaysGrowUntilCapAndAttemptsAreBounded() {
        ReconnectBackoff backoff = new ReconnectBackoff(ReconnectPolicy.defaults());

        long prev = 0;
        int attempts = 0;
        long d;
        while ((d = backoff.nextDelayMs()) >= 0) {
            attempts++;
            assertTrue("never above cap", d <= 30_000L);
            if (prev < 30_000L) {
                assertTrue("strictly increasing below the cap", d > prev);
            } else {
                assertEquals(30_000L, d);
            }
            prev = d;
        }

        assertEquals(10, attempts);
        assertTrue(backoff.isExhausted());
        assertEquals(-1L, backoff.nextDelayMs());
    }

    @Test
    public void firstDelaysFollowPolicy() {
        ReconnectBackoff backoff = new ReconnectBackoff(ReconnectPolicy.defaults());

        assertEquals(1_000L, backoff.nextDelayMs());
        assertEquals(2_000L, backoff.nextDelayMs());
        assertEquals(4_000L, backoff.nextDelayMs());
    }

    @Test
    public void resetStartsOver() {
        ReconnectBackoff backoff = new ReconnectBackoff(new ReconnectPolicy(10, 100, 2.0, 2));
        backoff.nextDelayMs();
        backoff.nextDelayMs();
        assertTrue(backoff.isExhausted());

        backoff.reset();

        assertEquals(0, backoff.getAttempts());
        assertEquals(10L, backoff.nextDelayMs());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNonGrowingFactor() {
        new ReconnectPolicy(1000, 30_000, 1.0, 10);
    }
}
