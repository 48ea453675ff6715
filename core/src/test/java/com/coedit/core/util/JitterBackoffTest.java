package com.coedit.core.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JitterBackoffTest {

    @Test
    void testDelayGrowsExponentially_WithoutJitter() {
        Duration base = Duration.ofMillis(100);
        Duration max = Duration.ofSeconds(10);

        assertEquals(100, JitterBackoff.next(0, base, max, Duration.ZERO).toMillis());
        assertEquals(200, JitterBackoff.next(1, base, max, Duration.ZERO).toMillis());
        assertEquals(800, JitterBackoff.next(3, base, max, Duration.ZERO).toMillis());
    }

    @Test
    void testDelayIsCapped() {
        assertEquals(10_000, JitterBackoff.next(40, Duration.ofMillis(100), Duration.ofSeconds(10), Duration.ZERO).toMillis());
    }

    @Test
    void testJitterStaysWithinBound() {
        for (int i = 0; i < 100; i++) {
            long delay = JitterBackoff.next(2, Duration.ofMillis(100), Duration.ofSeconds(10), Duration.ofMillis(50)).toMillis();
            assertTrue(delay >= 400 && delay <= 450, "delay out of range: " + delay);
        }
    }
}
