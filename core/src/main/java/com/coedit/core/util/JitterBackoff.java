package com.coedit.core.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Jittered exponential backoff for re-establishing bus subscriptions.
 * <p>
 * <b>Formula:</b> {@code t = min(max, base * 2^attempt) + uniform(0, jitterMax)}
 * </p>
 * <p>
 * Jitter keeps a fleet of instances from hammering the broker in lockstep after an outage.
 * </p>
 */
public final class JitterBackoff {
    private JitterBackoff() {
    }

    /**
     * Computes the delay before the given retry attempt.
     *
     * @param attempt   Retry attempt number (0-based)
     * @param base      Base delay
     * @param max       Maximum delay before jitter
     * @param jitterMax Maximum jitter to add
     * @return delay
     */
    public static Duration next(long attempt, Duration base, Duration max, Duration jitterMax) {
        long expMs = base.toMillis() * (1L << Math.min(attempt, 20));
        long cappedMs = Math.min(expMs, max.toMillis());
        long jitterMs = jitterMax.isZero() ? 0 : ThreadLocalRandom.current().nextLong(jitterMax.toMillis() + 1);
        return Duration.ofMillis(cappedMs + jitterMs);
    }

    /**
     * Defaults used by the bus: 500ms base, 30s cap, up to 1s jitter.
     *
     * @param attempt Retry attempt number (0-based)
     * @return delay
     */
    public static Duration next(long attempt) {
        return next(attempt, Duration.ofMillis(500), Duration.ofSeconds(30), Duration.ofSeconds(1));
    }
}
