package com.neoforge.orchestrator.agent;

import java.time.Duration;
import java.util.function.DoubleSupplier;

/**
 * Wait after the whole credential pool has been rate-limited:
 * {@code min(base * 2^(cycle-1) + jitter, MAX_DELAY)}, jitter uniform in {@code [0, maxJitter)}.
 *
 * Jitter stays below base, so consecutive cycles wait strictly longer until
 * the wait reaches {@link #MAX_DELAY}; from then on every wait is exactly
 * {@code MAX_DELAY}. With the default 20s base that happens at cycle 9.
 */
public class BackoffPolicy {

    /** Upper bound of a single wait. */
    public static final Duration MAX_DELAY = Duration.ofHours(1);

    private final Duration       base;
    private final Duration       maxJitter;
    private final DoubleSupplier unitRandom;

    /**
     * @param unitRandom source of values in [0, 1)
     */
    public BackoffPolicy(Duration base, Duration maxJitter, DoubleSupplier unitRandom) {
        if (base.plus(maxJitter).compareTo(MAX_DELAY) > 0) {
            throw new IllegalArgumentException("backoff base plus jitter must not exceed " + MAX_DELAY);
        }
        this.base       = base;
        this.maxJitter  = maxJitter;
        this.unitRandom = unitRandom;
    }

    /**
     * @param exhaustionCycle 1 for the first full exhaustion since the last successful call
     */
    public Duration delayFor(int exhaustionCycle) {
        if (exhaustionCycle < 1) {
            throw new IllegalArgumentException("exhaustionCycle starts at 1, got " + exhaustionCycle);
        }
        long capMillis  = MAX_DELAY.toMillis();
        long baseMillis = base.toMillis();
        int  shift      = exhaustionCycle - 1;
        // shifting past the cap could overflow
        if (shift >= Long.SIZE - 1 || baseMillis > (capMillis >> shift)) {
            return MAX_DELAY;
        }
        long jitterMillis = (long) (maxJitter.toMillis() * unitRandom.getAsDouble());
        return Duration.ofMillis(Math.min(capMillis, (baseMillis << shift) + jitterMillis));
    }
}
