package com.neoforge.orchestrator.agent;

import java.time.Duration;

/**
 * Budgets and request settings for one engine run.
 *
 * @param maxProductiveCalls  API calls that returned a usable response
 * @param maxRateLimitHits    rate-limit rejections, counted separately from productive calls
 * @param maxMalformedRetries corrective retries after an undecodable tool call
 * @param backoffBase         wait after the first full-pool exhaustion; doubles on each further one
 * @param maxJitter           upper bound of the random addend to each wait
 * @param temperature         sampling temperature sent with every request
 */
public record EngineLimits(
        int      maxProductiveCalls,
        int      maxRateLimitHits,
        int      maxMalformedRetries,
        Duration backoffBase,
        Duration maxJitter,
        double   temperature) {

    public EngineLimits {
        if (maxProductiveCalls < 1 || maxRateLimitHits < 1 || maxMalformedRetries < 0) {
            throw new IllegalArgumentException("Engine budgets must be positive");
        }
        if (maxJitter.compareTo(backoffBase) >= 0) {
            throw new IllegalArgumentException("maxJitter must be smaller than backoffBase");
        }
    }

    public static EngineLimits defaults() {
        return new EngineLimits(25, 30, 2, Duration.ofSeconds(20), Duration.ofSeconds(5), 0.3);
    }
}
