package com.neoforge.orchestrator.agent;

/**
 * How an engine run ended. None of these statuses is an error by itself; the
 * pipeline decides by checking the phase's artifact.
 */
public record RunOutcome(
        Status status,
        String text,
        int    productiveCalls,
        int    rateLimitHits,
        int    malformedRetries) {

    public enum Status {
        /** The model answered without tool calls; {@code text} is its answer. */
        COMPLETED,
        /** The productive-call budget ran out. */
        MAX_CALLS_REACHED,
        /** The rate-limit-hit budget ran out. */
        RATE_LIMITED
    }

    public static final String MAX_CALLS_SENTINEL = "Agent reached max tool calls.";

    public static String rateLimitedSentinel(int hits) {
        return "Agent aborted: rate limit hit " + hits + " times.";
    }

    public boolean completed() {
        return status == Status.COMPLETED;
    }
}
