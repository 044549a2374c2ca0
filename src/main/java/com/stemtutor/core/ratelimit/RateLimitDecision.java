package com.stemtutor.core.ratelimit;

/**
 * Outcome of a rate-limit check. {@code degraded} marks a decision taken
 * without the store, which always allows.
 */
public record RateLimitDecision(
        boolean allowed,
        int remaining,
        int limit,
        long resetInSeconds,
        Tier tier,
        boolean degraded
) {}
