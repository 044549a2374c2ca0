package com.stemtutor.core.ratelimit;

/**
 * Stored state of one identity's token bucket.
 *
 * @param tokens        tokens available at {@code lastRefillAt}, between 0 and the tier limit
 * @param lastRefillAt  epoch millis of the last refill
 */
public record BucketRecord(double tokens, long lastRefillAt) {}
