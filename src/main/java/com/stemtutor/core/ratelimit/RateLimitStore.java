package com.stemtutor.core.ratelimit;

import java.time.Duration;
import java.util.Optional;

/**
 * Persistence for token-bucket records, keyed by identity.
 * Implementations raise {@link RateLimiterUnavailableException} when the backing store fails.
 */
public interface RateLimitStore {

    Optional<BucketRecord> load(String identity);

    /**
     * Writes the record; it expires after {@code ttl} without further writes.
     */
    void save(String identity, BucketRecord record, Duration ttl);

    void delete(String identity);
}
