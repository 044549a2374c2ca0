package com.stemtutor.core.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-local store for single-instance deployments and tests.
 * Expired records are dropped when read, and every {@value #SWEEP_INTERVAL}
 * writes a sweep removes the ones that are never read again.
 */
public class InMemoryRateLimitStore implements RateLimitStore {

    static final int SWEEP_INTERVAL = 1024;

    private record Entry(BucketRecord record, long expiresAt) {}

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicInteger writesSinceSweep = new AtomicInteger();
    private final Clock clock;

    public InMemoryRateLimitStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<BucketRecord> load(String identity) {
        Entry entry = entries.get(identity);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.expiresAt() <= clock.millis()) {
            entries.remove(identity, entry);
            return Optional.empty();
        }
        return Optional.of(entry.record());
    }

    @Override
    public void save(String identity, BucketRecord record, Duration ttl) {
        long now = clock.millis();
        entries.put(identity, new Entry(record, now + ttl.toMillis()));
        if (writesSinceSweep.incrementAndGet() >= SWEEP_INTERVAL) {
            writesSinceSweep.set(0);
            sweepExpired(now);
        }
    }

    @Override
    public void delete(String identity) {
        entries.remove(identity);
    }

    int size() {
        return entries.size();
    }

    private void sweepExpired(long now) {
        entries.values().removeIf(entry -> entry.expiresAt() <= now);
    }
}
