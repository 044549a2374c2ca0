package com.stemtutor.core.ratelimit;

import com.stemtutor.core.metrics.TutorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Per-identity token bucket with continuous refill.
 * <p>
 * A bucket holds at most {@code limit} tokens and refills at
 * {@code limit / window} tokens per second. Each admitted request consumes one
 * token. A missing record is a full bucket.
 * <p>
 * Within one process, operations on the same identity are serialized through
 * lock striping. Across processes sharing a Redis store the read-then-write is
 * not atomic: concurrent requests for one identity landing on different
 * instances can each see the same token count and be admitted together, so a
 * burst may over-admit by up to one token per instance.
 * <p>
 * When the store is unreachable, {@link #check} and {@link #quota} fail open:
 * the request is allowed and the degradation is logged and counted.
 */
@Service
public class TokenBucketRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);

    private static final int LOCK_STRIPES = 64;

    private final RateLimitStore store;
    private final TierResolver tierResolver;
    private final RateLimitProperties properties;
    private final TutorMetrics metrics;
    private final Clock clock;
    private final Object[] locks = new Object[LOCK_STRIPES];

    public TokenBucketRateLimiter(RateLimitStore store, TierResolver tierResolver,
                                  RateLimitProperties properties, TutorMetrics metrics, Clock clock) {
        this.store = store;
        this.tierResolver = tierResolver;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new Object();
        }
    }

    /**
     * Consumes one token for {@code identity} if one is available.
     */
    public RateLimitDecision check(String identity) {
        Tier tier = tierResolver.resolve(identity);
        int limit = properties.limitFor(tier);
        int window = properties.getWindowSeconds();

        try {
            synchronized (lockFor(identity)) {
                long now = clock.millis();
                double tokens = refill(store.load(identity), limit, window, now);

                RateLimitDecision decision;
                if (tokens >= 1.0) {
                    tokens -= 1.0;
                    decision = new RateLimitDecision(true, (int) Math.floor(tokens), limit, 0, tier, false);
                } else {
                    long resetIn = (long) Math.ceil((1.0 - tokens) * window / limit);
                    decision = new RateLimitDecision(false, 0, limit, resetIn, tier, false);
                }
                store.save(identity, new BucketRecord(tokens, now), ttl(window));

                metrics.recordRateLimitDecision(tier.name(), decision.allowed());
                if (!decision.allowed()) {
                    log.info("Rate limit hit for {} ({}), reset in {}s", identity, tier, decision.resetInSeconds());
                }
                return decision;
            }
        } catch (RateLimiterUnavailableException e) {
            log.warn("Rate limiter degraded, allowing request for {}: {}", identity, e.getMessage());
            metrics.recordRateLimiterDegraded("check");
            return new RateLimitDecision(true, limit, limit, 0, tier, true);
        }
    }

    /**
     * Reports the current allowance without consuming a token. {@code resetInSeconds}
     * is the time until the bucket is full again.
     */
    public QuotaStatus quota(String identity) {
        Tier tier = tierResolver.resolve(identity);
        int limit = properties.limitFor(tier);
        int window = properties.getWindowSeconds();

        try {
            double tokens = refill(store.load(identity), limit, window, clock.millis());
            long resetIn = (long) Math.ceil((limit - tokens) * window / limit);
            return new QuotaStatus((int) Math.floor(tokens), limit, window, resetIn, tier);
        } catch (RateLimiterUnavailableException e) {
            log.warn("Rate limiter degraded, reporting full quota for {}: {}", identity, e.getMessage());
            metrics.recordRateLimiterDegraded("quota");
            return new QuotaStatus(limit, limit, window, 0, tier);
        }
    }

    /**
     * Drops the stored bucket so the next check starts full.
     *
     * @throws RateLimiterUnavailableException if the store is unreachable
     */
    public void reset(String identity) {
        synchronized (lockFor(identity)) {
            store.delete(identity);
        }
        log.info("Rate limit reset for {}", identity);
    }

    /**
     * Tokens available at {@code now}. Elapsed time is multiplied by the limit
     * before dividing by the window so whole windows refill exactly.
     */
    static double refill(Optional<BucketRecord> stored, int limit, int windowSeconds, long now) {
        if (stored.isEmpty()) {
            return limit;
        }
        var record = stored.get();
        long elapsedMs = Math.max(0, now - record.lastRefillAt());
        double refilled = record.tokens() + (elapsedMs * (double) limit) / (windowSeconds * 1000.0);
        return Math.max(0.0, Math.min(limit, refilled));
    }

    private static Duration ttl(int windowSeconds) {
        return Duration.ofSeconds(2L * windowSeconds);
    }

    private Object lockFor(String identity) {
        return locks[Math.floorMod(identity.hashCode(), LOCK_STRIPES)];
    }
}
