package com.stemtutor.core.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Shared store backed by one Redis hash per identity at {@code rate_limit:{identity}}
 * with fields {@code tokens} and {@code last_refill_at}.
 */
public class RedisRateLimitStore implements RateLimitStore {

    private static final Logger log = LoggerFactory.getLogger(RedisRateLimitStore.class);

    static final String KEY_PREFIX = "rate_limit:";
    static final String TOKENS = "tokens";
    static final String LAST_REFILL_AT = "last_refill_at";

    private final StringRedisTemplate redisTemplate;

    public RedisRateLimitStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<BucketRecord> load(String identity) {
        Map<Object, Object> fields;
        try {
            fields = redisTemplate.opsForHash().entries(key(identity));
        } catch (DataAccessException e) {
            throw new RateLimiterUnavailableException("Failed to read rate limit for " + identity, e);
        }
        if (fields == null || !fields.containsKey(TOKENS) || !fields.containsKey(LAST_REFILL_AT)) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BucketRecord(
                    Double.parseDouble(fields.get(TOKENS).toString()),
                    Long.parseLong(fields.get(LAST_REFILL_AT).toString())));
        } catch (NumberFormatException e) {
            log.warn("Discarding malformed rate limit record for {}: {}", identity, fields);
            return Optional.empty();
        }
    }

    @Override
    public void save(String identity, BucketRecord record, Duration ttl) {
        String key = key(identity);
        try {
            redisTemplate.opsForHash().putAll(key, Map.of(
                    TOKENS, Double.toString(record.tokens()),
                    LAST_REFILL_AT, Long.toString(record.lastRefillAt())));
            redisTemplate.expire(key, ttl);
        } catch (DataAccessException e) {
            throw new RateLimiterUnavailableException("Failed to write rate limit for " + identity, e);
        }
    }

    @Override
    public void delete(String identity) {
        try {
            redisTemplate.delete(key(identity));
        } catch (DataAccessException e) {
            throw new RateLimiterUnavailableException("Failed to reset rate limit for " + identity, e);
        }
    }

    static String key(String identity) {
        return KEY_PREFIX + identity;
    }
}
