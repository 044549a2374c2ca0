package com.stemtutor.core.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Chooses the rate-limit store from {@code stemtutor.rate-limit.store}.
 */
@Configuration
public class RateLimitStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(RateLimitStoreConfig.class);

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock rateLimitClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(prefix = "stemtutor.rate-limit", name = "store", havingValue = "redis")
    public RateLimitStore redisRateLimitStore(StringRedisTemplate redisTemplate) {
        log.info("Rate limits shared through Redis");
        return new RedisRateLimitStore(redisTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(RateLimitStore.class)
    public RateLimitStore inMemoryRateLimitStore(Clock clock) {
        log.info("Rate limits kept in memory (per instance)");
        return new InMemoryRateLimitStore(clock);
    }
}
