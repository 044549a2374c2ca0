package com.stemtutor.core.ratelimit;

import com.stemtutor.core.metrics.TutorMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class TokenBucketRateLimiterTest {

    private MutableClock clock;
    private RateLimitProperties props;
    private SimpleMeterRegistry registry;
    private TokenBucketRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        props = new RateLimitProperties();
        props.setProIdentities(List.of("pro-user"));
        registry = new SimpleMeterRegistry();
        limiter = limiterWith(new InMemoryRateLimitStore(clock));
    }

    private TokenBucketRateLimiter limiterWith(RateLimitStore store) {
        return new TokenBucketRateLimiter(store, new ConfiguredTierResolver(props), props,
                new TutorMetrics(registry), clock);
    }

    // ── check ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("check")
    class Check {

        @Test
        @DisplayName("Allows exactly the tier limit within one window, then rejects")
        void allowsLimitThenRejects() {
            for (int i = 0; i < 5; i++) {
                var decision = limiter.check("alice");
                assertTrue(decision.allowed(), "Request " + (i + 1) + " should pass");
                assertEquals(4 - i, decision.remaining());
            }

            var rejected = limiter.check("alice");
            assertFalse(rejected.allowed());
            assertEquals(0, rejected.remaining());
            assertEquals(5, rejected.limit());
            assertTrue(rejected.resetInSeconds() > 0);
            assertEquals(12, rejected.resetInSeconds(), "One token refills every 60/5 seconds");
        }

        @Test
        @DisplayName("Tokens refill continuously with elapsed time")
        void refillsOverTime() {
            for (int i = 0; i < 5; i++) {
                limiter.check("bob");
            }
            assertFalse(limiter.check("bob").allowed());

            clock.advance(Duration.ofSeconds(12));
            assertTrue(limiter.check("bob").allowed());
            assertFalse(limiter.check("bob").allowed());
        }

        @Test
        @DisplayName("A full window restores the whole bucket")
        void fullWindowRestores() {
            for (int i = 0; i < 5; i++) {
                limiter.check("carol");
            }
            clock.advance(Duration.ofSeconds(60));

            assertEquals(5, limiter.quota("carol").remaining());
        }

        @Test
        @DisplayName("Identities have independent buckets")
        void independentBuckets() {
            for (int i = 0; i < 5; i++) {
                limiter.check("dave");
            }
            assertFalse(limiter.check("dave").allowed());
            assertTrue(limiter.check("erin").allowed());
        }

        @Test
        @DisplayName("PRO identities get the PRO limit")
        void proTier() {
            var decision = limiter.check("pro-user");

            assertEquals(Tier.PRO, decision.tier());
            assertEquals(50, decision.limit());
            assertEquals(49, decision.remaining());
        }

        @Test
        @DisplayName("Concurrent checks on one identity never over-admit")
        void concurrentChecks() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(8);
            var start = new CountDownLatch(1);
            var allowed = new AtomicInteger();
            try {
                for (int i = 0; i < 40; i++) {
                    pool.submit(() -> {
                        start.await();
                        if (limiter.check("burst").allowed()) {
                            allowed.incrementAndGet();
                        }
                        return null;
                    });
                }
                start.countDown();
                pool.shutdown();
                assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
            } finally {
                pool.shutdownNow();
            }
            assertEquals(5, allowed.get());
        }

        @Test
        @DisplayName("Records allowed and rejected decisions by tier")
        void recordsMetrics() {
            for (int i = 0; i < 6; i++) {
                limiter.check("frank");
            }
            assertEquals(5.0, registry.counter("stemtutor.ratelimit.decisions", "tier", "FREE", "result", "allowed").count());
            assertEquals(1.0, registry.counter("stemtutor.ratelimit.decisions", "tier", "FREE", "result", "rejected").count());
        }
    }

    // ── quota and reset ─────────────────────────────────────────────

    @Nested
    @DisplayName("quota and reset")
    class QuotaAndReset {

        @Test
        @DisplayName("quota does not consume tokens")
        void quotaIsReadOnly() {
            limiter.check("gina");
            assertEquals(4, limiter.quota("gina").remaining());
            assertEquals(4, limiter.quota("gina").remaining());
        }

        @Test
        @DisplayName("quota of an unseen identity is a full bucket")
        void unseenIdentity() {
            var quota = limiter.quota("new");

            assertEquals(5, quota.remaining());
            assertEquals(5, quota.limit());
            assertEquals(60, quota.windowSeconds());
            assertEquals(0, quota.resetInSeconds());
            assertEquals(Tier.FREE, quota.tier());
        }

        @Test
        @DisplayName("reset restores a full bucket")
        void resetRestores() {
            for (int i = 0; i < 5; i++) {
                limiter.check("hank");
            }
            limiter.reset("hank");

            assertEquals(5, limiter.quota("hank").remaining());
            assertTrue(limiter.check("hank").allowed());
        }
    }

    // ── store failures ──────────────────────────────────────────────

    @Nested
    @DisplayName("store failures")
    class StoreFailures {

        private RateLimitStore failingStore() {
            var store = mock(RateLimitStore.class);
            var error = new RateLimiterUnavailableException("connection refused", null);
            when(store.load(anyString())).thenThrow(error);
            doThrow(error).when(store).save(anyString(), any(), any());
            doThrow(error).when(store).delete(anyString());
            return store;
        }

        @Test
        @DisplayName("check fails open and flags the decision as degraded")
        void checkFailsOpen() {
            var decision = limiterWith(failingStore()).check("ivy");

            assertTrue(decision.allowed());
            assertTrue(decision.degraded());
            assertEquals(1.0, registry.counter("stemtutor.ratelimit.degraded", "operation", "check").count());
        }

        @Test
        @DisplayName("quota reports a full bucket when the store is down")
        void quotaFailsOpen() {
            assertEquals(5, limiterWith(failingStore()).quota("ivy").remaining());
        }

        @Test
        @DisplayName("reset propagates the store failure")
        void resetPropagates() {
            var failing = limiterWith(failingStore());
            assertThrows(RateLimiterUnavailableException.class, () -> failing.reset("ivy"));
        }
    }

    // ── refill ──────────────────────────────────────────────────────

    @Test
    @DisplayName("refill caps at the limit and never goes negative")
    void refillBounds() {
        assertEquals(5.0, TokenBucketRateLimiter.refill(Optional.empty(), 5, 60, 0));
        assertEquals(5.0, TokenBucketRateLimiter.refill(Optional.of(new BucketRecord(4.0, 0)), 5, 60, 600_000));
        assertEquals(2.5, TokenBucketRateLimiter.refill(Optional.of(new BucketRecord(0.0, 0)), 5, 60, 30_000));
        assertEquals(1.0, TokenBucketRateLimiter.refill(Optional.of(new BucketRecord(1.0, 10_000)), 5, 60, 5_000),
                "A clock step backwards adds nothing");
    }
}
