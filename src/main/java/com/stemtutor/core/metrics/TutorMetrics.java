package com.stemtutor.core.metrics;

import com.stemtutor.core.collaborators.CollaboratorOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for tutoring sessions and rate limiting.
 */
@Service
public class TutorMetrics {

    private final MeterRegistry registry;

    public TutorMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSessionResult(String status) {
        Counter.builder("stemtutor.sessions.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordStepDuration(String step, long ms) {
        Timer.builder("stemtutor.step.duration")
                .tag("step", step)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordCollaboratorOutcome(String collaborator, CollaboratorOutcome outcome) {
        Counter.builder("stemtutor.collaborator.calls")
                .description("Collaborator calls by outcome")
                .tag("collaborator", collaborator)
                .tag("outcome", outcome.name())
                .register(registry)
                .increment();
    }

    public void recordRateLimitDecision(String tier, boolean allowed) {
        Counter.builder("stemtutor.ratelimit.decisions")
                .tag("tier", tier)
                .tag("result", allowed ? "allowed" : "rejected")
                .register(registry)
                .increment();
    }

    /**
     * Incremented whenever the rate-limit store is unreachable and a request is let through.
     */
    public void recordRateLimiterDegraded(String operation) {
        Counter.builder("stemtutor.ratelimit.degraded")
                .description("Rate-limit operations that failed open")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }
}
