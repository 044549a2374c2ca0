package com.stemtutor.core.collaborators;

import com.stemtutor.core.metrics.TutorMetrics;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs collaborator calls under a bounded exponential-backoff {@link Retry}.
 * <p>
 * Only {@link CollaboratorTransientException} is retried. When attempts run
 * out, or the first failure is permanent, the caller's fallback is returned
 * with a degraded outcome. Nothing is thrown past this boundary.
 */
@Component
public class CollaboratorInvoker {

    private static final Logger log = LoggerFactory.getLogger(CollaboratorInvoker.class);

    private final RetryRegistry retryRegistry;
    private final TutorMetrics metrics;

    public CollaboratorInvoker(CollaboratorProperties properties, TutorMetrics metrics) {
        this.metrics = metrics;
        var config = RetryConfig.custom()
                .maxAttempts(properties.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        Duration.ofMillis(properties.getInitialBackoffMs()), properties.getBackoffMultiplier()))
                .retryExceptions(CollaboratorTransientException.class)
                .build();
        this.retryRegistry = RetryRegistry.of(config);
        this.retryRegistry.getEventPublisher().onEntryAdded(added -> added.getAddedEntry()
                .getEventPublisher()
                .onRetry(event -> log.warn("Retrying {} (attempt {}) after {}: {}",
                        event.getName(), event.getNumberOfRetryAttempts() + 1,
                        event.getWaitInterval(), event.getLastThrowable().getMessage())));
    }

    public <T> CollaboratorResult<T> invoke(String collaborator, Supplier<T> call, Supplier<T> fallback) {
        Retry retry = retryRegistry.retry(collaborator);
        var attempts = new AtomicInteger();
        Supplier<T> classified = () -> {
            attempts.incrementAndGet();
            T value;
            try {
                value = call.get();
            } catch (RuntimeException e) {
                throw CollaboratorErrors.classify(collaborator, e);
            }
            if (value == null) {
                throw new CollaboratorPermanentException(collaborator, collaborator + " returned no value", null);
            }
            return value;
        };

        try {
            T value = Retry.decorateSupplier(retry, classified).get();
            metrics.recordCollaboratorOutcome(collaborator, CollaboratorOutcome.OK);
            return new CollaboratorResult<>(value, CollaboratorOutcome.OK, attempts.get());
        } catch (CollaboratorTransientException e) {
            log.warn("{} still failing after {} attempts, using fallback: {}", collaborator, attempts.get(), e.getMessage());
            return degraded(collaborator, fallback, CollaboratorOutcome.DEGRADED_TRANSIENT, attempts.get());
        } catch (CollaboratorPermanentException e) {
            log.warn("{} failed permanently, using fallback: {}", collaborator, e.getMessage());
            return degraded(collaborator, fallback, CollaboratorOutcome.DEGRADED_PERMANENT, attempts.get());
        }
    }

    private <T> CollaboratorResult<T> degraded(String collaborator, Supplier<T> fallback,
                                               CollaboratorOutcome outcome, int attempts) {
        metrics.recordCollaboratorOutcome(collaborator, outcome);
        return new CollaboratorResult<>(fallback.get(), outcome, attempts);
    }
}
