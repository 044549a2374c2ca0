package com.stemtutor.core.ratelimit;

/**
 * The identity has no tokens left; the request must not enter the workflow.
 */
public class RateLimitExceededException extends RuntimeException {

    private final String identity;
    private final RateLimitDecision decision;

    public RateLimitExceededException(String identity, RateLimitDecision decision) {
        super("Rate limit exceeded for " + identity + ", retry in " + decision.resetInSeconds() + "s");
        this.identity = identity;
        this.decision = decision;
    }

    public String getIdentity() {
        return identity;
    }

    public RateLimitDecision getDecision() {
        return decision;
    }

    public long getResetInSeconds() {
        return decision.resetInSeconds();
    }
}
