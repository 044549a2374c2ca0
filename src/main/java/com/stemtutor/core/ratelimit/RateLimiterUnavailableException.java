package com.stemtutor.core.ratelimit;

/**
 * The rate-limit store could not be reached.
 */
public class RateLimiterUnavailableException extends RuntimeException {
    public RateLimiterUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
