package com.stemtutor.core.ratelimit;

/**
 * Looks up the tier an identity belongs to.
 */
public interface TierResolver {

    Tier resolve(String identity);
}
