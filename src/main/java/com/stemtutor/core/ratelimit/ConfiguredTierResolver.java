package com.stemtutor.core.ratelimit;

import org.springframework.stereotype.Component;

/**
 * Resolves tiers from the {@code stemtutor.rate-limit.pro-identities} list.
 * Every other identity is {@link Tier#FREE}.
 */
@Component
public class ConfiguredTierResolver implements TierResolver {

    private final RateLimitProperties properties;

    public ConfiguredTierResolver(RateLimitProperties properties) {
        this.properties = properties;
    }

    @Override
    public Tier resolve(String identity) {
        return properties.getProIdentities().contains(identity) ? Tier.PRO : Tier.FREE;
    }
}
