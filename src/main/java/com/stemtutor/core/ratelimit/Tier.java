package com.stemtutor.core.ratelimit;

/**
 * Subscription tiers with distinct request allowances.
 */
public enum Tier {
    FREE,
    PRO
}
