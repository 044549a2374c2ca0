package com.stemtutor.core.ratelimit;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Current allowance of an identity, read without consuming a token.
 */
public record QuotaStatus(
        int remaining,
        int limit,
        @JsonProperty("window_seconds") int windowSeconds,
        @JsonProperty("reset_in_seconds") long resetInSeconds,
        Tier tier
) {}
