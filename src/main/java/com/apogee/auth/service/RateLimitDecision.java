package com.apogee.auth.service;

import lombok.Value;

/**
 * Outcome of a rate-limit admission check.
 */
@Value
public class RateLimitDecision {
    boolean allowed;
    int remaining;
    long retryAfterSeconds;

    public static RateLimitDecision allowed(int remaining) {
        return new RateLimitDecision(true, remaining, 0L);
    }

    public static RateLimitDecision denied(long retryAfterSeconds) {
        return new RateLimitDecision(false, 0, retryAfterSeconds);
    }
}
