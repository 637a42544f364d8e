package com.kitchzero.backend.modules.ratelimit.application;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one rate-limit check. {@code totalRequests} is the counter value after this request was
 * counted, or the saturated value when it was rejected.
 */
public record RateLimitResult(boolean allowed, int limit, int remaining, Instant resetTime, int totalRequests) {

    public long retryAfterSeconds(Instant now) {
        long seconds = Duration.between(now, resetTime).toSeconds();
        if (Duration.between(now, resetTime).toMillis() % 1000 != 0) {
            seconds++;
        }
        return Math.max(seconds, 1);
    }
}
