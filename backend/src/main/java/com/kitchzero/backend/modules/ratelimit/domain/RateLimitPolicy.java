package com.kitchzero.backend.modules.ratelimit.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public record RateLimitPolicy(EndpointClass endpointClass, int limit, Duration window) {

    public RateLimitPolicy {
        Objects.requireNonNull(endpointClass, "endpointClass must not be null");
        Objects.requireNonNull(window, "window must not be null");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        if (window.toMillis() <= 0) {
            throw new IllegalArgumentException("window must be positive");
        }
    }

    /**
     * Start of the fixed window containing {@code now}, aligned to the epoch.
     */
    public Instant windowStart(Instant now) {
        long size = window.toMillis();
        return Instant.ofEpochMilli(Math.floorDiv(now.toEpochMilli(), size) * size);
    }
}
