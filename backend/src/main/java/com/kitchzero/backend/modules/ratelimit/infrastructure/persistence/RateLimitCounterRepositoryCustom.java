package com.kitchzero.backend.modules.ratelimit.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.OptionalInt;

import com.kitchzero.backend.modules.ratelimit.domain.EndpointClass;

public interface RateLimitCounterRepositoryCustom {

    /**
     * Creates the counter with a count of one, or increments it while it is below {@code limit}.
     *
     * @return the count after the increment, or empty when the counter was already at the limit
     */
    OptionalInt incrementIfBelowLimit(String clientIdentity,
                                      EndpointClass endpointClass,
                                      OffsetDateTime windowStart,
                                      OffsetDateTime expiresAt,
                                      int limit,
                                      OffsetDateTime now);
}
