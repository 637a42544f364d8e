package com.kitchzero.backend.modules.ratelimit.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.OptionalInt;

import com.kitchzero.backend.modules.ratelimit.domain.EndpointClass;
import com.kitchzero.backend.modules.ratelimit.domain.RateLimitPolicy;
import com.kitchzero.backend.modules.ratelimit.infrastructure.persistence.RateLimitCounterRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Fixed-window rate limiter backed by the shared database so that every service instance sees the same
 * counters. The store is a defense-in-depth layer: when it cannot be reached the request is allowed.
 */
@Service
public class RateLimitService {

    private static final Logger log = LoggerFactory.getLogger(RateLimitService.class);

    private final RateLimitCounterRepository counterRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public RateLimitService(
            RateLimitCounterRepository counterRepository,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.counterRepository = counterRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    public RateLimitResult checkLimit(String clientIdentity, RateLimitPolicy policy) {
        return checkLimit(clientIdentity, policy, clock.instant());
    }

    RateLimitResult checkLimit(String clientIdentity, RateLimitPolicy policy, Instant now) {
        Instant windowStart = policy.windowStart(now);
        Instant resetTime = windowStart.plus(policy.window());
        try {
            RateLimitResult result = transactionTemplate.execute(status ->
                    countRequest(clientIdentity, policy, now, windowStart, resetTime));
            if (result != null && !result.allowed()) {
                log.warn("Rate limit exceeded for {} on {} ({} per {})",
                        clientIdentity, policy.endpointClass(), policy.limit(), policy.window());
            }
            return result;
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Rate limit store unavailable, allowing {} on {}: {}",
                    clientIdentity, policy.endpointClass(), ex.getMessage());
            return new RateLimitResult(true, policy.limit(), policy.limit(), resetTime, 0);
        }
    }

    private RateLimitResult countRequest(String clientIdentity, RateLimitPolicy policy, Instant now,
                                         Instant windowStart, Instant resetTime) {
        OffsetDateTime nowAt = toUtc(now);
        OffsetDateTime windowStartAt = toUtc(windowStart);
        counterRepository.deleteExpired(nowAt);

        OptionalInt counted = counterRepository.incrementIfBelowLimit(
                clientIdentity, policy.endpointClass(), windowStartAt, toUtc(resetTime), policy.limit(), nowAt);
        if (counted.isPresent()) {
            int total = counted.getAsInt();
            return new RateLimitResult(true, policy.limit(), Math.max(0, policy.limit() - total), resetTime, total);
        }

        int total = counterRepository.findRequestCount(clientIdentity, policy.endpointClass(), windowStartAt)
                .orElse(policy.limit());
        return new RateLimitResult(false, policy.limit(), 0, resetTime, total);
    }

    @Transactional
    public int resetLimit(String clientIdentity, EndpointClass endpointClass) {
        int removed = counterRepository.deleteByKey(clientIdentity, endpointClass);
        log.info("Reset rate limit for {} on {} ({} counters removed)", clientIdentity, endpointClass, removed);
        return removed;
    }

    @Transactional
    public int purgeExpired() {
        return counterRepository.deleteExpired(OffsetDateTime.now(clock));
    }

    private static OffsetDateTime toUtc(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
