package com.kitchzero.backend.modules.ratelimit.domain;

import java.time.OffsetDateTime;

import com.kitchzero.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Request count of one client identity for one endpoint class in one fixed window. Rows are written through
 * the atomic upsert in {@code RateLimitCounterRepositoryImpl}; the entity is read-mostly.
 */
@Entity
@Table(name = "rate_limit_counter")
public class RateLimitCounter extends AbstractTimestampedEntity<Long> {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "client_identity", nullable = false, length = 128)
    private String clientIdentity;

    @Enumerated(EnumType.STRING)
    @Column(name = "endpoint_class", nullable = false, length = 32)
    private EndpointClass endpointClass;

    @Column(name = "window_start", nullable = false)
    private OffsetDateTime windowStart;

    @Column(name = "request_count", nullable = false)
    private int requestCount;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    protected RateLimitCounter() {
    }

    public Long getId() {
        return id;
    }

    public String getClientIdentity() {
        return clientIdentity;
    }

    public EndpointClass getEndpointClass() {
        return endpointClass;
    }

    public OffsetDateTime getWindowStart() {
        return windowStart;
    }

    public int getRequestCount() {
        return requestCount;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }
}
