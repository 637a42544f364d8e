package com.kitchzero.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.kitchzero.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Server-side login session. {@code currentRefreshTokenId} names the single refresh token that may still be
 * exchanged for this session; any other presented id is treated as replay.
 */
@Entity
@Table(name = "auth_session")
public class AuthSession extends AbstractTimestampedEntity<UUID> {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID userId;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "last_activity_at", nullable = false)
    private OffsetDateTime lastActivityAt;

    @Column(name = "current_refresh_token_id", length = 64)
    private String currentRefreshTokenId;

    protected AuthSession() {
    }

    public AuthSession(UUID userId, OffsetDateTime createdAt, OffsetDateTime expiresAt) {
        this.userId = userId;
        this.lastActivityAt = createdAt;
        this.expiresAt = expiresAt;
    }

    public UUID getId() {
        return id;
    }

    public UUID getUserId() {
        return userId;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public OffsetDateTime getLastActivityAt() {
        return lastActivityAt;
    }

    public String getCurrentRefreshTokenId() {
        return currentRefreshTokenId;
    }

    public void setCurrentRefreshTokenId(String currentRefreshTokenId) {
        this.currentRefreshTokenId = currentRefreshTokenId;
    }

    public boolean isExpiredAt(OffsetDateTime now) {
        return !expiresAt.isAfter(now);
    }
}
