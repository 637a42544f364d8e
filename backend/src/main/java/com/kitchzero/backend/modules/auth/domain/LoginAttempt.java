package com.kitchzero.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Append-only record of one login attempt.
 */
@Entity
@Table(name = "login_attempt")
public class LoginAttempt {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "username", nullable = false, updatable = false, length = 50)
    private String username;

    @Column(name = "client_address", nullable = false, updatable = false, length = 64)
    private String clientAddress;

    @Column(name = "success", nullable = false, updatable = false)
    private boolean success;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_reason", updatable = false, length = 32)
    private LoginFailureReason failureReason;

    @Column(name = "attempted_at", nullable = false, updatable = false)
    private OffsetDateTime attemptedAt;

    protected LoginAttempt() {
    }

    private LoginAttempt(String username, String clientAddress, boolean success,
                         LoginFailureReason failureReason, OffsetDateTime attemptedAt) {
        this.username = username;
        this.clientAddress = clientAddress;
        this.success = success;
        this.failureReason = failureReason;
        this.attemptedAt = attemptedAt;
    }

    public static LoginAttempt failure(String username, String clientAddress, LoginFailureReason reason,
                                       OffsetDateTime attemptedAt) {
        return new LoginAttempt(username, clientAddress, false, reason, attemptedAt);
    }

    public static LoginAttempt success(String username, String clientAddress, OffsetDateTime attemptedAt) {
        return new LoginAttempt(username, clientAddress, true, null, attemptedAt);
    }

    public UUID getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    public String getClientAddress() {
        return clientAddress;
    }

    public boolean isSuccess() {
        return success;
    }

    public LoginFailureReason getFailureReason() {
        return failureReason;
    }

    public OffsetDateTime getAttemptedAt() {
        return attemptedAt;
    }
}
