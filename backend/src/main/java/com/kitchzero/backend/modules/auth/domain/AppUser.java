package com.kitchzero.backend.modules.auth.domain;

import java.util.UUID;

import com.kitchzero.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Authenticated principal. Username is fixed at creation from the caller's point of view; role, branch and
 * password hash change only through administrative updates.
 */
@Entity
@Table(name = "app_user")
public class AppUser extends AbstractTimestampedEntity<UUID> {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "username", nullable = false, length = 50)
    private String username;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 32)
    private UserRole role;

    @Column(name = "branch_id", length = 64)
    private String branchId;

    protected AppUser() {
    }

    public AppUser(String username, String passwordHash, UserRole role, String branchId) {
        this.username = username;
        this.passwordHash = passwordHash;
        assignRole(role, branchId);
    }

    /**
     * Replaces role and branch together. A branch is required for branch-scoped roles and forbidden otherwise.
     */
    public void assignRole(UserRole role, String branchId) {
        checkBranchScope(role, branchId);
        this.role = role;
        this.branchId = role.isBranchScoped() ? branchId.trim() : null;
    }

    public static void checkBranchScope(UserRole role, String branchId) {
        if (role == null) {
            throw new IllegalArgumentException("role is required");
        }
        boolean hasBranch = branchId != null && !branchId.isBlank();
        if (role.isBranchScoped() && !hasBranch) {
            throw new IllegalArgumentException(role + " requires a branchId");
        }
        if (!role.isBranchScoped() && hasBranch) {
            throw new IllegalArgumentException(role + " must not carry a branchId");
        }
    }

    @PrePersist
    @PreUpdate
    void verifyBranchScope() {
        checkBranchScope(role, branchId);
    }

    public UUID getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public void setPasswordHash(String passwordHash) {
        this.passwordHash = passwordHash;
    }

    public UserRole getRole() {
        return role;
    }

    public String getBranchId() {
        return branchId;
    }
}
