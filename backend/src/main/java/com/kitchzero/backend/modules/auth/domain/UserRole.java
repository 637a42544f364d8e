package com.kitchzero.backend.modules.auth.domain;

/**
 * Roles a principal can hold. Only {@link #BRANCH_ADMIN} is branch-scoped.
 */
public enum UserRole {
    SUPER_ADMIN,
    BRANCH_ADMIN;

    public boolean isBranchScoped() {
        return this == BRANCH_ADMIN;
    }
}
