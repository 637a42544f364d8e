package com.kitchzero.backend.modules.admin.presentation.dto;

import com.kitchzero.backend.modules.auth.domain.UserRole;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Partial update; null fields are left unchanged.
 */
public record UpdateUserRequest(
        @Size(min = 3, max = 50) @Pattern(regexp = "^[A-Za-z0-9_.-]+$") String username,
        @Size(min = 8, max = 128) String password,
        UserRole role,
        @Size(max = 64) String branchId
) {
}
