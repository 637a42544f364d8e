package com.kitchzero.backend.modules.admin.presentation.dto;

import com.kitchzero.backend.modules.auth.domain.UserRole;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CreateUserRequest(
        @NotBlank @Size(min = 3, max = 50) @Pattern(regexp = "^[A-Za-z0-9_.-]+$") String username,
        @NotBlank @Size(min = 8, max = 128) String password,
        @NotNull UserRole role,
        @Size(max = 64) String branchId
) {
}
