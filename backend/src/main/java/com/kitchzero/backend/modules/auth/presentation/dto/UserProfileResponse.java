package com.kitchzero.backend.modules.auth.presentation.dto;

import java.util.UUID;

import com.kitchzero.backend.modules.auth.domain.AppUser;
import com.kitchzero.backend.modules.auth.domain.UserRole;

public record UserProfileResponse(UUID id, String username, UserRole role, String branchId) {

    public static UserProfileResponse from(AppUser user) {
        return new UserProfileResponse(user.getId(), user.getUsername(), user.getRole(), user.getBranchId());
    }
}
