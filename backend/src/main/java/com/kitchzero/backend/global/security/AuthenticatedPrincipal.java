package com.kitchzero.backend.global.security;

import java.util.UUID;

import com.kitchzero.backend.modules.access.domain.PermissionSubject;
import com.kitchzero.backend.modules.auth.domain.UserRole;

public record AuthenticatedPrincipal(UUID userId, String username, UserRole role, String branchId, UUID sessionId)
        implements PermissionSubject {
}
