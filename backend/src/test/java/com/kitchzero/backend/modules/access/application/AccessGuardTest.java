package com.kitchzero.backend.modules.access.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.UUID;

import com.kitchzero.backend.global.error.AuthErrorCode;
import com.kitchzero.backend.global.error.AuthException;
import com.kitchzero.backend.global.security.AuthenticatedPrincipal;
import com.kitchzero.backend.modules.access.domain.Action;
import com.kitchzero.backend.modules.access.domain.Resource;
import com.kitchzero.backend.modules.access.domain.ResourceContext;
import com.kitchzero.backend.modules.auth.domain.UserRole;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;

class AccessGuardTest {

    private final AccessGuard accessGuard = new AccessGuard(new PermissionEvaluator());

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void returnsPrincipalWhenAllowed() {
        AuthenticatedPrincipal principal = authenticate(UserRole.BRANCH_ADMIN, "b1");

        assertThat(accessGuard.require(Resource.INVENTORY, Action.UPDATE, ResourceContext.ofBranch("b1")))
                .isEqualTo(principal);
    }

    @Test
    void deniesWithForbidden() {
        authenticate(UserRole.BRANCH_ADMIN, "b1");

        assertThatThrownBy(() -> accessGuard.require(Resource.INVENTORY, Action.UPDATE, ResourceContext.ofBranch("b2")))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.FORBIDDEN));
    }

    @Test
    void requiresAuthenticatedPrincipal() {
        assertThatThrownBy(() -> accessGuard.require(Resource.INVENTORY, Action.READ))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.INVALID_TOKEN));
    }

    private static AuthenticatedPrincipal authenticate(UserRole role, String branchId) {
        AuthenticatedPrincipal principal =
                new AuthenticatedPrincipal(UUID.randomUUID(), "manager", role, branchId, UUID.randomUUID());
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken(principal, null, List.of()));
        return principal;
    }
}
