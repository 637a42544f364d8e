package com.kitchzero.backend.global.security;

import java.util.Optional;
import java.util.UUID;

import com.kitchzero.backend.global.error.AuthErrorCode;
import com.kitchzero.backend.global.error.AuthException;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static Optional<AuthenticatedPrincipal> findCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof AuthenticatedPrincipal principal) {
            return Optional.of(principal);
        }
        return Optional.empty();
    }

    public static AuthenticatedPrincipal getCurrentPrincipal() {
        return findCurrentPrincipal().orElseThrow(() -> new AuthException(AuthErrorCode.INVALID_TOKEN));
    }

    public static UUID getCurrentUserId() {
        return getCurrentPrincipal().userId();
    }
}
