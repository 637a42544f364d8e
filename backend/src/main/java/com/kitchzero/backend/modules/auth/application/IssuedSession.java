package com.kitchzero.backend.modules.auth.application;

import java.util.UUID;

import com.kitchzero.backend.modules.auth.application.JwtTokenService.IssuedRefreshToken;
import com.kitchzero.backend.modules.auth.application.JwtTokenService.IssuedToken;
import com.kitchzero.backend.modules.auth.domain.AppUser;

/**
 * Outcome of a login or refresh: the principal, its session and the freshly minted token pair.
 */
public record IssuedSession(AppUser user, UUID sessionId, IssuedToken accessToken, IssuedRefreshToken refreshToken) {
}
