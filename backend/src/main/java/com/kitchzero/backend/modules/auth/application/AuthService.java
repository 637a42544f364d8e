package com.kitchzero.backend.modules.auth.application;

import java.util.UUID;

import com.kitchzero.backend.global.error.AuthErrorCode;
import com.kitchzero.backend.global.error.AuthException;
import com.kitchzero.backend.global.error.ProblemException;
import com.kitchzero.backend.modules.auth.application.JwtTokenService.IssuedRefreshToken;
import com.kitchzero.backend.modules.auth.application.JwtTokenService.IssuedToken;
import com.kitchzero.backend.modules.auth.application.JwtTokenService.RefreshTokenClaims;
import com.kitchzero.backend.modules.auth.domain.AppUser;
import com.kitchzero.backend.modules.auth.domain.AuthSession;
import com.kitchzero.backend.modules.auth.domain.LoginFailureReason;
import com.kitchzero.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final AppUserRepository appUserRepository;
    private final CredentialVerifier credentialVerifier;
    private final LoginAttemptService loginAttemptService;
    private final SessionService sessionService;
    private final JwtTokenService jwtTokenService;

    public AuthService(
            AppUserRepository appUserRepository,
            CredentialVerifier credentialVerifier,
            LoginAttemptService loginAttemptService,
            SessionService sessionService,
            JwtTokenService jwtTokenService
    ) {
        this.appUserRepository = appUserRepository;
        this.credentialVerifier = credentialVerifier;
        this.loginAttemptService = loginAttemptService;
        this.sessionService = sessionService;
        this.jwtTokenService = jwtTokenService;
    }

    /**
     * Lockout check, credential check, then a new session bound to the first refresh token id.
     */
    @Transactional(noRollbackFor = ProblemException.class)
    public IssuedSession login(String username, String password, String clientAddress) {
        if (loginAttemptService.isLocked(username, clientAddress)) {
            log.warn("Login rejected for '{}' from {}: locked out", username, clientAddress);
            throw new AuthException(AuthErrorCode.ACCOUNT_LOCKED);
        }

        AppUser user = appUserRepository.findByUsernameIgnoreCase(username.trim()).orElse(null);
        if (user == null) {
            credentialVerifier.verifyAgainstDummy(password);
            recordFailure(username, clientAddress, LoginFailureReason.USER_NOT_FOUND);
            throw new AuthException(AuthErrorCode.INVALID_CREDENTIALS);
        }

        if (!credentialVerifier.verify(password, user.getPasswordHash())) {
            recordFailure(username, clientAddress, LoginFailureReason.INVALID_PASSWORD);
            throw new AuthException(AuthErrorCode.INVALID_CREDENTIALS);
        }

        try {
            loginAttemptService.recordSuccessAndClear(username, clientAddress);
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Failed to record successful login for '{}': {}", username, ex.getMessage());
        }

        AuthSession session = sessionService.create(user.getId());
        IssuedRefreshToken refreshToken = jwtTokenService.issueRefreshToken(user.getId(), session.getId());
        sessionService.bindRefreshToken(session, refreshToken.tokenId());
        IssuedToken accessToken = jwtTokenService.issueAccessToken(user, session.getId());

        log.info("User {} logged in, session {}", user.getId(), session.getId());
        return new IssuedSession(user, session.getId(), accessToken, refreshToken);
    }

    /**
     * Exchanges a refresh token for a new pair. The session commits its rotation (or its deletion on reuse)
     * on its own, so this method runs outside a transaction.
     */
    public IssuedSession refresh(String refreshToken) {
        RefreshTokenClaims claims;
        try {
            claims = jwtTokenService.verifyRefreshToken(refreshToken);
        } catch (InvalidTokenException ex) {
            log.warn("Refresh rejected: {}", ex.getMessage());
            throw new AuthException(AuthErrorCode.INVALID_TOKEN, ex);
        }

        try {
            String nextTokenId = sessionService.rotate(claims.sessionId(), claims.tokenId());
            AppUser user = appUserRepository.findById(claims.userId()).orElse(null);
            if (user == null) {
                sessionService.invalidate(claims.sessionId());
                throw new AuthException(AuthErrorCode.SESSION_NOT_FOUND);
            }

            IssuedToken accessToken = jwtTokenService.issueAccessToken(user, claims.sessionId());
            IssuedRefreshToken nextRefreshToken =
                    jwtTokenService.issueRefreshToken(user.getId(), claims.sessionId(), nextTokenId);
            log.info("Session {} rotated for user {}", claims.sessionId(), user.getId());
            return new IssuedSession(user, claims.sessionId(), accessToken, nextRefreshToken);
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Session store unavailable during refresh of session {}: {}", claims.sessionId(), ex.getMessage());
            throw new AuthException(AuthErrorCode.STORE_UNAVAILABLE, ex);
        }
    }

    public void logout(UUID sessionId) {
        if (sessionId == null) {
            return;
        }
        try {
            sessionService.invalidate(sessionId);
            log.info("Session {} logged out", sessionId);
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Failed to delete session {} on logout: {}", sessionId, ex.getMessage());
        }
    }

    @Transactional(readOnly = true)
    public AppUser loadProfile(UUID userId) {
        return appUserRepository.findById(userId)
                .orElseThrow(() -> new AuthException(AuthErrorCode.SESSION_NOT_FOUND));
    }

    private void recordFailure(String username, String clientAddress, LoginFailureReason reason) {
        log.warn("Failed login for '{}' from {}: {}", username, clientAddress, reason);
        try {
            loginAttemptService.recordFailure(username, clientAddress, reason);
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Failed to record login failure for '{}': {}", username, ex.getMessage());
        }
    }
}
