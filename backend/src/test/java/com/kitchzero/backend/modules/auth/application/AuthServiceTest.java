package com.kitchzero.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.kitchzero.backend.global.error.AuthErrorCode;
import com.kitchzero.backend.global.error.AuthException;
import com.kitchzero.backend.modules.auth.AuthTestFixtures;
import com.kitchzero.backend.modules.auth.application.JwtTokenService.IssuedRefreshToken;
import com.kitchzero.backend.modules.auth.application.JwtTokenService.IssuedToken;
import com.kitchzero.backend.modules.auth.application.JwtTokenService.RefreshTokenClaims;
import com.kitchzero.backend.modules.auth.domain.AppUser;
import com.kitchzero.backend.modules.auth.domain.AuthSession;
import com.kitchzero.backend.modules.auth.domain.LoginFailureReason;
import com.kitchzero.backend.modules.auth.domain.UserRole;
import com.kitchzero.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.CannotCreateTransactionException;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private static final String ADDRESS = "203.0.113.7";
    private static final OffsetDateTime NOW = OffsetDateTime.of(2026, 3, 1, 10, 0, 0, 0, ZoneOffset.UTC);

    @Mock
    private AppUserRepository appUserRepository;

    @Mock
    private CredentialVerifier credentialVerifier;

    @Mock
    private LoginAttemptService loginAttemptService;

    @Mock
    private SessionService sessionService;

    @Mock
    private JwtTokenService jwtTokenService;

    @InjectMocks
    private AuthService authService;

    private final UUID userId = UUID.randomUUID();
    private final UUID sessionId = UUID.randomUUID();
    private final AppUser alice = AuthTestFixtures.user(userId, "alice", UserRole.BRANCH_ADMIN, "b1", "stored-hash");

    @Test
    @DisplayName("a locked-out login is rejected before any password verification")
    void lockedOutLoginNeverReachesVerifier() {
        when(loginAttemptService.isLocked("alice", ADDRESS)).thenReturn(true);

        assertThatThrownBy(() -> authService.login("alice", "secret-pw", ADDRESS))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.ACCOUNT_LOCKED));

        verifyNoInteractions(credentialVerifier, appUserRepository, sessionService, jwtTokenService);
        verify(loginAttemptService, never()).recordFailure(any(), any(), any());
    }

    @Test
    void unknownUserRunsDummyVerificationAndRecordsFailure() {
        when(appUserRepository.findByUsernameIgnoreCase("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authService.login("ghost", "secret-pw", ADDRESS))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.INVALID_CREDENTIALS));

        verify(credentialVerifier).verifyAgainstDummy("secret-pw");
        verify(loginAttemptService).recordFailure("ghost", ADDRESS, LoginFailureReason.USER_NOT_FOUND);
        verifyNoInteractions(sessionService);
    }

    @Test
    void wrongPasswordRecordsFailureWithSamePublicError() {
        when(appUserRepository.findByUsernameIgnoreCase("alice")).thenReturn(Optional.of(alice));
        when(credentialVerifier.verify("wrong-pw", "stored-hash")).thenReturn(false);

        assertThatThrownBy(() -> authService.login("alice", "wrong-pw", ADDRESS))
                .isInstanceOfSatisfying(AuthException.class, ex -> {
                    assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.INVALID_CREDENTIALS);
                    assertThat(ex.getCode()).isEqualTo("AUTHENTICATION_FAILED");
                });

        verify(loginAttemptService).recordFailure("alice", ADDRESS, LoginFailureReason.INVALID_PASSWORD);
        verifyNoInteractions(sessionService);
    }

    @Test
    void failureRecordingOutageDoesNotChangeTheOutcome() {
        when(appUserRepository.findByUsernameIgnoreCase("alice")).thenReturn(Optional.of(alice));
        when(credentialVerifier.verify("wrong-pw", "stored-hash")).thenReturn(false);
        doThrow(new DataAccessResourceFailureException("down"))
                .when(loginAttemptService).recordFailure("alice", ADDRESS, LoginFailureReason.INVALID_PASSWORD);

        assertThatThrownBy(() -> authService.login("alice", "wrong-pw", ADDRESS))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.INVALID_CREDENTIALS));
    }

    @Test
    @DisplayName("a successful login clears failures and binds the first refresh token id to a new session")
    void successfulLoginIssuesSessionBoundTokens() {
        AuthSession session = AuthTestFixtures.session(sessionId, userId, NOW, NOW.plusDays(7), null);
        IssuedRefreshToken refresh = new IssuedRefreshToken("refresh-jwt", "jti-a", NOW.plusDays(7));
        IssuedToken access = new IssuedToken("access-jwt", NOW.plusMinutes(15));
        when(appUserRepository.findByUsernameIgnoreCase("alice")).thenReturn(Optional.of(alice));
        when(credentialVerifier.verify("secret-pw", "stored-hash")).thenReturn(true);
        when(sessionService.create(userId)).thenReturn(session);
        when(jwtTokenService.issueRefreshToken(userId, sessionId)).thenReturn(refresh);
        when(jwtTokenService.issueAccessToken(alice, sessionId)).thenReturn(access);

        IssuedSession issued = authService.login("alice", "secret-pw", ADDRESS);

        assertThat(issued.user()).isSameAs(alice);
        assertThat(issued.sessionId()).isEqualTo(sessionId);
        assertThat(issued.accessToken()).isEqualTo(access);
        assertThat(issued.refreshToken()).isEqualTo(refresh);
        verify(loginAttemptService).recordSuccessAndClear("alice", ADDRESS);
        verify(sessionService).bindRefreshToken(session, "jti-a");
    }

    @Test
    void refreshWithInvalidTokenNeverTouchesSessions() {
        when(jwtTokenService.verifyRefreshToken("garbage")).thenThrow(new InvalidTokenException("bad"));

        assertThatThrownBy(() -> authService.refresh("garbage"))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.INVALID_TOKEN));
        verifyNoInteractions(sessionService);
    }

    @Test
    void refreshRotatesAndMintsPairWithNewTokenId() {
        when(jwtTokenService.verifyRefreshToken("refresh-jwt"))
                .thenReturn(new RefreshTokenClaims(userId, sessionId, "jti-a", NOW, NOW.plusDays(7)));
        when(sessionService.rotate(sessionId, "jti-a")).thenReturn("jti-b");
        when(appUserRepository.findById(userId)).thenReturn(Optional.of(alice));
        IssuedToken access = new IssuedToken("access-2", NOW.plusMinutes(15));
        IssuedRefreshToken refresh = new IssuedRefreshToken("refresh-2", "jti-b", NOW.plusDays(7));
        when(jwtTokenService.issueAccessToken(alice, sessionId)).thenReturn(access);
        when(jwtTokenService.issueRefreshToken(userId, sessionId, "jti-b")).thenReturn(refresh);

        IssuedSession issued = authService.refresh("refresh-jwt");

        assertThat(issued.refreshToken().tokenId()).isEqualTo("jti-b");
        assertThat(issued.accessToken()).isEqualTo(access);
    }

    @Test
    void refreshReuseIsSurfacedAsLoginRequired() {
        when(jwtTokenService.verifyRefreshToken("stale-jwt"))
                .thenReturn(new RefreshTokenClaims(userId, sessionId, "jti-a", NOW, NOW.plusDays(7)));
        when(sessionService.rotate(sessionId, "jti-a")).thenThrow(new AuthException(AuthErrorCode.REUSE_DETECTED));

        assertThatThrownBy(() -> authService.refresh("stale-jwt"))
                .isInstanceOfSatisfying(AuthException.class, ex -> {
                    assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.REUSE_DETECTED);
                    assertThat(ex.getCode()).isEqualTo("LOGIN_REQUIRED");
                    assertThat(ex.getDetailMessage()).isEqualTo("Please log in again");
                });
        verifyNoInteractions(appUserRepository);
    }

    @Test
    void refreshFailsClosedWhenSessionStoreIsDown() {
        when(jwtTokenService.verifyRefreshToken("refresh-jwt"))
                .thenReturn(new RefreshTokenClaims(userId, sessionId, "jti-a", NOW, NOW.plusDays(7)));
        when(sessionService.rotate(sessionId, "jti-a")).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> authService.refresh("refresh-jwt"))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.STORE_UNAVAILABLE));
    }

    @Test
    void refreshFailsClosedWhenNoTransactionCanBeOpened() {
        when(jwtTokenService.verifyRefreshToken("refresh-jwt"))
                .thenReturn(new RefreshTokenClaims(userId, sessionId, "jti-a", NOW, NOW.plusDays(7)));
        when(sessionService.rotate(sessionId, "jti-a"))
                .thenThrow(new CannotCreateTransactionException("Could not open JPA EntityManager for transaction"));

        assertThatThrownBy(() -> authService.refresh("refresh-jwt"))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.STORE_UNAVAILABLE));
    }

    @Test
    void logoutToleratesUnavailableStore() {
        doThrow(new CannotCreateTransactionException("down")).when(sessionService).invalidate(sessionId);

        authService.logout(sessionId);

        verify(sessionService).invalidate(sessionId);
    }

    @Test
    void logoutWithoutSessionIsNoop() {
        authService.logout(null);

        verifyNoInteractions(sessionService);
    }
}
