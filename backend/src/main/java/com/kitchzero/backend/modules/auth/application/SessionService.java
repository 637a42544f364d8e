package com.kitchzero.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.kitchzero.backend.global.error.AuthErrorCode;
import com.kitchzero.backend.global.error.AuthException;
import com.kitchzero.backend.modules.auth.domain.AuthSession;
import com.kitchzero.backend.modules.auth.infrastructure.persistence.AuthSessionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

/**
 * Session lifecycle and the single-use refresh rotation protocol.
 *
 * <p>A session is ACTIVE while it exists and is unexpired; its {@code currentRefreshTokenId} names the one
 * refresh token that may be exchanged. Rotation replaces that id with a conditional update, so of several
 * callers presenting the same id only one can win. Presenting any other id deletes the session.
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final AuthSessionRepository sessionRepository;
    private final JwtTokenService jwtTokenService;
    private final Duration sessionTtl;
    private final Clock clock;

    public SessionService(
            AuthSessionRepository sessionRepository,
            JwtTokenService jwtTokenService,
            @Value("${app.auth.session-ttl:P7D}") Duration sessionTtl,
            Clock clock
    ) {
        this.sessionRepository = sessionRepository;
        this.jwtTokenService = jwtTokenService;
        this.sessionTtl = sessionTtl;
        this.clock = clock;
    }

    @Transactional
    public AuthSession create(UUID userId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        AuthSession session = new AuthSession(userId, now, now.plus(sessionTtl));
        return sessionRepository.save(session);
    }

    /**
     * Binds the first refresh token id to a freshly created session. Must run in the transaction that
     * created the session.
     */
    @Transactional
    public void bindRefreshToken(AuthSession session, String tokenId) {
        session.setCurrentRefreshTokenId(tokenId);
        sessionRepository.save(session);
    }

    public void touch(UUID sessionId) {
        try {
            sessionRepository.touch(sessionId, OffsetDateTime.now(clock));
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Failed to touch session {}: {}", sessionId, ex.getMessage());
        }
    }

    /**
     * Whether the session exists and is unexpired. Expired sessions are deleted on the way. A store fault
     * counts as not live.
     */
    public boolean verifyLive(UUID sessionId) {
        try {
            Optional<AuthSession> session = sessionRepository.findById(sessionId);
            if (session.isEmpty()) {
                return false;
            }
            if (session.get().isExpiredAt(OffsetDateTime.now(clock))) {
                sessionRepository.deleteSession(sessionId);
                log.info("Session {} expired and was removed", sessionId);
                return false;
            }
            return true;
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Session store unavailable while checking session {}: {}", sessionId, ex.getMessage());
            return false;
        }
    }

    /**
     * Exchanges {@code presentedTokenId} for a new refresh token id.
     *
     * @throws AuthException with {@link AuthErrorCode#SESSION_NOT_FOUND}, {@link AuthErrorCode#SESSION_EXPIRED}
     *                       or {@link AuthErrorCode#REUSE_DETECTED}; the session is gone after the latter two
     */
    @Transactional(noRollbackFor = AuthException.class)
    public String rotate(UUID sessionId, String presentedTokenId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        AuthSession session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> new AuthException(AuthErrorCode.SESSION_NOT_FOUND));

        if (session.isExpiredAt(now)) {
            sessionRepository.deleteSession(sessionId);
            throw new AuthException(AuthErrorCode.SESSION_EXPIRED);
        }

        String nextTokenId = jwtTokenService.newTokenId();
        int updated = sessionRepository.compareAndSetRefreshTokenId(sessionId, presentedTokenId, nextTokenId, now);
        if (updated == 0) {
            int deleted = sessionRepository.deleteSession(sessionId);
            log.warn("Refresh token reuse detected for session {} of user {} (session deleted: {})",
                    sessionId, session.getUserId(), deleted > 0);
            throw new AuthException(AuthErrorCode.REUSE_DETECTED);
        }
        return nextTokenId;
    }

    @Transactional
    public void invalidate(UUID sessionId) {
        sessionRepository.deleteSession(sessionId);
    }

    @Transactional
    public int invalidateAllForPrincipal(UUID userId) {
        int deleted = sessionRepository.deleteAllByUserId(userId);
        if (deleted > 0) {
            log.info("Invalidated {} session(s) for user {}", deleted, userId);
        }
        return deleted;
    }

    @Transactional
    public int purgeExpired() {
        return sessionRepository.deleteExpired(OffsetDateTime.now(clock));
    }
}
