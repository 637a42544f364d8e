package com.kitchzero.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

import com.kitchzero.backend.global.web.ClientAddressResolver;
import com.kitchzero.backend.modules.auth.domain.LoginAttempt;
import com.kitchzero.backend.modules.auth.domain.LoginFailureReason;
import com.kitchzero.backend.modules.auth.infrastructure.persistence.LoginAttemptRepository;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Records login attempts and derives lockout state from recent failures. Failures are matched by
 * username or by client address, so either signal alone can lock.
 */
@Service
public class LoginAttemptService {

    private final LoginAttemptRepository loginAttemptRepository;
    private final int maxFailures;
    private final Duration lockoutWindow;
    private final Duration retention;
    private final Clock clock;

    public LoginAttemptService(
            LoginAttemptRepository loginAttemptRepository,
            @Value("${app.auth.lockout.max-failures:5}") int maxFailures,
            @Value("${app.auth.lockout.window:PT15M}") Duration lockoutWindow,
            @Value("${app.auth.login-attempt-retention:P30D}") Duration retention,
            Clock clock
    ) {
        this.loginAttemptRepository = loginAttemptRepository;
        this.maxFailures = maxFailures;
        this.lockoutWindow = lockoutWindow;
        this.retention = retention;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public long recentFailureCount(String username, String clientAddress) {
        OffsetDateTime since = OffsetDateTime.now(clock).minus(lockoutWindow);
        return loginAttemptRepository.countRecentFailures(normalize(username), matchableAddress(clientAddress), since);
    }

    @Transactional(readOnly = true)
    public boolean isLocked(String username, String clientAddress) {
        return recentFailureCount(username, clientAddress) >= maxFailures;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordFailure(String username, String clientAddress, LoginFailureReason reason) {
        loginAttemptRepository.save(
                LoginAttempt.failure(normalize(username), clientAddress, reason, OffsetDateTime.now(clock)));
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordSuccessAndClear(String username, String clientAddress) {
        String normalized = normalize(username);
        loginAttemptRepository.deleteFailures(normalized, matchableAddress(clientAddress));
        loginAttemptRepository.save(LoginAttempt.success(normalized, clientAddress, OffsetDateTime.now(clock)));
    }

    @Transactional
    public int purgeOlderThanRetention() {
        return loginAttemptRepository.deleteOlderThan(OffsetDateTime.now(clock).minus(retention));
    }

    // Requests without a forwarded address all share "unknown"; those are matched by username only.
    private static String matchableAddress(String clientAddress) {
        if (clientAddress == null || ClientAddressResolver.UNKNOWN.equals(clientAddress)) {
            return null;
        }
        return clientAddress;
    }

    private static String normalize(String username) {
        if (username == null) {
            return "";
        }
        String trimmed = username.trim();
        return trimmed.length() > 50 ? trimmed.substring(0, 50) : trimmed;
    }
}
