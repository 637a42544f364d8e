package com.kitchzero.backend.modules.auth.application;

import com.kitchzero.backend.modules.ratelimit.application.RateLimitService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic cleanup of expired sessions, old login attempts and stale rate-limit counters. Each sweep runs on
 * its own so one failing table does not stop the others.
 */
@Component
public class AuthMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(AuthMaintenanceScheduler.class);

    private final SessionService sessionService;
    private final LoginAttemptService loginAttemptService;
    private final RateLimitService rateLimitService;

    public AuthMaintenanceScheduler(
            SessionService sessionService,
            LoginAttemptService loginAttemptService,
            RateLimitService rateLimitService
    ) {
        this.sessionService = sessionService;
        this.loginAttemptService = loginAttemptService;
        this.rateLimitService = rateLimitService;
    }

    @Scheduled(
            fixedDelayString = "${app.auth.cleanup-interval:PT6H}",
            initialDelayString = "${app.auth.cleanup-initial-delay:PT5M}"
    )
    public void sweep() {
        runSweep("expired sessions", sessionService::purgeExpired);
        runSweep("old login attempts", loginAttemptService::purgeOlderThanRetention);
        runSweep("expired rate-limit counters", rateLimitService::purgeExpired);
    }

    private void runSweep(String label, Sweep sweep) {
        try {
            int removed = sweep.run();
            if (removed > 0) {
                log.info("Maintenance removed {} {}", removed, label);
            } else {
                log.debug("Maintenance found no {}", label);
            }
        } catch (RuntimeException ex) {
            log.error("Maintenance sweep of {} failed", label, ex);
        }
    }

    @FunctionalInterface
    interface Sweep {
        int run();
    }
}
