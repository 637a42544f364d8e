package com.kitchzero.backend.modules.admin.application;

import java.util.UUID;

import com.kitchzero.backend.global.error.ProblemException;
import com.kitchzero.backend.modules.access.application.AccessGuard;
import com.kitchzero.backend.modules.access.domain.Action;
import com.kitchzero.backend.modules.access.domain.Resource;
import com.kitchzero.backend.modules.auth.application.CredentialVerifier;
import com.kitchzero.backend.modules.auth.application.SessionService;
import com.kitchzero.backend.modules.auth.domain.AppUser;
import com.kitchzero.backend.modules.auth.domain.UserRole;
import com.kitchzero.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Administrative writes on principals. Every path goes through {@link AppUser#assignRole} so the branch
 * rule for branch-scoped roles holds after any update.
 */
@Service
@Transactional
public class AdminUserService {

    private static final Logger log = LoggerFactory.getLogger(AdminUserService.class);

    private final AppUserRepository appUserRepository;
    private final CredentialVerifier credentialVerifier;
    private final SessionService sessionService;
    private final AccessGuard accessGuard;

    public AdminUserService(
            AppUserRepository appUserRepository,
            CredentialVerifier credentialVerifier,
            SessionService sessionService,
            AccessGuard accessGuard
    ) {
        this.appUserRepository = appUserRepository;
        this.credentialVerifier = credentialVerifier;
        this.sessionService = sessionService;
        this.accessGuard = accessGuard;
    }

    public AppUser createUser(@NonNull CreateUserCommand command) {
        accessGuard.require(Resource.USERS, Action.CREATE);

        String username = command.username().trim();
        if (appUserRepository.existsByUsernameIgnoreCase(username)) {
            throw usernameTaken();
        }

        AppUser user;
        try {
            user = new AppUser(username, credentialVerifier.hash(command.password()), command.role(), command.branchId());
        } catch (IllegalArgumentException ex) {
            throw invalidBranchScope(ex);
        }
        AppUser saved = save(user);
        log.info("Created user {} with role {}", saved.getId(), saved.getRole());
        return saved;
    }

    /**
     * Applies the non-null fields of {@code command}. Changing the password, role or branch ends every
     * session of the principal, since live tokens carry the old values.
     */
    public AppUser updateUser(@NonNull UUID userId, @NonNull UpdateUserCommand command) {
        accessGuard.require(Resource.USERS, Action.UPDATE);
        AppUser user = findUser(userId);
        boolean revokeSessions = false;

        if (command.username() != null) {
            String username = command.username().trim();
            if (!username.equalsIgnoreCase(user.getUsername())
                    && appUserRepository.existsByUsernameIgnoreCaseAndIdNot(username, userId)) {
                throw usernameTaken();
            }
            user.setUsername(username);
        }

        if (command.role() != null || command.branchId() != null) {
            UserRole role = command.role() != null ? command.role() : user.getRole();
            String branchId = command.branchId() != null ? command.branchId() : user.getBranchId();
            if (command.role() != null && !command.role().isBranchScoped()) {
                branchId = command.branchId();
            }
            try {
                user.assignRole(role, branchId);
            } catch (IllegalArgumentException ex) {
                throw invalidBranchScope(ex);
            }
            revokeSessions = true;
        }

        if (command.password() != null) {
            user.setPasswordHash(credentialVerifier.hash(command.password()));
            revokeSessions = true;
        }

        AppUser saved = save(user);
        if (revokeSessions) {
            sessionService.invalidateAllForPrincipal(userId);
        }
        log.info("Updated user {}", userId);
        return saved;
    }

    public int forceLogout(@NonNull UUID userId) {
        accessGuard.require(Resource.USERS, Action.ADMIN);
        findUser(userId);
        return sessionService.invalidateAllForPrincipal(userId);
    }

    private AppUser save(AppUser user) {
        try {
            return appUserRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            throw new ProblemException(HttpStatus.CONFLICT, "admin.user_conflict", "User conflicts with an existing user", ex);
        }
    }

    private AppUser findUser(UUID userId) {
        return appUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "admin.user_not_found", "User not found"));
    }

    private static ProblemException usernameTaken() {
        return new ProblemException(HttpStatus.CONFLICT, "admin.username_taken", "Username is already in use");
    }

    private static ProblemException invalidBranchScope(IllegalArgumentException ex) {
        return new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "admin.invalid_branch_scope", ex.getMessage(), ex);
    }

    public record CreateUserCommand(String username, String password, UserRole role, String branchId) {
    }

    public record UpdateUserCommand(String username, String password, UserRole role, String branchId) {
    }
}
