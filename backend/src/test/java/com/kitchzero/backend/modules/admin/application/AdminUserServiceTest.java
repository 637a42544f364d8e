package com.kitchzero.backend.modules.admin.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;
import java.util.UUID;

import com.kitchzero.backend.global.error.ProblemException;
import com.kitchzero.backend.modules.access.application.AccessGuard;
import com.kitchzero.backend.modules.admin.application.AdminUserService.UpdateUserCommand;
import com.kitchzero.backend.modules.auth.AuthTestFixtures;
import com.kitchzero.backend.modules.auth.application.CredentialVerifier;
import com.kitchzero.backend.modules.auth.application.SessionService;
import com.kitchzero.backend.modules.auth.domain.AppUser;
import com.kitchzero.backend.modules.auth.domain.UserRole;
import com.kitchzero.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class AdminUserServiceTest {

    @Mock
    private AppUserRepository appUserRepository;

    @Mock
    private CredentialVerifier credentialVerifier;

    @Mock
    private SessionService sessionService;

    @Mock
    private AccessGuard accessGuard;

    @InjectMocks
    private AdminUserService adminUserService;

    private final UUID userId = UUID.randomUUID();
    private AppUser manager;

    @BeforeEach
    void setUp() {
        manager = AuthTestFixtures.user(userId, "manager", UserRole.BRANCH_ADMIN, "b1", "old-hash");
        when(appUserRepository.findById(userId)).thenReturn(Optional.of(manager));
        lenient().when(appUserRepository.saveAndFlush(any(AppUser.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void moveToAnotherBranchRevokesSessions() {
        adminUserService.updateUser(userId, new UpdateUserCommand(null, null, null, "b2"));

        assertThat(manager.getBranchId()).isEqualTo("b2");
        verify(sessionService).invalidateAllForPrincipal(userId);
    }

    @Test
    void promotionToSuperAdminDropsBranch() {
        adminUserService.updateUser(userId, new UpdateUserCommand(null, null, UserRole.SUPER_ADMIN, null));

        assertThat(manager.getRole()).isEqualTo(UserRole.SUPER_ADMIN);
        assertThat(manager.getBranchId()).isNull();
        verify(sessionService).invalidateAllForPrincipal(userId);
    }

    @Test
    void passwordChangeRehashesAndRevokes() {
        when(credentialVerifier.hash("brand-new-pass")).thenReturn("new-hash");

        adminUserService.updateUser(userId, new UpdateUserCommand(null, "brand-new-pass", null, null));

        assertThat(manager.getPasswordHash()).isEqualTo("new-hash");
        verify(sessionService).invalidateAllForPrincipal(userId);
    }

    @Test
    void renameKeepsSessions() {
        when(appUserRepository.existsByUsernameIgnoreCaseAndIdNot("kitchen-lead", userId)).thenReturn(false);

        adminUserService.updateUser(userId, new UpdateUserCommand("kitchen-lead", null, null, null));

        assertThat(manager.getUsername()).isEqualTo("kitchen-lead");
        verify(sessionService, never()).invalidateAllForPrincipal(any());
    }

    @Test
    void invalidScopeIsUnprocessable() {
        assertThatThrownBy(() ->
                adminUserService.updateUser(userId, new UpdateUserCommand(null, null, UserRole.SUPER_ADMIN, "b1")))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getHttpStatus()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
                    assertThat(ex.getCode()).isEqualTo("admin.invalid_branch_scope");
                });
        assertThat(manager.getBranchId()).isEqualTo("b1");
    }
}
