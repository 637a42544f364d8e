package com.kitchzero.backend.modules.admin.presentation;

import java.net.URI;
import java.util.UUID;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.kitchzero.backend.modules.admin.application.AdminUserService;
import com.kitchzero.backend.modules.admin.application.AdminUserService.CreateUserCommand;
import com.kitchzero.backend.modules.admin.application.AdminUserService.UpdateUserCommand;
import com.kitchzero.backend.modules.admin.presentation.dto.CreateUserRequest;
import com.kitchzero.backend.modules.admin.presentation.dto.ForceLogoutResponse;
import com.kitchzero.backend.modules.admin.presentation.dto.UpdateUserRequest;
import com.kitchzero.backend.modules.auth.domain.AppUser;
import com.kitchzero.backend.modules.auth.presentation.dto.UserProfileResponse;

@RestController
@RequestMapping("/users")
public class AdminUserController {

    private final AdminUserService adminUserService;

    public AdminUserController(AdminUserService adminUserService) {
        this.adminUserService = adminUserService;
    }

    @PostMapping
    public ResponseEntity<UserProfileResponse> createUser(@Valid @RequestBody CreateUserRequest request) {
        AppUser user = adminUserService.createUser(new CreateUserCommand(
                request.username(), request.password(), request.role(), request.branchId()));
        return ResponseEntity.created(URI.create("/users/" + user.getId()))
                .body(UserProfileResponse.from(user));
    }

    @PutMapping("/{userId}")
    public ResponseEntity<UserProfileResponse> updateUser(
            @PathVariable UUID userId,
            @Valid @RequestBody UpdateUserRequest request
    ) {
        AppUser user = adminUserService.updateUser(userId, new UpdateUserCommand(
                request.username(), request.password(), request.role(), request.branchId()));
        return ResponseEntity.ok(UserProfileResponse.from(user));
    }

    @DeleteMapping("/{userId}/sessions")
    public ResponseEntity<ForceLogoutResponse> forceLogout(@PathVariable UUID userId) {
        return ResponseEntity.ok(new ForceLogoutResponse(adminUserService.forceLogout(userId)));
    }
}
