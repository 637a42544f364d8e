package com.kitchzero.backend.modules.auth.presentation;

import com.kitchzero.backend.global.security.SecurityUtils;
import com.kitchzero.backend.modules.auth.application.AuthService;
import com.kitchzero.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/profile")
public class ProfileController {

    private final AuthService authService;

    public ProfileController(AuthService authService) {
        this.authService = authService;
    }

    @GetMapping("/me")
    public ResponseEntity<UserProfileResponse> me() {
        return ResponseEntity.ok(UserProfileResponse.from(authService.loadProfile(SecurityUtils.getCurrentUserId())));
    }
}
