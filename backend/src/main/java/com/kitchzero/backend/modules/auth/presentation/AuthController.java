package com.kitchzero.backend.modules.auth.presentation;

import com.kitchzero.backend.global.error.AuthErrorCode;
import com.kitchzero.backend.global.error.AuthException;
import com.kitchzero.backend.global.security.AuthenticatedPrincipal;
import com.kitchzero.backend.global.security.SecurityUtils;
import com.kitchzero.backend.global.web.ClientAddressResolver;
import com.kitchzero.backend.modules.auth.application.AuthService;
import com.kitchzero.backend.modules.auth.application.CsrfGuard;
import com.kitchzero.backend.modules.auth.application.IssuedSession;
import com.kitchzero.backend.modules.auth.presentation.dto.CsrfTokenResponse;
import com.kitchzero.backend.modules.auth.presentation.dto.LoginRequest;
import com.kitchzero.backend.modules.auth.presentation.dto.LoginResponse;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

    private final AuthService authService;
    private final CsrfGuard csrfGuard;
    private final AuthCookieFactory cookieFactory;

    public AuthController(AuthService authService, CsrfGuard csrfGuard, AuthCookieFactory cookieFactory) {
        this.authService = authService;
        this.csrfGuard = csrfGuard;
        this.cookieFactory = cookieFactory;
    }

    @GetMapping("/auth/csrf")
    public ResponseEntity<CsrfTokenResponse> csrf() {
        String token = csrfGuard.issue();
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookieFactory.csrfToken(token).toString())
                .body(new CsrfTokenResponse(token));
    }

    @PostMapping("/auth/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request, HttpServletRequest httpRequest) {
        IssuedSession session = authService.login(
                request.username(), request.password(), ClientAddressResolver.resolve(httpRequest));
        return withTokenCookies(session);
    }

    @PostMapping("/auth/refresh")
    public ResponseEntity<LoginResponse> refresh(
            @CookieValue(name = AuthCookieFactory.REFRESH_COOKIE, required = false) String refreshToken
    ) {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new AuthException(AuthErrorCode.INVALID_TOKEN);
        }
        return withTokenCookies(authService.refresh(refreshToken));
    }

    @PostMapping("/auth/logout")
    public ResponseEntity<Void> logout() {
        SecurityUtils.findCurrentPrincipal()
                .map(AuthenticatedPrincipal::sessionId)
                .ifPresent(authService::logout);
        return ResponseEntity.noContent()
                .header(HttpHeaders.SET_COOKIE, cookieFactory.expiredAccessToken().toString())
                .header(HttpHeaders.SET_COOKIE, cookieFactory.expiredRefreshToken().toString())
                .build();
    }

    private ResponseEntity<LoginResponse> withTokenCookies(IssuedSession session) {
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookieFactory.accessToken(session.accessToken().token()).toString())
                .header(HttpHeaders.SET_COOKIE, cookieFactory.refreshToken(session.refreshToken().token()).toString())
                .body(LoginResponse.from(session));
    }
}
