package com.kitchzero.backend.modules.auth.presentation;

import java.time.Duration;

import com.kitchzero.backend.global.security.AccessTokenResolver;
import com.kitchzero.backend.modules.auth.application.CsrfGuard;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

/**
 * Builds the HttpOnly, SameSite=Lax cookies that carry tokens to the browser.
 */
@Component
public class AuthCookieFactory {

    public static final String REFRESH_COOKIE = "refresh-token";
    public static final String REFRESH_PATH = "/auth/refresh";

    private final boolean secure;
    private final Duration accessTtl;
    private final Duration refreshTtl;

    public AuthCookieFactory(
            @Value("${app.cookies.secure:false}") boolean secure,
            @Value("${app.auth.jwt.access-ttl:PT15M}") Duration accessTtl,
            @Value("${app.auth.jwt.refresh-ttl:P7D}") Duration refreshTtl
    ) {
        this.secure = secure;
        this.accessTtl = accessTtl;
        this.refreshTtl = refreshTtl;
    }

    public ResponseCookie accessToken(String token) {
        return build(AccessTokenResolver.ACCESS_COOKIE, token, "/", accessTtl);
    }

    public ResponseCookie refreshToken(String token) {
        return build(REFRESH_COOKIE, token, REFRESH_PATH, refreshTtl);
    }

    public ResponseCookie csrfToken(String token) {
        return build(CsrfGuard.COOKIE_NAME, token, "/", refreshTtl);
    }

    public ResponseCookie expiredAccessToken() {
        return build(AccessTokenResolver.ACCESS_COOKIE, "", "/", Duration.ZERO);
    }

    public ResponseCookie expiredRefreshToken() {
        return build(REFRESH_COOKIE, "", REFRESH_PATH, Duration.ZERO);
    }

    private ResponseCookie build(String name, String value, String path, Duration maxAge) {
        return ResponseCookie.from(name, value)
                .httpOnly(true)
                .secure(secure)
                .sameSite("Lax")
                .path(path)
                .maxAge(maxAge)
                .build();
    }
}
