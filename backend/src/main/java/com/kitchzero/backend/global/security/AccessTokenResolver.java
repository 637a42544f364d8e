package com.kitchzero.backend.global.security;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;
import org.springframework.web.util.WebUtils;

/**
 * Reads the raw access token from the {@value #ACCESS_COOKIE} cookie or a bearer header.
 */
public final class AccessTokenResolver {

    public static final String ACCESS_COOKIE = "access-token";
    private static final String BEARER_PREFIX = "Bearer ";

    private AccessTokenResolver() {
    }

    public static String resolve(HttpServletRequest request) {
        Cookie cookie = WebUtils.getCookie(request, ACCESS_COOKIE);
        if (cookie != null && cookie.getValue() != null && !cookie.getValue().isBlank()) {
            return cookie.getValue();
        }
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? null : token;
        }
        return null;
    }
}
