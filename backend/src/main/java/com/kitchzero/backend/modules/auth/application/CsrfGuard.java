package com.kitchzero.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.HexFormat;

import org.springframework.stereotype.Component;

/**
 * Stateless double-submit CSRF tokens. Nothing is stored server-side: a request is accepted when the
 * {@value #COOKIE_NAME} cookie and the {@value #HEADER_NAME} header carry the same non-empty value.
 */
@Component
public class CsrfGuard {

    public static final String COOKIE_NAME = "csrf-token";
    public static final String HEADER_NAME = "X-CSRF-Token";
    private static final int TOKEN_BYTES = 32;

    private final SecureRandom secureRandom = new SecureRandom();

    public String issue() {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    public boolean verify(String cookieValue, String headerValue) {
        if (cookieValue == null || headerValue == null || cookieValue.isEmpty() || headerValue.isEmpty()) {
            return false;
        }
        return MessageDigest.isEqual(
                cookieValue.getBytes(StandardCharsets.UTF_8),
                headerValue.getBytes(StandardCharsets.UTF_8)
        );
    }
}
