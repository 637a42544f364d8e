package com.kitchzero.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * HMAC keys for the two token kinds. The keys are kept apart so that a leaked access-token secret cannot be
 * used to mint refresh tokens.
 */
@Component
public class JwtSigningKeys {

    private static final String HMAC_SHA_256 = "HmacSHA256";
    private static final int MIN_KEY_BYTES = 32;

    private final SecretKey accessKey;
    private final SecretKey refreshKey;

    public JwtSigningKeys(
            @Value("${app.auth.jwt.access-secret}") String accessSecret,
            @Value("${app.auth.jwt.refresh-secret}") String refreshSecret
    ) {
        byte[] accessBytes = decode("access", accessSecret);
        byte[] refreshBytes = decode("refresh", refreshSecret);
        if (MessageDigest.isEqual(accessBytes, refreshBytes)) {
            throw new IllegalStateException("Access and refresh token secrets must differ");
        }
        this.accessKey = new SecretKeySpec(accessBytes, HMAC_SHA_256);
        this.refreshKey = new SecretKeySpec(refreshBytes, HMAC_SHA_256);
    }

    public SecretKey getAccessKey() {
        return accessKey;
    }

    public SecretKey getRefreshKey() {
        return refreshKey;
    }

    private static byte[] decode(String kind, String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("The " + kind + " token secret is not configured");
        }
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(secret);
        } catch (IllegalArgumentException ex) {
            keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        }
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new IllegalStateException("The " + kind + " token secret must be at least " + MIN_KEY_BYTES + " bytes");
        }
        return keyBytes;
    }
}
