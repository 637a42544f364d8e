package com.kitchzero.backend.modules.auth.application;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Hashes and verifies passwords through the configured adaptive {@link PasswordEncoder}.
 */
@Component
public class CredentialVerifier {

    private final PasswordEncoder passwordEncoder;
    private final String dummyHash;

    public CredentialVerifier(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
        this.dummyHash = passwordEncoder.encode("kitchzero-dummy-password");
    }

    public String hash(String rawPassword) {
        if (rawPassword == null || rawPassword.isEmpty()) {
            throw new IllegalArgumentException("password must not be empty");
        }
        return passwordEncoder.encode(rawPassword);
    }

    public boolean verify(String rawPassword, String passwordHash) {
        if (rawPassword == null || passwordHash == null) {
            return false;
        }
        return passwordEncoder.matches(rawPassword, passwordHash);
    }

    /**
     * Burns one verification against a fixed hash so unknown usernames cost as much as wrong passwords.
     */
    public void verifyAgainstDummy(String rawPassword) {
        passwordEncoder.matches(rawPassword == null ? "" : rawPassword, dummyHash);
    }
}
