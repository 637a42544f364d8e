package com.kitchzero.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

class CredentialVerifierTest {

    private final CredentialVerifier verifier = new CredentialVerifier(new BCryptPasswordEncoder(4));

    @Test
    @DisplayName("hashes carry the bcrypt prefix and work factor and are salted")
    void hashEncodesAlgorithmAndCost() {
        String first = verifier.hash("correct horse");
        String second = verifier.hash("correct horse");

        assertThat(first).startsWith("$2a$04$");
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void verifyAcceptsOnlyTheOriginalPassword() {
        String hash = verifier.hash("correct horse");

        assertThat(verifier.verify("correct horse", hash)).isTrue();
        assertThat(verifier.verify("correct hors", hash)).isFalse();
        assertThat(verifier.verify("Correct horse", hash)).isFalse();
    }

    @Test
    void verifyRejectsMissingInput() {
        assertThat(verifier.verify(null, verifier.hash("x1234567"))).isFalse();
        assertThat(verifier.verify("x1234567", null)).isFalse();
    }

    @Test
    void hashRejectsEmptyPassword() {
        assertThatThrownBy(() -> verifier.hash(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
