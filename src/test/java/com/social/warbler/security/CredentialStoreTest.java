package com.social.warbler.security;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

class CredentialStoreTest {

    private CredentialStore store;

    @BeforeEach
    void setUp() {
        store = new CredentialStore(new BCryptPasswordEncoder(4));
    }

    @Test
    void hashIsNeverThePlaintext() {
        assertThat(store.hash("secret")).isNotEqualTo("secret");
    }

    @Test
    void sameInputHashesDifferentlyButVerifiesBoth() {
        String first = store.hash("secret");
        String second = store.hash("secret");

        assertThat(first).isNotEqualTo(second);
        assertThat(store.verify(first, "secret")).isTrue();
        assertThat(store.verify(second, "secret")).isTrue();
    }

    @Test
    void wrongPasswordDoesNotVerify() {
        assertThat(store.verify(store.hash("secret"), "Secret")).isFalse();
    }

    @Test
    void malformedOrMissingCredentialReturnsFalse() {
        assertThat(store.verify("not-a-bcrypt-hash", "secret")).isFalse();
        assertThat(store.verify(null, "secret")).isFalse();
        assertThat(store.verify(store.hash("secret"), null)).isFalse();
    }
}
