// src/main/java/com/social/warbler/security/CredentialStore.java
package com.social.warbler.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/** Salted one-way password hashing (BCrypt). */
@Slf4j
@Component
@RequiredArgsConstructor
public class CredentialStore {

    private final PasswordEncoder encoder;

    public String hash(String password) {
        if (password == null) throw new IllegalArgumentException("password must not be null");
        return encoder.encode(password);
    }

    /** Never throws; a malformed or missing credential simply does not match. */
    public boolean verify(String credential, String password) {
        if (credential == null || password == null) return false;
        try {
            return encoder.matches(password, credential);
        } catch (RuntimeException e) {
            log.warn("Credential verification failed: {}", e.getMessage());
            return false;
        }
    }
}
