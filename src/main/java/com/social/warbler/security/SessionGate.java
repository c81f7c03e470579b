// src/main/java/com/social/warbler/security/SessionGate.java
package com.social.warbler.security;

import com.social.warbler.user.model.User;
import jakarta.servlet.http.HttpSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Anonymous / Authenticated(user) state kept in the HTTP session under a
 * single attribute holding the user id.
 */
@Slf4j
@Component
public class SessionGate {

    private final String userKey;

    public SessionGate(@Value("${warbler.session.user-key:curr_user}") String userKey) {
        this.userKey = userKey;
    }

    public void login(HttpSession session, User user) {
        session.setAttribute(userKey, user.getId());
        log.info("User {} logged in", user.getId());
    }

    /** No-op when already anonymous. */
    public void logout(HttpSession session) {
        if (session == null || session.getAttribute(userKey) == null) return;
        Object id = session.getAttribute(userKey);
        session.removeAttribute(userKey);
        log.info("User {} logged out", id);
    }

    public Optional<Long> currentUserId(HttpSession session) {
        if (session == null) return Optional.empty();
        Object v = session.getAttribute(userKey);
        if (v instanceof Long id) return Optional.of(id);
        if (v instanceof Number n) return Optional.of(n.longValue());
        return Optional.empty();
    }
}
