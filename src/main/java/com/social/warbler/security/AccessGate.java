// src/main/java/com/social/warbler/security/AccessGate.java
package com.social.warbler.security;

import com.social.warbler.error.UnauthorizedException;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * The one guard every privileged operation passes through. An anonymous viewer
 * is refused before the wrapped action reads or writes anything.
 */
@Slf4j
public final class AccessGate {

    private AccessGate() {}

    /** Returns the acting user id or throws {@link UnauthorizedException}. */
    public static Long requireUser(Viewer viewer) {
        if (viewer == null || !viewer.isAuthenticated()) {
            log.warn("Refused privileged operation for anonymous viewer");
            throw new UnauthorizedException();
        }
        return viewer.userId();
    }

    public static <T> T guard(Viewer viewer, Function<Long, T> action) {
        Long userId = requireUser(viewer);
        return action.apply(userId);
    }

    public static void run(Viewer viewer, Consumer<Long> action) {
        Long userId = requireUser(viewer);
        action.accept(userId);
    }
}
