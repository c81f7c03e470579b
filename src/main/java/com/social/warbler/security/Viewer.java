package com.social.warbler.security;

/**
 * The acting identity of one request, resolved once by the handler and passed
 * explicitly into every service call.
 */
public record Viewer(Long userId, String username) {

    private static final Viewer ANONYMOUS = new Viewer(null, null);

    public static Viewer anonymous() {
        return ANONYMOUS;
    }

    public static Viewer of(Long userId, String username) {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");
        return new Viewer(userId, username);
    }

    /** Null principal means the request carried no session identity. */
    public static Viewer of(WarblerPrincipal principal) {
        return principal == null ? ANONYMOUS : of(principal.id(), principal.username());
    }

    public boolean isAuthenticated() {
        return userId != null;
    }

    public boolean is(Long otherUserId) {
        return userId != null && userId.equals(otherUserId);
    }
}
