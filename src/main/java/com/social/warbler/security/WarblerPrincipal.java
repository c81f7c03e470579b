// src/main/java/com/social/warbler/security/WarblerPrincipal.java
package com.social.warbler.security;

import java.security.Principal;

public record WarblerPrincipal(Long id, String username) implements Principal {
    @Override public String getName() {
        return username != null ? username : String.valueOf(id);
    }
}
