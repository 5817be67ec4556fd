package com.astralcore.mfa.config;

import java.util.Set;

/**
 * Principal placed in the security context by {@link JwtAuthFilter}.
 */
public record AuthenticatedUser(String userId, String email, Set<String> roles) {

    public boolean isAdmin() {
        return roles.contains("ADMIN") || roles.contains("SUPER_ADMIN");
    }
}
