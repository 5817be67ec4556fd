package com.astralcore.mfa.domain.mfa;

import java.util.Set;

/**
 * Identity data supplied by the user directory. MFA never changes it.
 */
public record UserAccount(String id, String email, String role) {

    /** Roles with access to PHI. They must keep MFA on. */
    public static final Set<String> MFA_REQUIRED_ROLES = Set.of(
            "THERAPIST", "CRISIS_COUNSELOR", "ADMIN", "SUPER_ADMIN", "COMPLIANCE_OFFICER");

    public boolean requiresMfa() {
        return role != null && MFA_REQUIRED_ROLES.contains(role.toUpperCase());
    }
}
