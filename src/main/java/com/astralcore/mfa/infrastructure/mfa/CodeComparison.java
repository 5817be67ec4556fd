package com.astralcore.mfa.infrastructure.mfa;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Constant-time string comparison for codes and digests.
 */
public final class CodeComparison {

    private CodeComparison() {
    }

    public static boolean matches(String expected, String candidate) {
        if (expected == null || candidate == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                candidate.getBytes(StandardCharsets.UTF_8));
    }
}
