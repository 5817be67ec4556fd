package com.astralcore.mfa.infrastructure.mfa;

/**
 * Display forms of delivery destinations for responses, audit metadata and logs.
 */
public final class Masking {

    private static final String MASK = "****";

    private Masking() {
    }

    /** {@code +15551234567} becomes {@code +1555123****}. */
    public static String maskPhoneNumber(String phoneNumber) {
        if (phoneNumber == null || phoneNumber.length() < 4) {
            return MASK;
        }
        return phoneNumber.substring(0, phoneNumber.length() - 4) + MASK;
    }

    /** {@code jane@example.org} becomes {@code ja***@example.org}. */
    public static String maskEmail(String email) {
        if (email == null) {
            return MASK;
        }
        int at = email.indexOf('@');
        if (at < 0) {
            return MASK;
        }
        String username = email.substring(0, at);
        String domain = email.substring(at + 1);
        if (username.length() <= 2) {
            return "**@" + domain;
        }
        return username.substring(0, 2) + "***@" + domain;
    }
}
