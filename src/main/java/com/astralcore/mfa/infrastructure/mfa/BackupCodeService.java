package com.astralcore.mfa.infrastructure.mfa;

import com.astralcore.mfa.config.MfaProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Service
public class BackupCodeService {

    private static final Logger log = LoggerFactory.getLogger(BackupCodeService.class);

    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    private final int count;
    private final int length;
    private final SecureRandom secureRandom = new SecureRandom();

    public BackupCodeService(MfaProperties properties) {
        this.count = properties.getBackupCodes().getCount();
        this.length = properties.getBackupCodes().getLength();
    }

    /**
     * Generate a fresh batch of recovery codes
     */
    public List<String> generateBackupCodes() {
        List<String> codes = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            codes.add(generateBackupCode());
        }
        log.debug("Generated {} backup codes", count);
        return codes;
    }

    private String generateBackupCode() {
        StringBuilder code = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            code.append(ALPHABET.charAt(secureRandom.nextInt(ALPHABET.length())));
        }
        return code.toString();
    }

    /**
     * Users type codes off paper, so surrounding whitespace and case are ignored.
     */
    public String normalize(String code) {
        return code == null ? null : code.trim().toUpperCase(Locale.ROOT);
    }

    public boolean isValidFormat(String code) {
        if (code == null || code.length() != length) {
            return false;
        }
        return code.matches("^[A-Z0-9]+$");
    }
}
