// ==============================================================================
// MFA Enrollment Service - setup of TOTP, SMS and EMAIL factors
// File: src/main/java/com/astralcore/mfa/application/MfaEnrollmentService.java
// ==============================================================================

package com.astralcore.mfa.application;

import com.astralcore.mfa.domain.audit.AuditCategory;
import com.astralcore.mfa.domain.audit.RiskLevel;
import com.astralcore.mfa.domain.mfa.MfaFactor;
import com.astralcore.mfa.domain.mfa.MfaMethod;
import com.astralcore.mfa.domain.mfa.MfaSetting;
import com.astralcore.mfa.domain.mfa.MfaStatus;
import com.astralcore.mfa.domain.ports.MfaSettingStore;
import com.astralcore.mfa.exception.MfaAlreadyConfiguredException;
import com.astralcore.mfa.exception.MfaNotFoundException;
import com.astralcore.mfa.exception.MfaValidationException;
import com.astralcore.mfa.exception.UnsupportedMfaMethodException;
import com.astralcore.mfa.infrastructure.encryption.SecretVault;
import com.astralcore.mfa.infrastructure.mfa.BackupCodeService;
import com.astralcore.mfa.infrastructure.mfa.ChallengeCodeService;
import com.astralcore.mfa.infrastructure.mfa.Masking;
import com.astralcore.mfa.infrastructure.mfa.TotpCodeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

@Service
public class MfaEnrollmentService {

    private static final Logger log = LoggerFactory.getLogger(MfaEnrollmentService.class);

    private static final Pattern E164 = Pattern.compile("^\\+[1-9]\\d{1,14}$");

    private final MfaSettingStore store;
    private final SecretVault vault;
    private final TotpCodeService totpCodeService;
    private final BackupCodeService backupCodeService;
    private final ChallengeCodeService challengeCodeService;
    private final MfaCodeChecker codeChecker;
    private final MfaAttemptGuard guard;
    private final MfaAuditEmitter audit;
    private final Clock clock;

    public MfaEnrollmentService(MfaSettingStore store, SecretVault vault, TotpCodeService totpCodeService,
                                BackupCodeService backupCodeService, ChallengeCodeService challengeCodeService,
                                MfaCodeChecker codeChecker, MfaAttemptGuard guard, MfaAuditEmitter audit,
                                Clock clock) {
        this.store = store;
        this.vault = vault;
        this.totpCodeService = totpCodeService;
        this.backupCodeService = backupCodeService;
        this.challengeCodeService = challengeCodeService;
        this.codeChecker = codeChecker;
        this.guard = guard;
        this.audit = audit;
        this.clock = clock;
    }

    /**
     * Start TOTP enrolment: new shared secret, provisioning URI, QR image and a fresh batch of backup codes.
     * The setting stays PENDING_SETUP until {@link #verifySetup} accepts a code.
     */
    @Transactional
    public TotpSetupResult setupTotp(String userId, String email) {
        log.info("🔧 Initiating TOTP setup for user: {}", userId);
        requireReenrollable(userId, email, MfaMethod.TOTP);

        String secret = totpCodeService.generateSecret();
        String uri = totpCodeService.provisioningUri(email, secret);
        String qrCodeImage = totpCodeService.generateQrCode(uri);
        List<String> backupCodes = backupCodeService.generateBackupCodes();

        store.upsertPending(userId, new MfaFactor.Totp(vault.encrypt(secret), null),
                encryptAll(backupCodes), OffsetDateTime.now(clock));

        audit.success(AuditCategory.ENROLLMENT, "MFA_SETUP_INITIATED", RiskLevel.MEDIUM,
                "TOTP setup initiated", userId, email, MfaMethod.TOTP, methodMetadata(MfaMethod.TOTP));

        log.info("✅ TOTP setup initiated for user: {}", userId);
        return new TotpSetupResult(secret, uri, qrCodeImage, backupCodes);
    }

    /**
     * Start SMS enrolment and send the first challenge to {@code phoneNumber}.
     *
     * @throws MfaValidationException if the number is not E.164
     */
    @Transactional
    public ChallengeSetupResult setupSms(String userId, String email, String phoneNumber) {
        log.info("🔧 Initiating SMS setup for user: {}", userId);
        if (phoneNumber == null || !E164.matcher(phoneNumber).matches()) {
            throw new MfaValidationException("Phone number must be in E.164 format, e.g. +15551234567");
        }
        requireReenrollable(userId, email, MfaMethod.SMS);

        List<String> backupCodes = backupCodeService.generateBackupCodes();
        store.upsertPending(userId, new MfaFactor.Sms(vault.encrypt(phoneNumber)),
                encryptAll(backupCodes), OffsetDateTime.now(clock));
        challengeCodeService.issue(userId, MfaMethod.SMS, phoneNumber);

        String masked = Masking.maskPhoneNumber(phoneNumber);
        Map<String, Object> metadata = methodMetadata(MfaMethod.SMS);
        metadata.put("destination", masked);
        audit.success(AuditCategory.ENROLLMENT, "MFA_SETUP_INITIATED", RiskLevel.MEDIUM,
                "SMS setup initiated", userId, email, MfaMethod.SMS, metadata);

        log.info("✅ SMS setup initiated for user: {} ({})", userId, masked);
        return new ChallengeSetupResult(MfaMethod.SMS, masked, backupCodes);
    }

    /**
     * Start EMAIL enrolment; the challenge goes to the account address.
     */
    @Transactional
    public ChallengeSetupResult setupEmail(String userId, String email) {
        log.info("🔧 Initiating EMAIL setup for user: {}", userId);
        if (email == null || email.isBlank() || email.indexOf('@') < 1) {
            throw new MfaValidationException("A valid account email is required for EMAIL verification");
        }
        requireReenrollable(userId, email, MfaMethod.EMAIL);

        List<String> backupCodes = backupCodeService.generateBackupCodes();
        store.upsertPending(userId, new MfaFactor.Email(), encryptAll(backupCodes), OffsetDateTime.now(clock));
        challengeCodeService.issue(userId, MfaMethod.EMAIL, email);

        String masked = Masking.maskEmail(email);
        Map<String, Object> metadata = methodMetadata(MfaMethod.EMAIL);
        metadata.put("destination", masked);
        audit.success(AuditCategory.ENROLLMENT, "MFA_SETUP_INITIATED", RiskLevel.MEDIUM,
                "EMAIL setup initiated", userId, email, MfaMethod.EMAIL, metadata);

        log.info("✅ EMAIL setup initiated for user: {}", userId);
        return new ChallengeSetupResult(MfaMethod.EMAIL, masked, backupCodes);
    }

    /**
     * Confirm a pending enrolment with the first code. A wrong code counts against the lockout policy and
     * returns {@code success=false}; it does not throw.
     */
    @Transactional
    public SetupVerificationResult verifySetup(String userId, String email, MfaMethod method, String code) {
        log.info("🔧 Verifying {} setup for user: {}", method, userId);
        if (method == MfaMethod.BACKUP_CODE) {
            throw new UnsupportedMfaMethodException(method, "setup verification");
        }
        boolean wellFormed = method == MfaMethod.TOTP
                ? totpCodeService.isValidCodeFormat(code)
                : challengeCodeService.isValidCodeFormat(code);
        if (!wellFormed) {
            throw new MfaValidationException("Verification code must be 6 digits");
        }

        MfaSetting setting = store.findOne(userId, method)
                .filter(MfaSetting::isPendingSetup)
                .orElseThrow(() -> new MfaNotFoundException("No pending " + method + " setup found"));

        guard.ensureNotLocked(setting, email, method, MfaAttemptGuard.Phase.SETUP);

        MfaCodeChecker.Outcome outcome = method == MfaMethod.TOTP
                ? codeChecker.checkTotp(setting, email, code)
                : codeChecker.checkChallenge(setting, code);

        if (!outcome.accepted()) {
            log.warn("❌ {} setup verification failed for user: {}", method, userId);
            MfaAttemptGuard.FailureOutcome failure = guard.recordFailure(setting, email, method,
                    MfaAttemptGuard.Phase.SETUP, reasonOf(outcome));
            return SetupVerificationResult.failed(failure.getRemainingAttempts(), failure.getLockedUntil());
        }

        guard.recordSuccess(setting, email, method, MfaAttemptGuard.Phase.SETUP, MfaStatus.ENABLED);
        List<String> backupCodes = setting.getBackupCodes().stream()
                .map(encrypted -> guard.reveal(setting, encrypted, email))
                .toList();

        audit.success(AuditCategory.ENROLLMENT, "MFA_SETUP_COMPLETED", RiskLevel.MEDIUM,
                method + " setup completed", userId, email, method, methodMetadata(method));

        log.info("✅ {} setup completed for user: {}", method, userId);
        return SetupVerificationResult.completed(backupCodes, guard.remainingAttempts(0));
    }

    /**
     * Replace the backup codes of an ENABLED setting. Codes from the previous batch stop working.
     */
    @Transactional
    public List<String> regenerateBackupCodes(String userId, String email, MfaMethod method) {
        log.info("🔄 Regenerating backup codes for user: {} on {}", userId, method);
        if (method == MfaMethod.BACKUP_CODE) {
            throw new UnsupportedMfaMethodException(method, "backup code regeneration");
        }

        MfaSetting setting = store.findOne(userId, method)
                .filter(MfaSetting::isEnabled)
                .orElseThrow(() -> new MfaNotFoundException("No enabled " + method + " setting found"));

        List<String> backupCodes = backupCodeService.generateBackupCodes();
        store.replaceBackupCodes(setting.getId(), encryptAll(backupCodes), OffsetDateTime.now(clock));

        Map<String, Object> metadata = methodMetadata(method);
        metadata.put("count", backupCodes.size());
        audit.success(AuditCategory.ENROLLMENT, "MFA_BACKUP_CODES_REGENERATED", RiskLevel.MEDIUM,
                "Backup codes regenerated", userId, email, method, metadata);

        log.info("✅ Backup codes regenerated for user: {}", userId);
        return backupCodes;
    }

    // ========================================================================
    // PRIVATE HELPER METHODS
    // ========================================================================

    private void requireReenrollable(String userId, String email, MfaMethod method) {
        store.findOne(userId, method).ifPresent(existing -> {
            if (existing.isEnabled()) {
                log.warn("❌ {} already enabled for user: {}", method, userId);
                throw new MfaAlreadyConfiguredException(method + " is already enabled for this user");
            }
            // a new setup must not clear an active lockout
            guard.ensureNotLocked(existing, email, method, MfaAttemptGuard.Phase.SETUP);
        });
    }

    private List<String> encryptAll(List<String> codes) {
        return codes.stream().map(vault::encrypt).toList();
    }

    private static Map<String, Object> methodMetadata(MfaMethod method) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("mfaMethod", method.name());
        return metadata;
    }

    static String reasonOf(MfaCodeChecker.Outcome outcome) {
        return outcome == MfaCodeChecker.Outcome.REPLAYED ? "replayed_code" : "invalid_code";
    }

    // ========================================================================
    // RESULT CLASSES
    // ========================================================================

    public static class TotpSetupResult {
        private final String secret;
        private final String provisioningUri;
        private final String qrCodeImage;
        private final List<String> backupCodes;

        public TotpSetupResult(String secret, String provisioningUri, String qrCodeImage, List<String> backupCodes) {
            this.secret = secret;
            this.provisioningUri = provisioningUri;
            this.qrCodeImage = qrCodeImage;
            this.backupCodes = List.copyOf(backupCodes);
        }

        public String getSecret() { return secret; }
        public String getProvisioningUri() { return provisioningUri; }
        public String getQrCodeImage() { return qrCodeImage; }
        public List<String> getBackupCodes() { return backupCodes; }
    }

    public static class ChallengeSetupResult {
        private final MfaMethod method;
        private final String maskedDestination;
        private final List<String> backupCodes;

        public ChallengeSetupResult(MfaMethod method, String maskedDestination, List<String> backupCodes) {
            this.method = method;
            this.maskedDestination = maskedDestination;
            this.backupCodes = List.copyOf(backupCodes);
        }

        public MfaMethod getMethod() { return method; }
        public String getMaskedDestination() { return maskedDestination; }
        public List<String> getBackupCodes() { return backupCodes; }
    }

    public static class SetupVerificationResult {
        private final boolean success;
        private final List<String> backupCodes;
        private final int remainingAttempts;
        private final OffsetDateTime lockedUntil;

        private SetupVerificationResult(boolean success, List<String> backupCodes, int remainingAttempts,
                                        OffsetDateTime lockedUntil) {
            this.success = success;
            this.backupCodes = backupCodes;
            this.remainingAttempts = remainingAttempts;
            this.lockedUntil = lockedUntil;
        }

        static SetupVerificationResult completed(List<String> backupCodes, int remainingAttempts) {
            return new SetupVerificationResult(true, List.copyOf(backupCodes), remainingAttempts, null);
        }

        static SetupVerificationResult failed(int remainingAttempts, OffsetDateTime lockedUntil) {
            return new SetupVerificationResult(false, List.of(), remainingAttempts, lockedUntil);
        }

        public boolean isSuccess() { return success; }
        public List<String> getBackupCodes() { return backupCodes; }
        public int getRemainingAttempts() { return remainingAttempts; }
        public OffsetDateTime getLockedUntil() { return lockedUntil; }
    }
}
