// ==============================================================================
// MFA Verification Service - login-time verification, challenges and revocation
// File: src/main/java/com/astralcore/mfa/application/MfaVerificationService.java
// ==============================================================================

package com.astralcore.mfa.application;

import com.astralcore.mfa.config.MfaProperties;
import com.astralcore.mfa.domain.audit.AuditCategory;
import com.astralcore.mfa.domain.audit.RiskLevel;
import com.astralcore.mfa.domain.mfa.MfaFactor;
import com.astralcore.mfa.domain.mfa.MfaMethod;
import com.astralcore.mfa.domain.mfa.MfaSetting;
import com.astralcore.mfa.domain.mfa.MfaStatus;
import com.astralcore.mfa.domain.mfa.TrustedDevice;
import com.astralcore.mfa.domain.mfa.UserAccount;
import com.astralcore.mfa.domain.ports.MfaSettingStore;
import com.astralcore.mfa.domain.ports.TrustedDeviceStore;
import com.astralcore.mfa.domain.ports.UserDirectory;
import com.astralcore.mfa.exception.MfaNotFoundException;
import com.astralcore.mfa.exception.MfaPermissionException;
import com.astralcore.mfa.exception.MfaValidationException;
import com.astralcore.mfa.exception.UnsupportedMfaMethodException;
import com.astralcore.mfa.infrastructure.mfa.BackupCodeService;
import com.astralcore.mfa.infrastructure.mfa.ChallengeCodeService;
import com.astralcore.mfa.infrastructure.mfa.DeviceTrustTokenService;
import com.astralcore.mfa.infrastructure.mfa.Masking;
import com.astralcore.mfa.infrastructure.mfa.TotpCodeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class MfaVerificationService {

    private static final Logger log = LoggerFactory.getLogger(MfaVerificationService.class);

    /** Order in which an enabled setting is picked to carry backup-code attempts. */
    private static final List<MfaMethod> PRIMARY_ORDER = List.of(MfaMethod.TOTP, MfaMethod.SMS, MfaMethod.EMAIL);

    private final MfaSettingStore store;
    private final TrustedDeviceStore trustedDevices;
    private final UserDirectory userDirectory;
    private final TotpCodeService totpCodeService;
    private final BackupCodeService backupCodeService;
    private final ChallengeCodeService challengeCodeService;
    private final DeviceTrustTokenService trustTokenService;
    private final MfaCodeChecker codeChecker;
    private final MfaAttemptGuard guard;
    private final MfaAuditEmitter audit;
    private final Clock clock;
    private final boolean trustedDevicesEnabled;

    public MfaVerificationService(
            MfaSettingStore store,
            TrustedDeviceStore trustedDevices,
            UserDirectory userDirectory,
            TotpCodeService totpCodeService,
            BackupCodeService backupCodeService,
            ChallengeCodeService challengeCodeService,
            DeviceTrustTokenService trustTokenService,
            MfaCodeChecker codeChecker,
            MfaAttemptGuard guard,
            MfaAuditEmitter audit,
            MfaProperties properties,
            Clock clock) {
        this.store = store;
        this.trustedDevices = trustedDevices;
        this.userDirectory = userDirectory;
        this.totpCodeService = totpCodeService;
        this.backupCodeService = backupCodeService;
        this.challengeCodeService = challengeCodeService;
        this.trustTokenService = trustTokenService;
        this.codeChecker = codeChecker;
        this.guard = guard;
        this.audit = audit;
        this.clock = clock;
        this.trustedDevicesEnabled = properties.getTrustedDevices().isEnabled();

        log.info("✅ MFA verification service initialized - TrustedDevices: {}", trustedDevicesEnabled);
    }

    // ========================================================================
    // VERIFICATION
    // ========================================================================

    /**
     * Verify a login-time code. A wrong code returns {@code success=false} and counts against the lockout policy.
     *
     * @throws com.astralcore.mfa.exception.MfaLockedException while the setting is locked
     */
    @Transactional
    public VerificationResult verifyMfa(String userId, String email, MfaMethod method, String code,
                                        boolean trustDevice) {
        log.info("🔍 Verifying {} code for user: {}", method, userId);
        if (method == null) {
            throw new MfaValidationException("MFA method is required");
        }
        if (method == MfaMethod.BACKUP_CODE) {
            return verifyBackupCode(userId, email, code, trustDevice);
        }

        boolean wellFormed = method == MfaMethod.TOTP
                ? totpCodeService.isValidCodeFormat(code)
                : challengeCodeService.isValidCodeFormat(code);
        if (!wellFormed) {
            throw new MfaValidationException("Verification code must be 6 digits");
        }

        MfaSetting setting = store.findOne(userId, method)
                .filter(MfaSetting::isEnabled)
                .orElseThrow(() -> new MfaNotFoundException(method + " is not enabled for this user"));

        guard.ensureNotLocked(setting, email, method, MfaAttemptGuard.Phase.LOGIN);

        MfaCodeChecker.Outcome outcome = method == MfaMethod.TOTP
                ? codeChecker.checkTotp(setting, email, code)
                : codeChecker.checkChallenge(setting, code);

        if (!outcome.accepted()) {
            log.warn("❌ {} verification failed for user: {}", method, userId);
            return failed(setting, email, method, MfaEnrollmentService.reasonOf(outcome));
        }
        return granted(setting, email, method, trustDevice);
    }

    private VerificationResult verifyBackupCode(String userId, String email, String code, boolean trustDevice) {
        String normalized = backupCodeService.normalize(code);
        if (!backupCodeService.isValidFormat(normalized)) {
            throw new MfaValidationException("Backup code must be 8 letters or digits");
        }

        List<MfaSetting> enabled = store.findAllByUser(userId).stream()
                .filter(MfaSetting::isEnabled)
                .toList();
        if (enabled.isEmpty()) {
            throw new MfaNotFoundException("MFA is not enabled for this user");
        }

        for (MfaSetting setting : enabled) {
            guard.ensureNotLocked(setting, email, MfaMethod.BACKUP_CODE, MfaAttemptGuard.Phase.LOGIN);
        }

        MfaSetting primary = primaryOf(enabled);
        Optional<MfaSetting> consumedFrom = codeChecker.checkBackupCode(enabled, email, normalized);
        if (consumedFrom.isEmpty()) {
            log.warn("❌ Backup code verification failed for user: {}", userId);
            return failed(primary, email, MfaMethod.BACKUP_CODE, "invalid_code");
        }
        return granted(primary, email, MfaMethod.BACKUP_CODE, trustDevice);
    }

    // ========================================================================
    // CHALLENGES
    // ========================================================================

    /**
     * Issue a fresh SMS/EMAIL code to the enrolled destination. TOTP needs no challenge, so nothing is sent.
     */
    @Transactional
    public ChallengeDispatchResult sendChallenge(String userId, String email, MfaMethod method) {
        if (method == MfaMethod.BACKUP_CODE) {
            throw new UnsupportedMfaMethodException(method, "challenge delivery");
        }
        if (method == MfaMethod.TOTP) {
            log.debug("No challenge needed for TOTP, user: {}", userId);
            return ChallengeDispatchResult.notRequired(method);
        }

        MfaSetting setting = store.findOne(userId, method)
                .filter(s -> s.isEnabled() || s.isPendingSetup())
                .orElseThrow(() -> new MfaNotFoundException(method + " is not set up for this user"));

        guard.ensureNotLocked(setting, email, method, MfaAttemptGuard.Phase.LOGIN);

        String destination;
        String masked;
        if (setting.getFactor() instanceof MfaFactor.Sms sms) {
            destination = guard.reveal(setting, sms.encryptedPhoneNumber(), email);
            masked = Masking.maskPhoneNumber(destination);
        } else {
            destination = email;
            masked = Masking.maskEmail(email);
        }

        challengeCodeService.issue(userId, method, destination);

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("mfaMethod", method.name());
        metadata.put("destination", masked);
        audit.success(AuditCategory.VERIFICATION, "MFA_CHALLENGE_SENT", RiskLevel.LOW,
                "MFA challenge sent", userId, email, method, metadata);

        return ChallengeDispatchResult.sent(method, masked, challengeCodeService.getTtl().getSeconds());
    }

    // ========================================================================
    // MANAGEMENT
    // ========================================================================

    /**
     * Disable one method. Users in MFA-required roles can only be disabled by an administrator.
     */
    @Transactional
    public void disableMfa(String userId, String email, MfaMethod method, String actingAdminId) {
        log.info("🔄 Disabling {} for user: {}", method, userId);
        if (method == MfaMethod.BACKUP_CODE) {
            throw new UnsupportedMfaMethodException(method, "disable");
        }

        UserAccount account = userDirectory.findById(userId)
                .orElseThrow(() -> new MfaNotFoundException("User not found"));
        String actorEmail = email != null ? email : account.email();
        // an administrator acting on their own account is self-service
        boolean byAdmin = actingAdminId != null && !actingAdminId.equals(userId);

        if (account.requiresMfa() && !byAdmin) {
            log.warn("❌ Refused to disable {} for user {} in MFA-required role {}", method, userId, account.role());

            Map<String, Object> metadata = new HashMap<>();
            metadata.put("mfaMethod", method.name());
            metadata.put("role", account.role());
            audit.failure(AuditCategory.DISABLEMENT, "MFA_DISABLE_DENIED", RiskLevel.HIGH,
                    "MFA cannot be disabled for a role that requires it", userId, actorEmail, method, metadata);
            throw new MfaPermissionException("MFA is required for role " + account.role()
                    + " and can only be disabled by an administrator");
        }

        MfaSetting setting = store.findOne(userId, method)
                .orElseThrow(() -> new MfaNotFoundException(method + " is not set up for this user"));

        OffsetDateTime now = OffsetDateTime.now(clock);
        store.updateStatus(setting.getId(), MfaStatus.DISABLED, now);
        int revoked = trustedDevices.revokeAll(userId, byAdmin ? actingAdminId : userId, now);

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("mfaMethod", method.name());
        metadata.put("disabledByAdmin", byAdmin);
        metadata.put("adminId", byAdmin ? actingAdminId : null);
        metadata.put("revokedTrustedDevices", revoked);
        audit.success(AuditCategory.DISABLEMENT, "MFA_DISABLED", RiskLevel.HIGH,
                method + " disabled", userId, actorEmail, method, metadata);

        log.info("✅ {} disabled for user: {} ({} trusted devices revoked)", method, userId, revoked);
    }

    /**
     * Administrative unlock: clears the failure counter and any lock on one setting.
     */
    @Transactional
    public void resetFailedAttempts(String userId, MfaMethod method, String actingAdminId) {
        if (actingAdminId == null) {
            throw new MfaPermissionException("Only an administrator can reset failed MFA attempts");
        }
        if (actingAdminId.equals(userId)) {
            log.warn("❌ Admin {} tried to clear their own MFA lockout on {}", actingAdminId, method);
            throw new MfaPermissionException("Administrators cannot reset their own failed MFA attempts");
        }

        MfaSetting setting = store.findOne(userId, method)
                .orElseThrow(() -> new MfaNotFoundException(method + " is not set up for this user"));
        store.resetFailures(setting.getId(), OffsetDateTime.now(clock));

        String email = userDirectory.findById(userId).map(UserAccount::email).orElse(null);
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("mfaMethod", method.name());
        metadata.put("adminId", actingAdminId);
        metadata.put("previousFailedAttempts", setting.getFailedAttempts());
        audit.success(AuditCategory.VERIFICATION, "MFA_FAILED_ATTEMPTS_RESET", RiskLevel.MEDIUM,
                "Failed MFA attempts reset by administrator", userId, email, method, metadata);

        log.info("✅ Failed attempts on {} reset for user {} by admin {}", method, userId, actingAdminId);
    }

    /**
     * @return true if {@code token} is an authentic, unexpired trust token of {@code userId} whose device record
     *         has not been revoked
     */
    @Transactional
    public boolean isDeviceTrusted(String userId, String token) {
        if (!trustedDevicesEnabled) {
            return false;
        }

        Optional<String> tokenId = trustTokenService.validate(userId, token);
        if (tokenId.isEmpty()) {
            return false;
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        Optional<TrustedDevice> device = trustedDevices.findByTokenId(tokenId.get())
                .filter(d -> userId.equals(d.getUserId()))
                .filter(d -> d.isCurrentlyTrusted(now));
        if (device.isEmpty()) {
            log.debug("Trust token {} of user {} has no active device record", tokenId.get(), userId);
            return false;
        }

        trustedDevices.touch(tokenId.get(), now);
        log.info("✅ Trusted device recognised for user: {}", userId);
        return true;
    }

    // ========================================================================
    // PRIVATE HELPER METHODS
    // ========================================================================

    private VerificationResult granted(MfaSetting counted, String email, MfaMethod method, boolean trustDevice) {
        guard.recordSuccess(counted, email, method, MfaAttemptGuard.Phase.LOGIN, MfaStatus.ENABLED);

        String trustToken = null;
        if (trustDevice && trustedDevicesEnabled) {
            trustToken = trustDevice(counted.getUserId());
        }

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("mfaMethod", method.name());
        metadata.put("deviceTrusted", trustToken != null);
        audit.success(AuditCategory.VERIFICATION, "MFA_VERIFICATION_SUCCESS", RiskLevel.LOW,
                "MFA verification successful", counted.getUserId(), email, method, metadata);

        log.info("✅ {} verification successful for user: {}", method, counted.getUserId());
        return VerificationResult.granted(method, guard.remainingAttempts(0), trustToken);
    }

    private VerificationResult failed(MfaSetting counted, String email, MfaMethod method, String reason) {
        MfaAttemptGuard.FailureOutcome outcome = guard.recordFailure(counted, email, method,
                MfaAttemptGuard.Phase.LOGIN, reason);
        return VerificationResult.failed(method, outcome.getRemainingAttempts(), outcome.getLockedUntil());
    }

    private String trustDevice(String userId) {
        DeviceTrustTokenService.IssuedToken issued = trustTokenService.issue(userId);
        trustedDevices.save(new TrustedDevice(issued.tokenId(), userId, issued.issuedAt(), issued.expiresAt(),
                issued.issuedAt(), null, null));
        log.info("✅ Created trusted device for user {}: {}", userId, issued.tokenId());
        return issued.token();
    }

    private static MfaSetting primaryOf(List<MfaSetting> enabled) {
        return enabled.stream()
                .min(Comparator.comparingInt(s -> PRIMARY_ORDER.indexOf(s.getMethod())))
                .orElseThrow();
    }

    // ========================================================================
    // RESULT CLASSES
    // ========================================================================

    public static class VerificationResult {
        private final boolean success;
        private final MfaMethod method;
        private final int remainingAttempts;
        private final OffsetDateTime lockedUntil;
        private final String trustToken;

        private VerificationResult(boolean success, MfaMethod method, int remainingAttempts,
                                   OffsetDateTime lockedUntil, String trustToken) {
            this.success = success;
            this.method = method;
            this.remainingAttempts = remainingAttempts;
            this.lockedUntil = lockedUntil;
            this.trustToken = trustToken;
        }

        static VerificationResult granted(MfaMethod method, int remainingAttempts, String trustToken) {
            return new VerificationResult(true, method, remainingAttempts, null, trustToken);
        }

        static VerificationResult failed(MfaMethod method, int remainingAttempts, OffsetDateTime lockedUntil) {
            return new VerificationResult(false, method, remainingAttempts, lockedUntil, null);
        }

        public boolean isSuccess() { return success; }
        public MfaMethod getMethod() { return method; }
        public int getRemainingAttempts() { return remainingAttempts; }
        public OffsetDateTime getLockedUntil() { return lockedUntil; }
        public String getTrustToken() { return trustToken; }
    }

    public static class ChallengeDispatchResult {
        private final MfaMethod method;
        private final boolean sent;
        private final String maskedDestination;
        private final long expiresInSeconds;

        private ChallengeDispatchResult(MfaMethod method, boolean sent, String maskedDestination,
                                        long expiresInSeconds) {
            this.method = method;
            this.sent = sent;
            this.maskedDestination = maskedDestination;
            this.expiresInSeconds = expiresInSeconds;
        }

        static ChallengeDispatchResult sent(MfaMethod method, String maskedDestination, long expiresInSeconds) {
            return new ChallengeDispatchResult(method, true, maskedDestination, expiresInSeconds);
        }

        static ChallengeDispatchResult notRequired(MfaMethod method) {
            return new ChallengeDispatchResult(method, false, null, 0);
        }

        public MfaMethod getMethod() { return method; }
        public boolean isSent() { return sent; }
        public String getMaskedDestination() { return maskedDestination; }
        public long getExpiresInSeconds() { return expiresInSeconds; }
    }
}
