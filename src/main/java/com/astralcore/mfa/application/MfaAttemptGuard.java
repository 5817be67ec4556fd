package com.astralcore.mfa.application;

import com.astralcore.mfa.config.MfaProperties;
import com.astralcore.mfa.domain.audit.AuditCategory;
import com.astralcore.mfa.domain.audit.RiskLevel;
import com.astralcore.mfa.domain.mfa.LockoutPolicy;
import com.astralcore.mfa.domain.mfa.MfaMethod;
import com.astralcore.mfa.domain.mfa.MfaSetting;
import com.astralcore.mfa.domain.mfa.MfaStatus;
import com.astralcore.mfa.domain.ports.MfaSettingStore;
import com.astralcore.mfa.exception.MfaIntegrityException;
import com.astralcore.mfa.exception.MfaLockedException;
import com.astralcore.mfa.exception.MfaNotFoundException;
import com.astralcore.mfa.infrastructure.encryption.SecretVault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Applies the {@link LockoutPolicy} to stored settings for both enrollment and login verification, and decrypts
 * setting data with integrity failures audited.
 */
@Component
public class MfaAttemptGuard {

    private static final Logger log = LoggerFactory.getLogger(MfaAttemptGuard.class);

    public enum Phase {
        SETUP("MFA_SETUP_BLOCKED", "MFA_SETUP_VERIFICATION_FAILED"),
        LOGIN("MFA_VERIFICATION_BLOCKED", "MFA_VERIFICATION_FAILED");

        private final String blockedAction;
        private final String failedAction;

        Phase(String blockedAction, String failedAction) {
            this.blockedAction = blockedAction;
            this.failedAction = failedAction;
        }
    }

    private final LockoutPolicy policy;
    private final MfaSettingStore store;
    private final MfaAuditEmitter audit;
    private final SecretVault vault;
    private final Clock clock;
    private final int casRetries;

    public MfaAttemptGuard(LockoutPolicy policy, MfaSettingStore store, MfaAuditEmitter audit,
                           SecretVault vault, MfaProperties properties, Clock clock) {
        this.policy = policy;
        this.store = store;
        this.audit = audit;
        this.vault = vault;
        this.clock = clock;
        this.casRetries = Math.max(1, properties.getLockout().getCasRetries());
    }

    /**
     * @throws MfaLockedException after auditing, if the setting's lockout window is still open
     */
    public void ensureNotLocked(MfaSetting setting, String email, MfaMethod presentedMethod, Phase phase) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (!policy.isLocked(setting.getLockedUntil(), now)) {
            return;
        }

        log.warn("❌ {} attempt for locked user {} on {} (locked until {})",
                phase, setting.getUserId(), setting.getMethod(), setting.getLockedUntil());

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("mfaMethod", presentedMethod.name());
        metadata.put("lockedUntil", setting.getLockedUntil().toString());
        audit.failure(AuditCategory.FAILURE, phase.blockedAction, RiskLevel.HIGH,
                "MFA attempt blocked due to account lock", setting.getUserId(), email, presentedMethod, metadata);

        throw new MfaLockedException(setting.getLockedUntil());
    }

    /**
     * Counts one failed attempt with a compare-and-swap on the stored counter, re-reading on a lost race.
     */
    public FailureOutcome recordFailure(MfaSetting setting, String email, MfaMethod presentedMethod,
                                        Phase phase, String reason) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        MfaSetting current = setting;

        for (int attempt = 0; attempt < casRetries; attempt++) {
            LockoutPolicy.Decision decision = policy.onFailure(current.getFailedAttempts(), now);

            if (store.recordFailure(current.getId(), current.getFailedAttempts(),
                    decision.failedAttempts(), decision.lockedUntil(), now)) {
                FailureOutcome outcome = new FailureOutcome(decision.failedAttempts(),
                        policy.remainingAttempts(decision.failedAttempts()), decision.lockedUntil());
                auditFailure(current, email, presentedMethod, phase, reason, outcome);
                return outcome;
            }

            log.debug("Lost failure-counter race on setting {}, re-reading", current.getId());
            current = store.findOne(current.getUserId(), current.getMethod())
                    .orElseThrow(() -> new MfaNotFoundException("MFA setting no longer exists"));

            if (policy.isLocked(current.getLockedUntil(), now)) {
                // a concurrent request already tripped the lock
                FailureOutcome outcome = new FailureOutcome(current.getFailedAttempts(), 0, current.getLockedUntil());
                auditFailure(current, email, presentedMethod, phase, reason, outcome);
                return outcome;
            }
        }

        log.error("❌ Could not record failed MFA attempt for user {} after {} tries", setting.getUserId(), casRetries);
        throw new ConcurrencyFailureException("Failed MFA attempt could not be recorded for setting " + setting.getId());
    }

    /**
     * Resets the counter after an accepted code. The write only lands if no failure was counted since
     * {@code setting} was read, so a code checked before a concurrent lockout cannot lift that lock.
     *
     * @throws MfaLockedException after auditing, if a concurrent failure locked the setting
     */
    public void recordSuccess(MfaSetting setting, String email, MfaMethod presentedMethod, Phase phase,
                              MfaStatus resultingStatus) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        MfaSetting current = setting;

        for (int attempt = 0; attempt < casRetries; attempt++) {
            if (store.recordSuccess(current.getId(), current.getFailedAttempts(), resultingStatus, now)) {
                return;
            }

            log.debug("Lost success race on setting {}, re-reading", current.getId());
            current = store.findOne(current.getUserId(), current.getMethod())
                    .orElseThrow(() -> new MfaNotFoundException("MFA setting no longer exists"));

            // a concurrent failure tripped the lock after this code was checked
            ensureNotLocked(current, email, presentedMethod, phase);
        }

        log.error("❌ Could not record MFA success for user {} after {} tries", setting.getUserId(), casRetries);
        throw new ConcurrencyFailureException("MFA success could not be recorded for setting " + setting.getId());
    }

    public int remainingAttempts(int failedAttempts) {
        return policy.remainingAttempts(failedAttempts);
    }

    /**
     * Decrypts a value stored on {@code setting}. An integrity failure is audited as CRITICAL and rethrown.
     */
    public String reveal(MfaSetting setting, String ciphertext, String email) {
        try {
            return vault.decrypt(ciphertext);
        } catch (MfaIntegrityException e) {
            log.error("🚨 Integrity failure on MFA setting {} of user {}: {}",
                    setting.getId(), setting.getUserId(), e.getMessage());

            Map<String, Object> metadata = new HashMap<>();
            metadata.put("mfaMethod", setting.getMethod().name());
            metadata.put("settingId", setting.getId().toString());
            audit.failure(AuditCategory.FAILURE, "MFA_INTEGRITY_FAILURE", RiskLevel.CRITICAL,
                    "Stored MFA data failed integrity verification", setting.getUserId(), email,
                    setting.getMethod(), metadata);
            throw e;
        }
    }

    private void auditFailure(MfaSetting setting, String email, MfaMethod presentedMethod, Phase phase,
                              String reason, FailureOutcome outcome) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("mfaMethod", presentedMethod.name());
        metadata.put("reason", reason);
        metadata.put("failedAttempts", outcome.getFailedAttempts());
        metadata.put("remainingAttempts", outcome.getRemainingAttempts());
        audit.failure(AuditCategory.FAILURE, phase.failedAction, RiskLevel.HIGH,
                "Invalid MFA code", setting.getUserId(), email, presentedMethod, metadata);

        if (outcome.isLocked()) {
            log.warn("❌ User {} locked on {} until {} after {} failed attempts",
                    setting.getUserId(), setting.getMethod(), outcome.getLockedUntil(), outcome.getFailedAttempts());

            Map<String, Object> lockMetadata = new HashMap<>();
            lockMetadata.put("mfaMethod", setting.getMethod().name());
            lockMetadata.put("lockedUntil", outcome.getLockedUntil().toString());
            audit.failure(AuditCategory.FAILURE, "MFA_LOCKOUT_TRIGGERED", RiskLevel.HIGH,
                    "MFA locked after repeated failures", setting.getUserId(), email, setting.getMethod(), lockMetadata);
        }
    }

    // ========================================================================
    // RESULT CLASSES
    // ========================================================================

    public static class FailureOutcome {
        private final int failedAttempts;
        private final int remainingAttempts;
        private final OffsetDateTime lockedUntil;

        public FailureOutcome(int failedAttempts, int remainingAttempts, OffsetDateTime lockedUntil) {
            this.failedAttempts = failedAttempts;
            this.remainingAttempts = remainingAttempts;
            this.lockedUntil = lockedUntil;
        }

        public int getFailedAttempts() { return failedAttempts; }
        public int getRemainingAttempts() { return remainingAttempts; }
        public OffsetDateTime getLockedUntil() { return lockedUntil; }
        public boolean isLocked() { return lockedUntil != null; }
    }
}
