package com.astralcore.mfa.domain.ports;

import com.astralcore.mfa.domain.mfa.MfaFactor;
import com.astralcore.mfa.domain.mfa.MfaMethod;
import com.astralcore.mfa.domain.mfa.MfaSetting;
import com.astralcore.mfa.domain.mfa.MfaStatus;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable store of MFA settings, unique per (userId, method). Each write is atomic per row.
 */
public interface MfaSettingStore {

    Optional<MfaSetting> findOne(String userId, MfaMethod method);

    List<MfaSetting> findAllByUser(String userId);

    /**
     * Creates or replaces the row for (userId, factor method) as PENDING_SETUP with the given factor and backup
     * codes. The failure counter and lock are kept so a new setup cannot clear an active lockout.
     */
    MfaSetting upsertPending(String userId, MfaFactor factor, List<String> encryptedBackupCodes, OffsetDateTime now);

    /**
     * Compare-and-swap on the failure counter.
     *
     * @return false if another request changed the counter since {@code expectedFailedAttempts} was read
     */
    boolean recordFailure(UUID settingId, int expectedFailedAttempts, int failedAttempts,
                          OffsetDateTime lockedUntil, OffsetDateTime now);

    /**
     * Resets the counter, clears the lock, stamps lastUsed and moves the row to {@code status}, but only if the
     * counter still equals {@code expectedFailedAttempts} and no lock is active at {@code now}.
     *
     * @return false if a concurrent failure changed the counter or set a lock
     */
    boolean recordSuccess(UUID settingId, int expectedFailedAttempts, MfaStatus status, OffsetDateTime now);

    /**
     * Advances the last accepted TOTP step only if it is still below {@code step}.
     *
     * @return false if the step (or a later one) was already used
     */
    boolean advanceTotpStep(UUID settingId, long step, OffsetDateTime now);

    /**
     * Removes one backup code.
     *
     * @return false if the code was already consumed by another request
     */
    boolean consumeBackupCode(UUID settingId, String encryptedBackupCode, OffsetDateTime now);

    void replaceBackupCodes(UUID settingId, List<String> encryptedBackupCodes, OffsetDateTime now);

    void updateStatus(UUID settingId, MfaStatus status, OffsetDateTime now);

    void resetFailures(UUID settingId, OffsetDateTime now);
}
