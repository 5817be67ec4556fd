package com.astralcore.mfa.infrastructure.adapters;

import com.astralcore.mfa.domain.mfa.MfaFactor;
import com.astralcore.mfa.domain.mfa.MfaMethod;
import com.astralcore.mfa.domain.mfa.MfaSetting;
import com.astralcore.mfa.domain.mfa.MfaStatus;
import com.astralcore.mfa.domain.ports.MfaSettingStore;
import com.astralcore.mfa.exception.MfaIntegrityException;
import com.astralcore.mfa.infrastructure.jpa.MfaBackupCodeEntity;
import com.astralcore.mfa.infrastructure.jpa.MfaSettingEntity;
import com.astralcore.mfa.infrastructure.jpa.SpringMfaBackupCodeRepository;
import com.astralcore.mfa.infrastructure.jpa.SpringMfaSettingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Component
public class JpaMfaSettingStoreAdapter implements MfaSettingStore {

    private static final Logger log = LoggerFactory.getLogger(JpaMfaSettingStoreAdapter.class);

    private final SpringMfaSettingRepository settings;
    private final SpringMfaBackupCodeRepository backupCodes;

    public JpaMfaSettingStoreAdapter(SpringMfaSettingRepository settings, SpringMfaBackupCodeRepository backupCodes) {
        this.settings = settings;
        this.backupCodes = backupCodes;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<MfaSetting> findOne(String userId, MfaMethod method) {
        return settings.findByUserIdAndMethod(userId, method)
                .map(e -> toDomain(e, codesOf(e.getId())));
    }

    @Override
    @Transactional(readOnly = true)
    public List<MfaSetting> findAllByUser(String userId) {
        List<MfaSettingEntity> rows = settings.findByUserIdOrderByCreatedAtAsc(userId);
        if (rows.isEmpty()) {
            return List.of();
        }

        Map<UUID, List<String>> codesBySetting = backupCodes
                .findBySettingIdInOrderByPositionAsc(rows.stream().map(MfaSettingEntity::getId).toList())
                .stream()
                .collect(Collectors.groupingBy(MfaBackupCodeEntity::getSettingId,
                        Collectors.mapping(MfaBackupCodeEntity::getEncryptedCode, Collectors.toList())));

        return rows.stream()
                .map(e -> toDomain(e, codesBySetting.getOrDefault(e.getId(), List.of())))
                .toList();
    }

    @Override
    @Transactional
    public MfaSetting upsertPending(String userId, MfaFactor factor, List<String> encryptedBackupCodes, OffsetDateTime now) {
        MfaSettingEntity entity = settings.findByUserIdAndMethod(userId, factor.method())
                .orElseGet(() -> {
                    MfaSettingEntity created = new MfaSettingEntity();
                    created.setUserId(userId);
                    created.setMethod(factor.method());
                    created.setCreatedAt(now);
                    return created;
                });

        entity.setStatus(MfaStatus.PENDING_SETUP);
        entity.setEncryptedSecret(null);
        entity.setEncryptedPhoneNumber(null);
        entity.setLastTotpStep(null);
        if (factor instanceof MfaFactor.Totp totp) {
            entity.setEncryptedSecret(totp.encryptedSecret());
        } else if (factor instanceof MfaFactor.Sms sms) {
            entity.setEncryptedPhoneNumber(sms.encryptedPhoneNumber());
        }
        entity.setUpdatedAt(now);

        MfaSettingEntity saved = settings.saveAndFlush(entity);
        writeBackupCodes(saved.getId(), encryptedBackupCodes, now);

        log.debug("Upserted pending {} setting {} for user {}", factor.method(), saved.getId(), userId);
        return toDomain(saved, List.copyOf(encryptedBackupCodes));
    }

    @Override
    @Transactional
    public boolean recordFailure(UUID settingId, int expectedFailedAttempts, int failedAttempts,
                                 OffsetDateTime lockedUntil, OffsetDateTime now) {
        return settings.compareAndSetFailures(settingId, expectedFailedAttempts, failedAttempts, lockedUntil, now) == 1;
    }

    @Override
    @Transactional
    public boolean recordSuccess(UUID settingId, int expectedFailedAttempts, MfaStatus status, OffsetDateTime now) {
        return settings.markSuccess(settingId, expectedFailedAttempts, status, now) == 1;
    }

    @Override
    @Transactional
    public boolean advanceTotpStep(UUID settingId, long step, OffsetDateTime now) {
        return settings.advanceTotpStep(settingId, step, now) == 1;
    }

    @Override
    @Transactional
    public boolean consumeBackupCode(UUID settingId, String encryptedBackupCode, OffsetDateTime now) {
        Optional<MfaBackupCodeEntity> row = backupCodes.findBySettingIdOrderByPositionAsc(settingId).stream()
                .filter(c -> c.getEncryptedCode().equals(encryptedBackupCode))
                .findFirst();
        if (row.isEmpty()) {
            return false;
        }
        return backupCodes.deleteCode(row.get().getId()) == 1;
    }

    @Override
    @Transactional
    public void replaceBackupCodes(UUID settingId, List<String> encryptedBackupCodes, OffsetDateTime now) {
        writeBackupCodes(settingId, encryptedBackupCodes, now);
    }

    @Override
    @Transactional
    public void updateStatus(UUID settingId, MfaStatus status, OffsetDateTime now) {
        requireUpdated(settings.updateStatus(settingId, status, now), settingId);
    }

    @Override
    @Transactional
    public void resetFailures(UUID settingId, OffsetDateTime now) {
        requireUpdated(settings.resetFailures(settingId, now), settingId);
    }

    // ========================================================================
    // PRIVATE HELPER METHODS
    // ========================================================================

    private void writeBackupCodes(UUID settingId, List<String> encryptedBackupCodes, OffsetDateTime now) {
        int removed = backupCodes.deleteAllBySettingId(settingId);
        List<MfaBackupCodeEntity> rows = new ArrayList<>(encryptedBackupCodes.size());
        for (int i = 0; i < encryptedBackupCodes.size(); i++) {
            rows.add(new MfaBackupCodeEntity(settingId, encryptedBackupCodes.get(i), i, now));
        }
        backupCodes.saveAll(rows);
        log.debug("Replaced {} backup codes with {} for setting {}", removed, rows.size(), settingId);
    }

    private List<String> codesOf(UUID settingId) {
        return backupCodes.findBySettingIdOrderByPositionAsc(settingId).stream()
                .map(MfaBackupCodeEntity::getEncryptedCode)
                .toList();
    }

    private static void requireUpdated(int rows, UUID settingId) {
        if (rows != 1) {
            throw new IllegalStateException("MFA setting not found for update: " + settingId);
        }
    }

    private static MfaSetting toDomain(MfaSettingEntity e, List<String> codes) {
        MfaFactor factor;
        try {
            factor = switch (e.getMethod()) {
                case TOTP -> new MfaFactor.Totp(e.getEncryptedSecret(), e.getLastTotpStep());
                case SMS -> new MfaFactor.Sms(e.getEncryptedPhoneNumber());
                case EMAIL -> new MfaFactor.Email();
                case BACKUP_CODE -> throw new IllegalArgumentException("BACKUP_CODE has no setting of its own");
            };
        } catch (IllegalArgumentException ex) {
            throw new MfaIntegrityException("Stored MFA setting " + e.getId() + " is inconsistent", ex);
        }

        return new MfaSetting(e.getId(), e.getUserId(), factor, e.getStatus(), codes,
                e.getFailedAttempts(), e.getLockedUntil(), e.getLastUsedAt(), e.getCreatedAt(), e.getUpdatedAt());
    }
}
