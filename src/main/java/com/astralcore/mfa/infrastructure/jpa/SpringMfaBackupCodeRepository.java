// ==============================================================================
// MFA Backup Code Repository
// File: src/main/java/com/astralcore/mfa/infrastructure/jpa/SpringMfaBackupCodeRepository.java
// ==============================================================================

package com.astralcore.mfa.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface SpringMfaBackupCodeRepository extends JpaRepository<MfaBackupCodeEntity, UUID> {

    List<MfaBackupCodeEntity> findBySettingIdOrderByPositionAsc(UUID settingId);

    List<MfaBackupCodeEntity> findBySettingIdInOrderByPositionAsc(Collection<UUID> settingIds);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM MfaBackupCodeEntity b WHERE b.id = :id")
    int deleteCode(@Param("id") UUID id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM MfaBackupCodeEntity b WHERE b.settingId = :settingId")
    int deleteAllBySettingId(@Param("settingId") UUID settingId);
}
