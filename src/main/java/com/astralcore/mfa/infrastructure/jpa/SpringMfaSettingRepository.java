// ==============================================================================
// MFA Setting Repository
// File: src/main/java/com/astralcore/mfa/infrastructure/jpa/SpringMfaSettingRepository.java
// ==============================================================================

package com.astralcore.mfa.infrastructure.jpa;

import com.astralcore.mfa.domain.mfa.MfaMethod;
import com.astralcore.mfa.domain.mfa.MfaStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SpringMfaSettingRepository extends JpaRepository<MfaSettingEntity, UUID> {

    Optional<MfaSettingEntity> findByUserIdAndMethod(String userId, MfaMethod method);

    List<MfaSettingEntity> findByUserIdOrderByCreatedAtAsc(String userId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE MfaSettingEntity m SET m.failedAttempts = :attempts, m.lockedUntil = :lockedUntil, m.updatedAt = :now " +
            "WHERE m.id = :id AND m.failedAttempts = :expected")
    int compareAndSetFailures(@Param("id") UUID id, @Param("expected") int expected, @Param("attempts") int attempts,
                              @Param("lockedUntil") OffsetDateTime lockedUntil, @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE MfaSettingEntity m SET m.status = :status, m.failedAttempts = 0, m.lockedUntil = null, " +
            "m.lastUsedAt = :now, m.updatedAt = :now " +
            "WHERE m.id = :id AND m.failedAttempts = :expected AND (m.lockedUntil IS NULL OR m.lockedUntil <= :now)")
    int markSuccess(@Param("id") UUID id, @Param("expected") int expected, @Param("status") MfaStatus status,
                    @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE MfaSettingEntity m SET m.lastTotpStep = :step, m.updatedAt = :now " +
            "WHERE m.id = :id AND (m.lastTotpStep IS NULL OR m.lastTotpStep < :step)")
    int advanceTotpStep(@Param("id") UUID id, @Param("step") long step, @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE MfaSettingEntity m SET m.status = :status, m.updatedAt = :now WHERE m.id = :id")
    int updateStatus(@Param("id") UUID id, @Param("status") MfaStatus status, @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE MfaSettingEntity m SET m.failedAttempts = 0, m.lockedUntil = null, m.updatedAt = :now WHERE m.id = :id")
    int resetFailures(@Param("id") UUID id, @Param("now") OffsetDateTime now);
}
