// ==============================================================================
// MFA Trusted Device Repository
// File: src/main/java/com/astralcore/mfa/infrastructure/jpa/SpringMfaTrustedDeviceRepository.java
// ==============================================================================

package com.astralcore.mfa.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.List;

public interface SpringMfaTrustedDeviceRepository extends JpaRepository<MfaTrustedDeviceEntity, String> {

    @Query("SELECT d FROM MfaTrustedDeviceEntity d WHERE d.userId = :userId AND d.revokedAt IS NULL AND (d.expiresAt IS NULL OR d.expiresAt > :now)")
    List<MfaTrustedDeviceEntity> findActiveTrustedDevices(@Param("userId") String userId, @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE MfaTrustedDeviceEntity d SET d.lastSeenAt = :now WHERE d.tokenId = :tokenId")
    int updateLastSeen(@Param("tokenId") String tokenId, @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE MfaTrustedDeviceEntity d SET d.revokedAt = :now, d.revokedBy = :revokedBy WHERE d.userId = :userId AND d.revokedAt IS NULL")
    int revokeAllForUser(@Param("userId") String userId, @Param("revokedBy") String revokedBy, @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM MfaTrustedDeviceEntity d WHERE d.expiresAt IS NOT NULL AND d.expiresAt < :now")
    int deleteExpired(@Param("now") OffsetDateTime now);
}
