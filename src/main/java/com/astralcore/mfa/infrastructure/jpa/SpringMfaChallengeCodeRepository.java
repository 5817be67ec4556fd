package com.astralcore.mfa.infrastructure.jpa;

import com.astralcore.mfa.domain.mfa.MfaMethod;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public interface SpringMfaChallengeCodeRepository extends JpaRepository<MfaChallengeCodeEntity, UUID> {

    @Query("SELECT c FROM MfaChallengeCodeEntity c WHERE c.userId = :userId AND c.method = :method AND c.expiresAt > :now")
    List<MfaChallengeCodeEntity> findLive(@Param("userId") String userId, @Param("method") MfaMethod method,
                                          @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM MfaChallengeCodeEntity c WHERE c.id = :id")
    int deleteCode(@Param("id") UUID id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM MfaChallengeCodeEntity c WHERE c.userId = :userId AND c.method = :method")
    int deleteAllFor(@Param("userId") String userId, @Param("method") MfaMethod method);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM MfaChallengeCodeEntity c WHERE c.expiresAt <= :now")
    int deleteExpired(@Param("now") OffsetDateTime now);
}
