package com.astralcore.mfa.domain.ports;

import com.astralcore.mfa.domain.mfa.MfaMethod;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Short-lived storage for issued SMS/EMAIL challenge codes. Comparison happens inside the store.
 */
public interface ChallengeCodeStore {

    /** Stores a code for (userId, method), replacing any code issued earlier. */
    void save(String userId, MfaMethod method, String code, Duration ttl, OffsetDateTime now);

    /**
     * @return true if {@code candidate} matches the live code, which is then removed
     */
    boolean verifyAndConsume(String userId, MfaMethod method, String candidate, OffsetDateTime now);

    int purgeExpired(OffsetDateTime now);
}
