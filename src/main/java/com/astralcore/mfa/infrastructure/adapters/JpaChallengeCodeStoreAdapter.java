package com.astralcore.mfa.infrastructure.adapters;

import com.astralcore.mfa.domain.mfa.MfaMethod;
import com.astralcore.mfa.domain.ports.ChallengeCodeStore;
import com.astralcore.mfa.infrastructure.encryption.SecretVault;
import com.astralcore.mfa.infrastructure.jpa.MfaChallengeCodeEntity;
import com.astralcore.mfa.infrastructure.jpa.SpringMfaChallengeCodeRepository;
import com.astralcore.mfa.infrastructure.mfa.CodeComparison;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Keeps only a SHA-256 digest of each issued code. One live code per (user, method).
 */
@Component
public class JpaChallengeCodeStoreAdapter implements ChallengeCodeStore {

    private static final Logger log = LoggerFactory.getLogger(JpaChallengeCodeStoreAdapter.class);

    private final SpringMfaChallengeCodeRepository repository;
    private final SecretVault vault;

    public JpaChallengeCodeStoreAdapter(SpringMfaChallengeCodeRepository repository, SecretVault vault) {
        this.repository = repository;
        this.vault = vault;
    }

    @Override
    @Transactional
    public void save(String userId, MfaMethod method, String code, Duration ttl, OffsetDateTime now) {
        int replaced = repository.deleteAllFor(userId, method);
        repository.save(new MfaChallengeCodeEntity(userId, method, vault.generateHash(code), now.plus(ttl), now));
        if (replaced > 0) {
            log.debug("Replaced {} earlier {} challenge(s) for user {}", replaced, method, userId);
        }
    }

    @Override
    @Transactional
    public boolean verifyAndConsume(String userId, MfaMethod method, String candidate, OffsetDateTime now) {
        if (candidate == null) {
            return false;
        }
        String candidateHash = vault.generateHash(candidate);
        List<MfaChallengeCodeEntity> live = repository.findLive(userId, method, now);
        for (MfaChallengeCodeEntity code : live) {
            if (CodeComparison.matches(code.getCodeHash(), candidateHash)) {
                // false if another request consumed it first
                return repository.deleteCode(code.getId()) == 1;
            }
        }
        return false;
    }

    @Override
    @Transactional
    public int purgeExpired(OffsetDateTime now) {
        return repository.deleteExpired(now);
    }
}
