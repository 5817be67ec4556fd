package com.astralcore.mfa.application;

import com.astralcore.mfa.config.MfaProperties;
import com.astralcore.mfa.domain.mfa.MfaFactor;
import com.astralcore.mfa.domain.mfa.MfaSetting;
import com.astralcore.mfa.domain.ports.MfaSettingStore;
import com.astralcore.mfa.infrastructure.mfa.ChallengeCodeService;
import com.astralcore.mfa.infrastructure.mfa.CodeComparison;
import com.astralcore.mfa.infrastructure.mfa.TotpCodeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Checks a presented code against one factor. Store-side consumption (TOTP step, backup code) happens here so
 * that a code can only ever be accepted once.
 */
@Component
public class MfaCodeChecker {

    private static final Logger log = LoggerFactory.getLogger(MfaCodeChecker.class);

    public enum Outcome {
        MATCH,
        MISMATCH,
        /** Correct code, but its time step was already accepted. */
        REPLAYED;

        public boolean accepted() {
            return this == MATCH;
        }
    }

    private final TotpCodeService totpCodeService;
    private final ChallengeCodeService challengeCodeService;
    private final MfaSettingStore store;
    private final MfaAttemptGuard guard;
    private final Clock clock;
    private final boolean replayProtection;

    public MfaCodeChecker(TotpCodeService totpCodeService, ChallengeCodeService challengeCodeService,
                          MfaSettingStore store, MfaAttemptGuard guard, MfaProperties properties, Clock clock) {
        this.totpCodeService = totpCodeService;
        this.challengeCodeService = challengeCodeService;
        this.store = store;
        this.guard = guard;
        this.clock = clock;
        this.replayProtection = properties.getTotp().isReplayProtection();
    }

    public Outcome checkTotp(MfaSetting setting, String email, String code) {
        if (!(setting.getFactor() instanceof MfaFactor.Totp totp)) {
            return Outcome.MISMATCH;
        }

        String secret = guard.reveal(setting, totp.encryptedSecret(), email);
        OptionalLong step = totpCodeService.matchStep(secret, code);
        if (step.isEmpty()) {
            return Outcome.MISMATCH;
        }
        if (!replayProtection) {
            return Outcome.MATCH;
        }

        Long lastUsed = totp.lastUsedStep();
        if ((lastUsed != null && step.getAsLong() <= lastUsed)
                || !store.advanceTotpStep(setting.getId(), step.getAsLong(), OffsetDateTime.now(clock))) {
            log.warn("❌ Replayed TOTP code for user {} (step {})", setting.getUserId(), step.getAsLong());
            return Outcome.REPLAYED;
        }
        return Outcome.MATCH;
    }

    public Outcome checkChallenge(MfaSetting setting, String code) {
        return challengeCodeService.verify(setting.getUserId(), setting.getMethod(), code)
                ? Outcome.MATCH
                : Outcome.MISMATCH;
    }

    /**
     * Looks for {@code normalizedCode} among the backup codes of {@code candidates} and consumes the first match.
     *
     * @return the setting the consumed code belonged to
     */
    public Optional<MfaSetting> checkBackupCode(List<MfaSetting> candidates, String email, String normalizedCode) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        for (MfaSetting setting : candidates) {
            for (String encrypted : setting.getBackupCodes()) {
                if (!CodeComparison.matches(guard.reveal(setting, encrypted, email), normalizedCode)) {
                    continue;
                }
                if (store.consumeBackupCode(setting.getId(), encrypted, now)) {
                    log.info("✅ Backup code consumed for user {} ({} left on {})",
                            setting.getUserId(), setting.getBackupCodes().size() - 1, setting.getMethod());
                    return Optional.of(setting);
                }
                log.warn("❌ Backup code for user {} was consumed concurrently", setting.getUserId());
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
