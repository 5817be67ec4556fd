package com.astralcore.mfa.infrastructure.mfa;

import com.astralcore.mfa.config.MfaProperties;
import com.astralcore.mfa.domain.mfa.MfaMethod;
import com.astralcore.mfa.domain.ports.ChallengeCodeStore;
import com.astralcore.mfa.domain.ports.ChallengeDeliveryPort;
import com.astralcore.mfa.exception.UnsupportedMfaMethodException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Locale;

/**
 * Issues SMS/EMAIL challenge codes and checks them through the {@link ChallengeCodeStore}.
 */
@Service
public class ChallengeCodeService {

    private static final Logger log = LoggerFactory.getLogger(ChallengeCodeService.class);

    private final ChallengeCodeStore codeStore;
    private final ChallengeDeliveryPort delivery;
    private final Clock clock;
    private final int length;
    private final int bound;
    private final Duration ttl;
    private final SecureRandom secureRandom = new SecureRandom();

    public ChallengeCodeService(ChallengeCodeStore codeStore, ChallengeDeliveryPort delivery,
                                MfaProperties properties, Clock clock) {
        this.codeStore = codeStore;
        this.delivery = delivery;
        this.clock = clock;
        this.length = properties.getChallenge().getLength();
        this.bound = (int) Math.pow(10, length);
        this.ttl = Duration.ofSeconds(properties.getChallenge().getTtlSeconds());
    }

    /**
     * Uniformly random decimal code, zero-padded.
     */
    public String generateCode() {
        return String.format(Locale.ROOT, "%0" + length + "d", secureRandom.nextInt(bound));
    }

    /**
     * Generates a code, stores it for (userId, method) and sends it to {@code destination}.
     */
    public void issue(String userId, MfaMethod method, String destination) {
        if (!method.isChallengeBased()) {
            throw new UnsupportedMfaMethodException(method, "challenge delivery");
        }
        String code = generateCode();
        codeStore.save(userId, method, code, ttl, OffsetDateTime.now(clock));

        if (method == MfaMethod.SMS) {
            delivery.sendSms(destination, code);
        } else {
            delivery.sendEmail(destination, code);
        }
        log.info("📤 Challenge issued for user {} via {} (valid {}s)", userId, method, ttl.getSeconds());
    }

    public boolean verify(String userId, MfaMethod method, String candidate) {
        return codeStore.verifyAndConsume(userId, method, candidate, OffsetDateTime.now(clock));
    }

    public boolean isValidCodeFormat(String code) {
        return code != null && code.length() == length && code.chars().allMatch(c -> c >= '0' && c <= '9');
    }

    public Duration getTtl() {
        return ttl;
    }
}
