package com.astralcore.mfa.domain.mfa;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LockoutPolicy")
class LockoutPolicyTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2026, 3, 2, 9, 0, 0, 0, ZoneOffset.UTC);

    private final LockoutPolicy policy = new LockoutPolicy(5, Duration.ofSeconds(900));

    @Test
    @DisplayName("failures below the limit only count")
    void countsWithoutLocking() {
        LockoutPolicy.Decision decision = policy.onFailure(3, NOW);

        assertThat(decision.failedAttempts()).isEqualTo(4);
        assertThat(decision.locked()).isFalse();
        assertThat(policy.remainingAttempts(decision.failedAttempts())).isEqualTo(1);
    }

    @Test
    @DisplayName("the fifth failure locks for the cooldown")
    void locksAtLimit() {
        LockoutPolicy.Decision decision = policy.onFailure(4, NOW);

        assertThat(decision.failedAttempts()).isEqualTo(5);
        assertThat(decision.lockedUntil()).isEqualTo(NOW.plusSeconds(900));
        assertThat(policy.remainingAttempts(5)).isZero();
    }

    @Test
    @DisplayName("a failure after an expired lock locks again")
    void relocksAfterCooldown() {
        LockoutPolicy.Decision decision = policy.onFailure(5, NOW);

        assertThat(decision.failedAttempts()).isEqualTo(6);
        assertThat(decision.locked()).isTrue();
    }

    @Test
    void lockIsActiveOnlyBeforeItsEnd() {
        assertThat(policy.isLocked(NOW.plusSeconds(1), NOW)).isTrue();
        assertThat(policy.isLocked(NOW, NOW)).isFalse();
        assertThat(policy.isLocked(null, NOW)).isFalse();
    }

    @Test
    void successResetsEverything() {
        LockoutPolicy.Decision decision = policy.onSuccess();

        assertThat(decision.failedAttempts()).isZero();
        assertThat(decision.locked()).isFalse();
    }

    @Test
    void rejectsNonsenseConfiguration() {
        assertThatThrownBy(() -> new LockoutPolicy(0, Duration.ofSeconds(900)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LockoutPolicy(5, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
