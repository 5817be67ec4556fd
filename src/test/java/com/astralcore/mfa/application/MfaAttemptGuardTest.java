package com.astralcore.mfa.application;

import com.astralcore.mfa.config.MfaProperties;
import com.astralcore.mfa.domain.audit.AuditCategory;
import com.astralcore.mfa.domain.audit.RiskLevel;
import com.astralcore.mfa.domain.mfa.LockoutPolicy;
import com.astralcore.mfa.domain.mfa.MfaFactor;
import com.astralcore.mfa.domain.mfa.MfaMethod;
import com.astralcore.mfa.domain.mfa.MfaSetting;
import com.astralcore.mfa.domain.mfa.MfaStatus;
import com.astralcore.mfa.domain.ports.MfaSettingStore;
import com.astralcore.mfa.exception.MfaIntegrityException;
import com.astralcore.mfa.exception.MfaLockedException;
import com.astralcore.mfa.infrastructure.encryption.SecretVault;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.ConcurrencyFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("MfaAttemptGuard")
class MfaAttemptGuardTest {

    private static final Instant NOW_INSTANT = Instant.parse("2026-03-02T09:00:00Z");
    private static final OffsetDateTime NOW = OffsetDateTime.ofInstant(NOW_INSTANT, ZoneOffset.UTC);
    private static final UUID SETTING_ID = UUID.randomUUID();

    @Mock
    private MfaSettingStore store;

    @Mock
    private MfaAuditEmitter audit;

    @Mock
    private SecretVault vault;

    private MfaAttemptGuard guard;

    @BeforeEach
    void setUp() {
        guard = new MfaAttemptGuard(new LockoutPolicy(5, Duration.ofSeconds(900)), store, audit, vault,
                new MfaProperties(), Clock.fixed(NOW_INSTANT, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should block and audit attempts while locked")
    void ensureNotLocked_WhileLocked_ThrowsLocked() {
        // Given
        MfaSetting setting = totpSetting(5, NOW.plusMinutes(10));

        // When / Then
        assertThatThrownBy(() -> guard.ensureNotLocked(setting, "u1@x.com", MfaMethod.TOTP, MfaAttemptGuard.Phase.LOGIN))
                .isInstanceOf(MfaLockedException.class)
                .extracting(e -> ((MfaLockedException) e).getLockedUntil())
                .isEqualTo(NOW.plusMinutes(10));

        verify(audit).failure(eq(AuditCategory.FAILURE), eq("MFA_VERIFICATION_BLOCKED"), eq(RiskLevel.HIGH),
                anyString(), eq("u1"), eq("u1@x.com"), eq(MfaMethod.TOTP), anyMap());
    }

    @Test
    @DisplayName("Should let attempts through once the lock has expired")
    void ensureNotLocked_ExpiredLock_Passes() {
        guard.ensureNotLocked(totpSetting(5, NOW.minusSeconds(1)), "u1@x.com", MfaMethod.TOTP,
                MfaAttemptGuard.Phase.SETUP);

        verifyNoInteractions(audit);
    }

    @Test
    @DisplayName("Should count a failure and report remaining attempts")
    void recordFailure_BelowLimit_Counts() {
        // Given
        when(store.recordFailure(SETTING_ID, 2, 3, null, NOW)).thenReturn(true);

        // When
        MfaAttemptGuard.FailureOutcome outcome = guard.recordFailure(totpSetting(2, null), "u1@x.com",
                MfaMethod.TOTP, MfaAttemptGuard.Phase.LOGIN, "invalid_code");

        // Then
        assertThat(outcome.getFailedAttempts()).isEqualTo(3);
        assertThat(outcome.getRemainingAttempts()).isEqualTo(2);
        assertThat(outcome.isLocked()).isFalse();
        verify(audit).failure(eq(AuditCategory.FAILURE), eq("MFA_VERIFICATION_FAILED"), eq(RiskLevel.HIGH),
                anyString(), eq("u1"), eq("u1@x.com"), eq(MfaMethod.TOTP), anyMap());
        verify(audit, never()).failure(any(), eq("MFA_LOCKOUT_TRIGGERED"), any(), any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("Should lock on the fifth failure")
    void recordFailure_FifthFailure_Locks() {
        // Given
        when(store.recordFailure(SETTING_ID, 4, 5, NOW.plusSeconds(900), NOW)).thenReturn(true);

        // When
        MfaAttemptGuard.FailureOutcome outcome = guard.recordFailure(totpSetting(4, null), "u1@x.com",
                MfaMethod.TOTP, MfaAttemptGuard.Phase.SETUP, "invalid_code");

        // Then
        assertThat(outcome.getRemainingAttempts()).isZero();
        assertThat(outcome.getLockedUntil()).isEqualTo(NOW.plusSeconds(900));
        verify(audit).failure(eq(AuditCategory.FAILURE), eq("MFA_SETUP_VERIFICATION_FAILED"), eq(RiskLevel.HIGH),
                anyString(), eq("u1"), eq("u1@x.com"), eq(MfaMethod.TOTP), anyMap());
        verify(audit).failure(eq(AuditCategory.FAILURE), eq("MFA_LOCKOUT_TRIGGERED"), eq(RiskLevel.HIGH),
                anyString(), eq("u1"), eq("u1@x.com"), eq(MfaMethod.TOTP), anyMap());
    }

    @Test
    @DisplayName("Should re-read and retry when a concurrent failure won the race")
    void recordFailure_LostRace_RetriesWithFreshCounter() {
        // Given
        when(store.recordFailure(SETTING_ID, 1, 2, null, NOW)).thenReturn(false);
        when(store.findOne("u1", MfaMethod.TOTP)).thenReturn(Optional.of(totpSetting(2, null)));
        when(store.recordFailure(SETTING_ID, 2, 3, null, NOW)).thenReturn(true);

        // When
        MfaAttemptGuard.FailureOutcome outcome = guard.recordFailure(totpSetting(1, null), "u1@x.com",
                MfaMethod.TOTP, MfaAttemptGuard.Phase.LOGIN, "invalid_code");

        // Then
        assertThat(outcome.getFailedAttempts()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should report the lock set by a concurrent failure")
    void recordFailure_ConcurrentLock_ReturnsLocked() {
        when(store.recordFailure(SETTING_ID, 4, 5, NOW.plusSeconds(900), NOW)).thenReturn(false);
        when(store.findOne("u1", MfaMethod.TOTP)).thenReturn(Optional.of(totpSetting(5, NOW.plusSeconds(899))));

        MfaAttemptGuard.FailureOutcome outcome = guard.recordFailure(totpSetting(4, null), "u1@x.com",
                MfaMethod.TOTP, MfaAttemptGuard.Phase.LOGIN, "invalid_code");

        assertThat(outcome.isLocked()).isTrue();
        assertThat(outcome.getRemainingAttempts()).isZero();
        verify(store, times(1)).recordFailure(any(), anyInt(), anyInt(), any(), any());
    }

    @Test
    @DisplayName("Should give up after the configured number of lost races")
    void recordFailure_RetriesExhausted_Throws() {
        // Given
        when(store.recordFailure(eq(SETTING_ID), anyInt(), anyInt(), isNull(), eq(NOW))).thenReturn(false);
        when(store.findOne("u1", MfaMethod.TOTP)).thenReturn(Optional.of(totpSetting(1, null)));

        // When / Then
        assertThatThrownBy(() -> guard.recordFailure(totpSetting(1, null), "u1@x.com",
                MfaMethod.TOTP, MfaAttemptGuard.Phase.LOGIN, "invalid_code"))
                .isInstanceOf(ConcurrencyFailureException.class);

        verify(store, times(3)).recordFailure(eq(SETTING_ID), anyInt(), anyInt(), isNull(), eq(NOW));
        verifyNoInteractions(audit);
    }

    @Test
    @DisplayName("Should audit integrity failures as CRITICAL and rethrow")
    void reveal_IntegrityFailure_AuditsCritical() {
        // Given
        MfaSetting setting = totpSetting(0, null);
        when(vault.decrypt("v1:secret")).thenThrow(new MfaIntegrityException("Ciphertext failed authentication"));

        // When / Then
        assertThatThrownBy(() -> guard.reveal(setting, "v1:secret", "u1@x.com"))
                .isInstanceOf(MfaIntegrityException.class);

        verify(audit).failure(eq(AuditCategory.FAILURE), eq("MFA_INTEGRITY_FAILURE"), eq(RiskLevel.CRITICAL),
                anyString(), eq("u1"), eq("u1@x.com"), eq(MfaMethod.TOTP), anyMap());
    }

    @Test
    void recordSuccess_ExpectsCounterFromSnapshot() {
        when(store.recordSuccess(SETTING_ID, 3, MfaStatus.ENABLED, NOW)).thenReturn(true);

        guard.recordSuccess(totpSetting(3, null), "u1@x.com", MfaMethod.TOTP, MfaAttemptGuard.Phase.LOGIN,
                MfaStatus.ENABLED);

        verify(store, never()).findOne(anyString(), any());
        verifyNoInteractions(audit);
    }

    @Test
    @DisplayName("Should refuse a stale success once a concurrent failure has locked the setting")
    void recordSuccess_LockedConcurrently_ThrowsLocked() {
        // Given - the code was checked against a snapshot with 4 failures, then the fifth failure locked it
        MfaSetting stale = totpSetting(4, null);
        when(store.recordSuccess(SETTING_ID, 4, MfaStatus.ENABLED, NOW)).thenReturn(false);
        when(store.findOne("u1", MfaMethod.TOTP)).thenReturn(Optional.of(totpSetting(5, NOW.plusSeconds(900))));

        // When / Then
        assertThatThrownBy(() -> guard.recordSuccess(stale, "u1@x.com", MfaMethod.TOTP,
                MfaAttemptGuard.Phase.LOGIN, MfaStatus.ENABLED))
                .isInstanceOf(MfaLockedException.class);

        verify(store, times(1)).recordSuccess(any(), anyInt(), any(), any());
        verify(audit).failure(eq(AuditCategory.FAILURE), eq("MFA_VERIFICATION_BLOCKED"), eq(RiskLevel.HIGH),
                anyString(), eq("u1"), eq("u1@x.com"), eq(MfaMethod.TOTP), anyMap());
    }

    @Test
    @DisplayName("Should retry the success with the fresh counter when a failure landed without locking")
    void recordSuccess_CounterMovedWithoutLock_Retries() {
        // Given
        when(store.recordSuccess(SETTING_ID, 1, MfaStatus.ENABLED, NOW)).thenReturn(false);
        when(store.findOne("u1", MfaMethod.TOTP)).thenReturn(Optional.of(totpSetting(2, null)));
        when(store.recordSuccess(SETTING_ID, 2, MfaStatus.ENABLED, NOW)).thenReturn(true);

        // When
        guard.recordSuccess(totpSetting(1, null), "u1@x.com", MfaMethod.TOTP, MfaAttemptGuard.Phase.SETUP,
                MfaStatus.ENABLED);

        // Then
        verify(store).recordSuccess(SETTING_ID, 2, MfaStatus.ENABLED, NOW);
        verifyNoInteractions(audit);
    }

    @Test
    @DisplayName("Should give up on the success write after repeated lost races")
    void recordSuccess_RetriesExhausted_ThrowsConcurrencyFailure() {
        when(store.recordSuccess(any(), anyInt(), any(), any())).thenReturn(false);
        when(store.findOne("u1", MfaMethod.TOTP)).thenReturn(Optional.of(totpSetting(1, null)));

        assertThatThrownBy(() -> guard.recordSuccess(totpSetting(0, null), "u1@x.com", MfaMethod.TOTP,
                MfaAttemptGuard.Phase.LOGIN, MfaStatus.ENABLED))
                .isInstanceOf(ConcurrencyFailureException.class);
    }

    private static MfaSetting totpSetting(int failedAttempts, OffsetDateTime lockedUntil) {
        return new MfaSetting(SETTING_ID, "u1", new MfaFactor.Totp("v1:secret", null), MfaStatus.ENABLED,
                List.of(), failedAttempts, lockedUntil, null, NOW.minusDays(1), NOW.minusDays(1));
    }
}
