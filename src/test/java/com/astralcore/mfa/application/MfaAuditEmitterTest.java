package com.astralcore.mfa.application;

import com.astralcore.mfa.domain.audit.AuditCategory;
import com.astralcore.mfa.domain.audit.AuditEvent;
import com.astralcore.mfa.domain.audit.AuditOutcome;
import com.astralcore.mfa.domain.audit.RiskLevel;
import com.astralcore.mfa.domain.mfa.MfaMethod;
import com.astralcore.mfa.domain.ports.AuditSink;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class MfaAuditEmitterTest {

    @Mock
    private AuditSink sink;

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-02T09:00:00Z"), ZoneOffset.UTC);

    @Test
    void buildsEventWithOutcomeAndTimestamp() {
        MfaAuditEmitter emitter = new MfaAuditEmitter(sink, clock);
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("adminId", null);

        emitter.failure(AuditCategory.DISABLEMENT, "MFA_DISABLE_DENIED", RiskLevel.HIGH, "denied",
                "u1", "u1@x.com", MfaMethod.TOTP, metadata);

        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(sink).record(captor.capture());
        AuditEvent event = captor.getValue();
        assertThat(event.outcome()).isEqualTo(AuditOutcome.FAILURE);
        assertThat(event.riskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(event.occurredAt().toInstant()).isEqualTo(clock.instant());
        assertThat(event.metadata()).containsKey("adminId");
        assertThat(event.eventId()).isNotNull();
    }

    @Test
    void sinkFailureDoesNotPropagate() {
        MfaAuditEmitter emitter = new MfaAuditEmitter(sink, clock);
        doThrow(new IllegalStateException("audit table unavailable")).when(sink).record(any());

        assertThatCode(() -> emitter.success(AuditCategory.VERIFICATION, "MFA_VERIFICATION_SUCCESS",
                RiskLevel.LOW, "ok", "u1", "u1@x.com", MfaMethod.TOTP, null))
                .doesNotThrowAnyException();
    }
}
