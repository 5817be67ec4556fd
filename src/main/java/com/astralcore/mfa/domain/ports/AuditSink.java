package com.astralcore.mfa.domain.ports;

import com.astralcore.mfa.domain.audit.AuditEvent;

public interface AuditSink {

    void record(AuditEvent event);
}
