// ==============================================================================
// MFA Setting Domain Model
// File: src/main/java/com/astralcore/mfa/domain/mfa/MfaSetting.java
// ==============================================================================

package com.astralcore.mfa.domain.mfa;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Snapshot of one (user, method) enrolment as read from the store
 */
public class MfaSetting {
    private final UUID id;
    private final String userId;
    private final MfaFactor factor;
    private final MfaStatus status;
    private final List<String> backupCodes;
    private final int failedAttempts;
    private final OffsetDateTime lockedUntil;
    private final OffsetDateTime lastUsed;
    private final OffsetDateTime createdAt;
    private final OffsetDateTime updatedAt;

    public MfaSetting(UUID id, String userId, MfaFactor factor, MfaStatus status, List<String> backupCodes,
                      int failedAttempts, OffsetDateTime lockedUntil, OffsetDateTime lastUsed,
                      OffsetDateTime createdAt, OffsetDateTime updatedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.userId = Objects.requireNonNull(userId, "userId");
        this.factor = Objects.requireNonNull(factor, "factor");
        this.status = Objects.requireNonNull(status, "status");
        this.backupCodes = backupCodes == null ? List.of() : List.copyOf(backupCodes);
        this.failedAttempts = failedAttempts;
        this.lockedUntil = lockedUntil;
        this.lastUsed = lastUsed;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    // Getters
    public UUID getId() { return id; }
    public String getUserId() { return userId; }
    public MfaFactor getFactor() { return factor; }
    public MfaMethod getMethod() { return factor.method(); }
    public MfaStatus getStatus() { return status; }
    public List<String> getBackupCodes() { return backupCodes; }
    public int getFailedAttempts() { return failedAttempts; }
    public OffsetDateTime getLockedUntil() { return lockedUntil; }
    public OffsetDateTime getLastUsed() { return lastUsed; }
    public OffsetDateTime getCreatedAt() { return createdAt; }
    public OffsetDateTime getUpdatedAt() { return updatedAt; }

    public boolean isEnabled() {
        return status == MfaStatus.ENABLED;
    }

    public boolean isPendingSetup() {
        return status == MfaStatus.PENDING_SETUP;
    }
}
