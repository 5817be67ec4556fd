package com.astralcore.mfa.infrastructure.jpa;

import com.astralcore.mfa.domain.mfa.MfaMethod;
import com.astralcore.mfa.domain.mfa.MfaStatus;
import jakarta.persistence.*;
import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "mfa_settings",
        uniqueConstraints = @UniqueConstraint(name = "uk_mfa_settings_user_method", columnNames = {"user_id", "method"}))
public class MfaSettingEntity {

    @Id
    private UUID id = UUID.randomUUID();

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private MfaMethod method;

    @Column(nullable = false, length = 30)
    @Enumerated(EnumType.STRING)
    private MfaStatus status = MfaStatus.PENDING_SETUP;

    @Column(name = "encrypted_secret", columnDefinition = "TEXT")
    private String encryptedSecret;

    @Column(name = "encrypted_phone_number", columnDefinition = "TEXT")
    private String encryptedPhoneNumber;

    @Column(name = "last_totp_step")
    private Long lastTotpStep;

    @Column(name = "failed_attempts", nullable = false)
    private int failedAttempts = 0;

    @Column(name = "locked_until")
    private OffsetDateTime lockedUntil;

    @Column(name = "last_used_at")
    private OffsetDateTime lastUsedAt;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    // Constructors
    public MfaSettingEntity() {}

    // Getters and Setters
    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public MfaMethod getMethod() { return method; }
    public void setMethod(MfaMethod method) { this.method = method; }

    public MfaStatus getStatus() { return status; }
    public void setStatus(MfaStatus status) { this.status = status; }

    public String getEncryptedSecret() { return encryptedSecret; }
    public void setEncryptedSecret(String encryptedSecret) { this.encryptedSecret = encryptedSecret; }

    public String getEncryptedPhoneNumber() { return encryptedPhoneNumber; }
    public void setEncryptedPhoneNumber(String encryptedPhoneNumber) { this.encryptedPhoneNumber = encryptedPhoneNumber; }

    public Long getLastTotpStep() { return lastTotpStep; }
    public void setLastTotpStep(Long lastTotpStep) { this.lastTotpStep = lastTotpStep; }

    public int getFailedAttempts() { return failedAttempts; }
    public void setFailedAttempts(int failedAttempts) { this.failedAttempts = failedAttempts; }

    public OffsetDateTime getLockedUntil() { return lockedUntil; }
    public void setLockedUntil(OffsetDateTime lockedUntil) { this.lockedUntil = lockedUntil; }

    public OffsetDateTime getLastUsedAt() { return lastUsedAt; }
    public void setLastUsedAt(OffsetDateTime lastUsedAt) { this.lastUsedAt = lastUsedAt; }

    public OffsetDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(OffsetDateTime createdAt) { this.createdAt = createdAt; }

    public OffsetDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(OffsetDateTime updatedAt) { this.updatedAt = updatedAt; }
}
