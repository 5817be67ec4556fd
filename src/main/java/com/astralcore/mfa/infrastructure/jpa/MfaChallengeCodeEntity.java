package com.astralcore.mfa.infrastructure.jpa;

import com.astralcore.mfa.domain.mfa.MfaMethod;
import jakarta.persistence.*;
import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "mfa_challenge_codes", indexes = @Index(name = "idx_mfa_challenge_codes_user_method", columnList = "user_id, method"))
public class MfaChallengeCodeEntity {

    @Id
    private UUID id = UUID.randomUUID();

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private MfaMethod method;

    @Column(name = "code_hash", nullable = false, length = 64)
    private String codeHash;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    // Constructors
    public MfaChallengeCodeEntity() {}

    public MfaChallengeCodeEntity(String userId, MfaMethod method, String codeHash,
                                  OffsetDateTime expiresAt, OffsetDateTime createdAt) {
        this.userId = userId;
        this.method = method;
        this.codeHash = codeHash;
        this.expiresAt = expiresAt;
        this.createdAt = createdAt;
    }

    // Getters and Setters
    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public MfaMethod getMethod() { return method; }
    public void setMethod(MfaMethod method) { this.method = method; }

    public String getCodeHash() { return codeHash; }
    public void setCodeHash(String codeHash) { this.codeHash = codeHash; }

    public OffsetDateTime getExpiresAt() { return expiresAt; }
    public void setExpiresAt(OffsetDateTime expiresAt) { this.expiresAt = expiresAt; }

    public OffsetDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(OffsetDateTime createdAt) { this.createdAt = createdAt; }
}
