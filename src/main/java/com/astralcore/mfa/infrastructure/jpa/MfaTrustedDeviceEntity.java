package com.astralcore.mfa.infrastructure.jpa;

import jakarta.persistence.*;
import java.time.OffsetDateTime;

@Entity
@Table(name = "mfa_trusted_devices", indexes = @Index(name = "idx_mfa_trusted_devices_user", columnList = "user_id"))
public class MfaTrustedDeviceEntity {

    @Id
    @Column(name = "token_id", length = 64)
    private String tokenId;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "trusted_at", nullable = false)
    private OffsetDateTime trustedAt;

    @Column(name = "expires_at")
    private OffsetDateTime expiresAt;

    @Column(name = "last_seen_at")
    private OffsetDateTime lastSeenAt;

    @Column(name = "revoked_at")
    private OffsetDateTime revokedAt;

    @Column(name = "revoked_by", length = 64)
    private String revokedBy;

    // Constructors
    public MfaTrustedDeviceEntity() {}

    // Getters and Setters
    public String getTokenId() { return tokenId; }
    public void setTokenId(String tokenId) { this.tokenId = tokenId; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public OffsetDateTime getTrustedAt() { return trustedAt; }
    public void setTrustedAt(OffsetDateTime trustedAt) { this.trustedAt = trustedAt; }

    public OffsetDateTime getExpiresAt() { return expiresAt; }
    public void setExpiresAt(OffsetDateTime expiresAt) { this.expiresAt = expiresAt; }

    public OffsetDateTime getLastSeenAt() { return lastSeenAt; }
    public void setLastSeenAt(OffsetDateTime lastSeenAt) { this.lastSeenAt = lastSeenAt; }

    public OffsetDateTime getRevokedAt() { return revokedAt; }
    public void setRevokedAt(OffsetDateTime revokedAt) { this.revokedAt = revokedAt; }

    public String getRevokedBy() { return revokedBy; }
    public void setRevokedBy(String revokedBy) { this.revokedBy = revokedBy; }
}
