// ==============================================================================
// Trusted Device Domain Model
// File: src/main/java/com/astralcore/mfa/domain/mfa/TrustedDevice.java
// ==============================================================================

package com.astralcore.mfa.domain.mfa;

import java.time.OffsetDateTime;

/**
 * A "remember this device" grant, keyed by the id embedded in its trust token
 */
public class TrustedDevice {
    private final String tokenId;
    private final String userId;
    private final OffsetDateTime trustedAt;
    private final OffsetDateTime expiresAt;
    private final OffsetDateTime lastSeenAt;
    private final OffsetDateTime revokedAt;
    private final String revokedBy;

    public TrustedDevice(String tokenId, String userId, OffsetDateTime trustedAt, OffsetDateTime expiresAt,
                         OffsetDateTime lastSeenAt, OffsetDateTime revokedAt, String revokedBy) {
        this.tokenId = tokenId;
        this.userId = userId;
        this.trustedAt = trustedAt;
        this.expiresAt = expiresAt;
        this.lastSeenAt = lastSeenAt;
        this.revokedAt = revokedAt;
        this.revokedBy = revokedBy;
    }

    // Getters
    public String getTokenId() { return tokenId; }
    public String getUserId() { return userId; }
    public OffsetDateTime getTrustedAt() { return trustedAt; }
    public OffsetDateTime getExpiresAt() { return expiresAt; }
    public OffsetDateTime getLastSeenAt() { return lastSeenAt; }
    public OffsetDateTime getRevokedAt() { return revokedAt; }
    public String getRevokedBy() { return revokedBy; }

    public boolean isCurrentlyTrusted(OffsetDateTime now) {
        if (revokedAt != null) {
            return false;
        }
        return expiresAt == null || expiresAt.isAfter(now);
    }

    public boolean isRevoked() {
        return revokedAt != null;
    }
}
