package com.astralcore.mfa.domain.ports;

import com.astralcore.mfa.domain.mfa.TrustedDevice;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

public interface TrustedDeviceStore {

    void save(TrustedDevice device);

    Optional<TrustedDevice> findByTokenId(String tokenId);

    List<TrustedDevice> findActive(String userId, OffsetDateTime now);

    void touch(String tokenId, OffsetDateTime now);

    int revokeAll(String userId, String revokedBy, OffsetDateTime now);

    int purgeExpired(OffsetDateTime now);
}
