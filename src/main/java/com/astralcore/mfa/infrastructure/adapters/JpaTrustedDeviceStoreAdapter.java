package com.astralcore.mfa.infrastructure.adapters;

import com.astralcore.mfa.domain.mfa.TrustedDevice;
import com.astralcore.mfa.domain.ports.TrustedDeviceStore;
import com.astralcore.mfa.infrastructure.jpa.MfaTrustedDeviceEntity;
import com.astralcore.mfa.infrastructure.jpa.SpringMfaTrustedDeviceRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Component
public class JpaTrustedDeviceStoreAdapter implements TrustedDeviceStore {

    private final SpringMfaTrustedDeviceRepository repository;

    public JpaTrustedDeviceStoreAdapter(SpringMfaTrustedDeviceRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional
    public void save(TrustedDevice device) {
        MfaTrustedDeviceEntity entity = new MfaTrustedDeviceEntity();
        entity.setTokenId(device.getTokenId());
        entity.setUserId(device.getUserId());
        entity.setTrustedAt(device.getTrustedAt());
        entity.setExpiresAt(device.getExpiresAt());
        entity.setLastSeenAt(device.getLastSeenAt());
        entity.setRevokedAt(device.getRevokedAt());
        entity.setRevokedBy(device.getRevokedBy());
        repository.save(entity);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<TrustedDevice> findByTokenId(String tokenId) {
        return repository.findById(tokenId).map(JpaTrustedDeviceStoreAdapter::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<TrustedDevice> findActive(String userId, OffsetDateTime now) {
        return repository.findActiveTrustedDevices(userId, now).stream()
                .map(JpaTrustedDeviceStoreAdapter::toDomain)
                .toList();
    }

    @Override
    @Transactional
    public void touch(String tokenId, OffsetDateTime now) {
        repository.updateLastSeen(tokenId, now);
    }

    @Override
    @Transactional
    public int revokeAll(String userId, String revokedBy, OffsetDateTime now) {
        return repository.revokeAllForUser(userId, revokedBy, now);
    }

    @Override
    @Transactional
    public int purgeExpired(OffsetDateTime now) {
        return repository.deleteExpired(now);
    }

    private static TrustedDevice toDomain(MfaTrustedDeviceEntity e) {
        return new TrustedDevice(e.getTokenId(), e.getUserId(), e.getTrustedAt(), e.getExpiresAt(),
                e.getLastSeenAt(), e.getRevokedAt(), e.getRevokedBy());
    }
}
