package com.astralcore.mfa.application;

import com.astralcore.mfa.domain.mfa.MfaMethod;
import com.astralcore.mfa.domain.mfa.MfaSetting;
import com.astralcore.mfa.domain.mfa.MfaStatus;
import com.astralcore.mfa.domain.mfa.UserAccount;
import com.astralcore.mfa.domain.ports.MfaSettingStore;
import com.astralcore.mfa.domain.ports.TrustedDeviceStore;
import com.astralcore.mfa.domain.ports.UserDirectory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Read-only summary of a user's MFA enrolments.
 */
@Service
public class MfaStatusService {

    private static final List<MfaMethod> METHOD_ORDER = List.of(MfaMethod.TOTP, MfaMethod.SMS, MfaMethod.EMAIL);

    private final MfaSettingStore store;
    private final UserDirectory userDirectory;
    private final TrustedDeviceStore trustedDevices;
    private final Clock clock;

    public MfaStatusService(MfaSettingStore store, UserDirectory userDirectory, TrustedDeviceStore trustedDevices,
                            Clock clock) {
        this.store = store;
        this.userDirectory = userDirectory;
        this.trustedDevices = trustedDevices;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public MfaStatusResult getMfaStatus(String userId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<MfaSetting> settings = store.findAllByUser(userId).stream()
                .sorted(Comparator.comparingInt(s -> METHOD_ORDER.indexOf(s.getMethod())))
                .toList();

        List<MfaMethod> enabledMethods = settings.stream()
                .filter(MfaSetting::isEnabled)
                .map(MfaSetting::getMethod)
                .toList();

        MfaStatus aggregate;
        if (!enabledMethods.isEmpty()) {
            aggregate = MfaStatus.ENABLED;
        } else if (settings.stream().anyMatch(MfaSetting::isPendingSetup)) {
            aggregate = MfaStatus.PENDING_SETUP;
        } else {
            aggregate = MfaStatus.DISABLED;
        }

        OffsetDateTime lastUsed = settings.stream()
                .map(MfaSetting::getLastUsed)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);

        int backupCodesRemaining = settings.stream()
                .filter(MfaSetting::isEnabled)
                .mapToInt(s -> s.getBackupCodes().size())
                .sum();

        List<MethodDetail> details = settings.stream()
                .map(s -> new MethodDetail(s.getMethod(), s.getStatus(), s.getBackupCodes().size(),
                        s.getFailedAttempts(), lockedUntilIfActive(s, now), s.getLastUsed()))
                .toList();

        boolean required = userDirectory.findById(userId).map(UserAccount::requiresMfa).orElse(false);

        return new MfaStatusResult(!enabledMethods.isEmpty(), required, enabledMethods, aggregate, lastUsed,
                backupCodesRemaining, details, trustedDevices.findActive(userId, now).size());
    }

    private static OffsetDateTime lockedUntilIfActive(MfaSetting setting, OffsetDateTime now) {
        OffsetDateTime lockedUntil = setting.getLockedUntil();
        return lockedUntil != null && lockedUntil.isAfter(now) ? lockedUntil : null;
    }

    // ========================================================================
    // RESULT CLASSES
    // ========================================================================

    public static class MfaStatusResult {
        private final boolean enabled;
        private final boolean required;
        private final List<MfaMethod> methods;
        private final MfaStatus status;
        private final OffsetDateTime lastUsed;
        private final int backupCodesRemaining;
        private final List<MethodDetail> details;
        private final int trustedDeviceCount;

        public MfaStatusResult(boolean enabled, boolean required, List<MfaMethod> methods, MfaStatus status,
                               OffsetDateTime lastUsed, int backupCodesRemaining, List<MethodDetail> details,
                               int trustedDeviceCount) {
            this.enabled = enabled;
            this.required = required;
            this.methods = List.copyOf(methods);
            this.status = status;
            this.lastUsed = lastUsed;
            this.backupCodesRemaining = backupCodesRemaining;
            this.details = List.copyOf(details);
            this.trustedDeviceCount = trustedDeviceCount;
        }

        public boolean isEnabled() { return enabled; }
        public boolean isRequired() { return required; }
        public List<MfaMethod> getMethods() { return methods; }
        public MfaStatus getStatus() { return status; }
        public OffsetDateTime getLastUsed() { return lastUsed; }
        public int getBackupCodesRemaining() { return backupCodesRemaining; }
        public List<MethodDetail> getDetails() { return details; }
        public int getTrustedDeviceCount() { return trustedDeviceCount; }
    }

    public record MethodDetail(MfaMethod method, MfaStatus status, int backupCodesRemaining, int failedAttempts,
                               OffsetDateTime lockedUntil, OffsetDateTime lastUsed) {}
}
