package com.astralcore.mfa.domain.mfa;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Failure counting and cooldown rules shared by setup-time and login-time verification.
 * Holds no state; callers persist the returned {@link Decision}.
 */
public class LockoutPolicy {

    private final int maxAttempts;
    private final Duration cooldown;

    public LockoutPolicy(int maxAttempts, Duration cooldown) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (cooldown == null || cooldown.isNegative() || cooldown.isZero()) {
            throw new IllegalArgumentException("cooldown must be positive");
        }
        this.maxAttempts = maxAttempts;
        this.cooldown = cooldown;
    }

    public boolean isLocked(OffsetDateTime lockedUntil, OffsetDateTime now) {
        return lockedUntil != null && lockedUntil.isAfter(now);
    }

    public Decision onFailure(int failedAttempts, OffsetDateTime now) {
        int next = failedAttempts + 1;
        if (next >= maxAttempts) {
            return new Decision(next, now.plus(cooldown));
        }
        return new Decision(next, null);
    }

    public Decision onSuccess() {
        return new Decision(0, null);
    }

    public int remainingAttempts(int failedAttempts) {
        return Math.max(0, maxAttempts - failedAttempts);
    }

    public int getMaxAttempts() { return maxAttempts; }
    public Duration getCooldown() { return cooldown; }

    /**
     * Counter and lock values to write back.
     */
    public record Decision(int failedAttempts, OffsetDateTime lockedUntil) {
        public boolean locked() {
            return lockedUntil != null;
        }
    }
}
