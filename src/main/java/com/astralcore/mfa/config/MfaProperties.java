package com.astralcore.mfa.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "app.mfa")
public class MfaProperties {
    private Totp totp = new Totp();
    private QrCode qrCode = new QrCode();
    private Challenge challenge = new Challenge();
    private BackupCodes backupCodes = new BackupCodes();
    private Lockout lockout = new Lockout();
    private TrustedDevices trustedDevices = new TrustedDevices();
    private Housekeeping housekeeping = new Housekeeping();

    public Totp getTotp() { return totp; }
    public QrCode getQrCode() { return qrCode; }
    public Challenge getChallenge() { return challenge; }
    public BackupCodes getBackupCodes() { return backupCodes; }
    public Lockout getLockout() { return lockout; }
    public TrustedDevices getTrustedDevices() { return trustedDevices; }
    public Housekeeping getHousekeeping() { return housekeeping; }

    public static class Totp {
        private String issuer = "Astral Core";
        private int digits = 6;
        private int periodSeconds = 30;
        private int windowSize = 1;
        private boolean replayProtection = false;

        public String getIssuer() { return issuer; }
        public void setIssuer(String issuer) { this.issuer = issuer; }
        public int getDigits() { return digits; }
        public void setDigits(int digits) { this.digits = digits; }
        public int getPeriodSeconds() { return periodSeconds; }
        public void setPeriodSeconds(int periodSeconds) { this.periodSeconds = periodSeconds; }
        public int getWindowSize() { return windowSize; }
        public void setWindowSize(int windowSize) { this.windowSize = windowSize; }
        public boolean isReplayProtection() { return replayProtection; }
        public void setReplayProtection(boolean replayProtection) { this.replayProtection = replayProtection; }
    }

    public static class QrCode {
        private int width = 300;
        private int height = 300;

        public int getWidth() { return width; }
        public void setWidth(int width) { this.width = width; }
        public int getHeight() { return height; }
        public void setHeight(int height) { this.height = height; }
    }

    public static class Challenge {
        private int length = 6;
        private long ttlSeconds = 300;

        public int getLength() { return length; }
        public void setLength(int length) { this.length = length; }
        public long getTtlSeconds() { return ttlSeconds; }
        public void setTtlSeconds(long ttlSeconds) { this.ttlSeconds = ttlSeconds; }
    }

    public static class BackupCodes {
        private int count = 10;
        private int length = 8;

        public int getCount() { return count; }
        public void setCount(int count) { this.count = count; }
        public int getLength() { return length; }
        public void setLength(int length) { this.length = length; }
    }

    public static class Lockout {
        private int maxAttempts = 5;
        private long cooldownSeconds = 900;
        private int casRetries = 3;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public long getCooldownSeconds() { return cooldownSeconds; }
        public void setCooldownSeconds(long cooldownSeconds) { this.cooldownSeconds = cooldownSeconds; }
        public int getCasRetries() { return casRetries; }
        public void setCasRetries(int casRetries) { this.casRetries = casRetries; }
    }

    public static class TrustedDevices {
        private boolean enabled = true;
        private int expiryDays = 30;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getExpiryDays() { return expiryDays; }
        public void setExpiryDays(int expiryDays) { this.expiryDays = expiryDays; }
    }

    public static class Housekeeping {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
