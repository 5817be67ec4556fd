package com.astralcore.mfa.infrastructure.housekeeping;

import com.astralcore.mfa.config.MfaProperties;
import com.astralcore.mfa.domain.ports.ChallengeCodeStore;
import com.astralcore.mfa.domain.ports.TrustedDeviceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Enforces the storage TTL of challenge codes and trusted devices by deleting expired rows.
 */
@Component
public class MfaHousekeepingJob {
  private static final Logger log = LoggerFactory.getLogger(MfaHousekeepingJob.class);

  private final ChallengeCodeStore challengeCodes;
  private final TrustedDeviceStore trustedDevices;
  private final Clock clock;
  private final boolean enabled;

  public MfaHousekeepingJob(
          ChallengeCodeStore challengeCodes,
          TrustedDeviceStore trustedDevices,
          MfaProperties properties,
          Clock clock) {
    this.challengeCodes = challengeCodes;
    this.trustedDevices = trustedDevices;
    this.clock = clock;
    this.enabled = properties.getHousekeeping().isEnabled();

    log.info("MfaHousekeepingJob initialized - enabled: {}", enabled);
  }

  @Scheduled(initialDelayString = "${app.mfa.housekeeping.initial-delay-ms:60000}",
          fixedDelayString = "${app.mfa.housekeeping.poll-ms:300000}")
  public void purgeExpired() {
    if (!enabled) {
      log.debug("MFA housekeeping is disabled");
      return;
    }

    OffsetDateTime now = OffsetDateTime.now(clock);
    try {
      int codes = challengeCodes.purgeExpired(now);
      int devices = trustedDevices.purgeExpired(now);

      if (codes > 0 || devices > 0) {
        log.info("🧹 Purged {} expired challenge codes and {} expired trusted devices", codes, devices);
      } else {
        log.trace("Nothing to purge");
      }
    } catch (RuntimeException e) {
      // next run retries
      log.error("MFA housekeeping failed: {}", e.getMessage(), e);
    }
  }
}
