package com.astralcore.mfa.infrastructure.notify;

import com.astralcore.mfa.domain.ports.ChallengeDeliveryPort;
import com.astralcore.mfa.infrastructure.mfa.Masking;
import org.slf4j.Logger; import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stand-in for the SMS gateway and mail sender. Logs the masked destination only; the code itself is never logged.
 */
@Component
public class LoggingChallengeDelivery implements ChallengeDeliveryPort {
  private static final Logger log = LoggerFactory.getLogger(LoggingChallengeDelivery.class);

  @Override public void sendSms(String phoneNumber, String code) {
    log.info("📱 SMS challenge dispatched to {} ({} digits)", Masking.maskPhoneNumber(phoneNumber), code.length());
  }

  @Override public void sendEmail(String address, String code) {
    log.info("📧 Email challenge dispatched to {} ({} digits)", Masking.maskEmail(address), code.length());
  }
}
