package com.astralcore.mfa.domain.ports;

/**
 * Out-of-band delivery of challenge codes. Implementations receive the real destination.
 */
public interface ChallengeDeliveryPort {

    void sendSms(String phoneNumber, String code);

    void sendEmail(String address, String code);
}
