package com.astralcore.mfa.domain.mfa;

/**
 * Method-specific enrolment data of a setting. Secrets and phone numbers are held as vault ciphertext only.
 */
public sealed interface MfaFactor permits MfaFactor.Totp, MfaFactor.Sms, MfaFactor.Email {

    MfaMethod method();

    /**
     * @param encryptedSecret vault ciphertext of the Base32 shared secret
     * @param lastUsedStep    last accepted time step, or null if no code has been accepted yet
     */
    record Totp(String encryptedSecret, Long lastUsedStep) implements MfaFactor {
        public Totp {
            if (encryptedSecret == null || encryptedSecret.isBlank()) {
                throw new IllegalArgumentException("TOTP factor requires a secret");
            }
        }

        @Override
        public MfaMethod method() {
            return MfaMethod.TOTP;
        }
    }

    record Sms(String encryptedPhoneNumber) implements MfaFactor {
        public Sms {
            if (encryptedPhoneNumber == null || encryptedPhoneNumber.isBlank()) {
                throw new IllegalArgumentException("SMS factor requires a phone number");
            }
        }

        @Override
        public MfaMethod method() {
            return MfaMethod.SMS;
        }
    }

    /** Codes go to the account email, so nothing is stored. */
    record Email() implements MfaFactor {
        @Override
        public MfaMethod method() {
            return MfaMethod.EMAIL;
        }
    }
}
