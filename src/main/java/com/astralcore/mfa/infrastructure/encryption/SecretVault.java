// ==============================================================================
// Secret Vault: AES-256-GCM encryption of MFA secrets, phone numbers and backup codes
// File: src/main/java/com/astralcore/mfa/infrastructure/encryption/SecretVault.java
// ==============================================================================

package com.astralcore.mfa.infrastructure.encryption;

import com.astralcore.mfa.exception.MfaIntegrityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

@Service
public class SecretVault {

    private static final Logger log = LoggerFactory.getLogger(SecretVault.class);

    // AES-GCM configuration
    private static final String ALGORITHM = "AES";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 16;
    private static final int GCM_TAG_LENGTH = 16; // 128 bits
    private static final int AES_KEY_LENGTH = 32; // 256 bits
    private static final String VERSION_PREFIX = "v";
    private static final char VERSION_SEPARATOR = ':';

    private final SecretKeySpec secretKey;
    private final int keyVersion;
    private final SecureRandom secureRandom;

    public SecretVault(
            @Value("${MFA_ENCRYPTION_KEY:}") String base64Key,
            @Value("${app.encryption.key-version:1}") int keyVersion) {

        this.keyVersion = keyVersion;
        this.secureRandom = new SecureRandom();

        if (base64Key == null || base64Key.isBlank()) {
            log.error("❌ MFA_ENCRYPTION_KEY is not set, refusing to start");
            throw new IllegalStateException("MFA_ENCRYPTION_KEY is required (Base64 of 32 random bytes)");
        }

        byte[] decodedKey;
        try {
            decodedKey = Base64.getDecoder().decode(base64Key.trim());
        } catch (IllegalArgumentException e) {
            log.error("❌ MFA_ENCRYPTION_KEY is not valid Base64");
            throw new IllegalStateException("Invalid encryption key configuration", e);
        }
        if (decodedKey.length != AES_KEY_LENGTH) {
            throw new IllegalStateException(String.format(
                    "Invalid key length: %d bytes. Expected %d bytes for AES-256.", decodedKey.length, AES_KEY_LENGTH));
        }
        this.secretKey = new SecretKeySpec(decodedKey, ALGORITHM);
        log.info("✅ Secret vault initialized - Algorithm: AES-256-GCM, KeyVersion: {}", keyVersion);
    }

    /**
     * Encrypts with a fresh random IV. Output is {@code v<keyVersion>:} followed by Base64 of IV, cipher output and tag.
     */
    public String encrypt(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext must not be null");
        }

        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));

            // GCM appends the tag to the cipher output
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            byte[] payload = ByteBuffer.allocate(iv.length + sealed.length)
                    .put(iv)
                    .put(sealed)
                    .array();

            return VERSION_PREFIX + keyVersion + VERSION_SEPARATOR + Base64.getEncoder().encodeToString(payload);

        } catch (GeneralSecurityException e) {
            log.error("❌ Encryption failed: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to encrypt value", e);
        }
    }

    /**
     * @throws MfaIntegrityException if the value is malformed, was sealed under another key version, or fails
     *                               tag verification
     */
    public String decrypt(String ciphertext) {
        if (ciphertext == null || ciphertext.isBlank()) {
            throw new MfaIntegrityException("Ciphertext is missing");
        }

        int separator = ciphertext.indexOf(VERSION_SEPARATOR);
        if (!ciphertext.startsWith(VERSION_PREFIX) || separator < 2) {
            throw new MfaIntegrityException("Ciphertext has no key version");
        }

        int version;
        try {
            version = Integer.parseInt(ciphertext.substring(VERSION_PREFIX.length(), separator));
        } catch (NumberFormatException e) {
            throw new MfaIntegrityException("Ciphertext has a malformed key version", e);
        }
        if (version != keyVersion) {
            throw new MfaIntegrityException("Ciphertext was sealed with unknown key version " + version);
        }

        byte[] payload;
        try {
            payload = Base64.getDecoder().decode(ciphertext.substring(separator + 1));
        } catch (IllegalArgumentException e) {
            throw new MfaIntegrityException("Ciphertext is not valid Base64", e);
        }
        if (payload.length < GCM_IV_LENGTH + GCM_TAG_LENGTH) {
            throw new MfaIntegrityException("Ciphertext is truncated");
        }

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH * 8, payload, 0, GCM_IV_LENGTH));
            byte[] plain = cipher.doFinal(payload, GCM_IV_LENGTH, payload.length - GCM_IV_LENGTH);
            return new String(plain, StandardCharsets.UTF_8);

        } catch (AEADBadTagException e) {
            log.error("❌ Authentication tag mismatch on stored MFA ciphertext");
            throw new MfaIntegrityException("Ciphertext failed authentication", e);
        } catch (GeneralSecurityException e) {
            log.error("❌ Decryption failed: {}", e.getMessage());
            throw new MfaIntegrityException("Failed to decrypt value", e);
        }
    }

    /**
     * SHA-256 hex digest, used where a value only needs to be compared, never recovered.
     */
    public String generateHash(String input) {
        if (input == null) {
            return null;
        }

        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashBytes = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashBytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    public int getCurrentKeyVersion() {
        return keyVersion;
    }
}
