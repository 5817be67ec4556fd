// ==============================================================================
// TotpCodeService.java - RFC 6238 codes, provisioning URI and QR rendering
// File: src/main/java/com/astralcore/mfa/infrastructure/mfa/TotpCodeService.java
// ==============================================================================

package com.astralcore.mfa.infrastructure.mfa;

import com.astralcore.mfa.config.MfaProperties;
import com.google.zxing.BarcodeFormat;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;
import dev.samstevens.totp.code.CodeGenerator;
import dev.samstevens.totp.code.DefaultCodeGenerator;
import dev.samstevens.totp.code.HashingAlgorithm;
import dev.samstevens.totp.exceptions.CodeGenerationException;
import dev.samstevens.totp.secret.DefaultSecretGenerator;
import dev.samstevens.totp.secret.SecretGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.OptionalLong;
import java.util.regex.Pattern;

@Service
public class TotpCodeService {

    private static final Logger log = LoggerFactory.getLogger(TotpCodeService.class);

    private final String issuer;
    private final int digits;
    private final int periodSeconds;
    private final int windowSize;
    private final int qrWidth;
    private final int qrHeight;
    private final Pattern codeFormat;

    private final Clock clock;
    private final SecretGenerator secretGenerator;
    private final CodeGenerator codeGenerator;

    public TotpCodeService(MfaProperties properties, Clock clock) {
        MfaProperties.Totp totp = properties.getTotp();
        this.issuer = totp.getIssuer();
        this.digits = totp.getDigits();
        this.periodSeconds = totp.getPeriodSeconds();
        this.windowSize = totp.getWindowSize();
        this.qrWidth = properties.getQrCode().getWidth();
        this.qrHeight = properties.getQrCode().getHeight();
        this.codeFormat = Pattern.compile("^[0-9]{" + digits + "}$");
        this.clock = clock;

        this.secretGenerator = new DefaultSecretGenerator();
        this.codeGenerator = new DefaultCodeGenerator(HashingAlgorithm.SHA1, digits);

        log.info("✅ TOTP service initialized - Issuer: {}, Digits: {}, Period: {}s, Window: ±{}",
                issuer, digits, periodSeconds, windowSize);
    }

    /**
     * New Base32 shared secret.
     */
    public String generateSecret() {
        return secretGenerator.generate();
    }

    /**
     * {@code otpauth://totp/<Issuer:email>?secret=..&issuer=..&digits=..&period=..} with label and issuer
     * percent-encoded as URI components.
     */
    public String provisioningUri(String email, String secret) {
        String label = issuer + ":" + email;
        return "otpauth://totp/" + encodeComponent(label)
                + "?secret=" + secret
                + "&issuer=" + encodeComponent(issuer)
                + "&digits=" + digits
                + "&period=" + periodSeconds;
    }

    /**
     * PNG QR code of the URI, Base64 encoded.
     */
    public String generateQrCode(String uri) {
        try {
            BitMatrix bitMatrix = new QRCodeWriter().encode(uri, BarcodeFormat.QR_CODE, qrWidth, qrHeight);

            ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
            MatrixToImageWriter.writeToStream(bitMatrix, "PNG", outputStream);

            log.debug("Generated QR code image of size: {} bytes", outputStream.size());
            return Base64.getEncoder().encodeToString(outputStream.toByteArray());
        } catch (WriterException | IOException e) {
            log.error("❌ Failed to generate QR code: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to generate QR code", e);
        }
    }

    public long timeStep(Instant instant) {
        return instant.getEpochSecond() / periodSeconds;
    }

    public long currentTimeStep() {
        return timeStep(clock.instant());
    }

    public String generateCode(String secret, long step) {
        try {
            return codeGenerator.generate(secret, step);
        } catch (CodeGenerationException e) {
            log.error("❌ Failed to compute TOTP code: {}", e.getMessage());
            throw new IllegalStateException("Failed to compute TOTP code", e);
        }
    }

    /**
     * Checks the candidate against every step in {@code T-window .. T+window} for the current time.
     *
     * @return the matching step, empty if none matched
     */
    public OptionalLong matchStep(String secret, String candidate) {
        return matchStep(secret, candidate, clock.instant());
    }

    public OptionalLong matchStep(String secret, String candidate, Instant at) {
        if (secret == null || secret.isBlank() || !isValidCodeFormat(candidate)) {
            return OptionalLong.empty();
        }

        long current = timeStep(at);
        for (long step = current - windowSize; step <= current + windowSize; step++) {
            if (CodeComparison.matches(generateCode(secret, step), candidate)) {
                return OptionalLong.of(step);
            }
        }
        return OptionalLong.empty();
    }

    public boolean verifyCode(String secret, String candidate) {
        return matchStep(secret, candidate).isPresent();
    }

    public boolean isValidCodeFormat(String code) {
        return code != null && codeFormat.matcher(code).matches();
    }

    private static String encodeComponent(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("%21", "!")
                .replace("%27", "'")
                .replace("%28", "(")
                .replace("%29", ")")
                .replace("%7E", "~");
    }
}
