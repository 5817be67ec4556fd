package com.astralcore.mfa.infrastructure.mfa;

import com.astralcore.mfa.config.MfaProperties;
import com.astralcore.mfa.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TotpCodeService")
class TotpCodeServiceTest {

    /** "12345678901234567890" in Base32, the RFC 4226 / 6238 test secret. */
    private static final String RFC_SECRET = "GEZDGNBVGY3TQOJQGEZDGNBVGY3TQOJQ";

    private MutableClock clock;
    private TotpCodeService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.ofEpochSecond(1111111109L));
        service = new TotpCodeService(new MfaProperties(), clock);
    }

    @Test
    @DisplayName("HOTP values match RFC 4226 appendix D")
    void matchesRfc4226Vectors() {
        List<String> expected = List.of("755224", "287082", "359152", "969429", "338314");
        for (int counter = 0; counter < expected.size(); counter++) {
            assertThat(service.generateCode(RFC_SECRET, counter)).isEqualTo(expected.get(counter));
        }
    }

    @Test
    @DisplayName("TOTP values match RFC 6238 SHA-1 vectors truncated to 6 digits")
    void matchesRfc6238Vectors() {
        assertThat(service.matchStep(RFC_SECRET, "287082", Instant.ofEpochSecond(59)))
                .hasValue(1L);
        assertThat(service.matchStep(RFC_SECRET, "081804", Instant.ofEpochSecond(1111111109L)))
                .hasValue(1111111109L / 30);
    }

    @Test
    @DisplayName("codes from one step either side are accepted")
    void acceptsAdjacentSteps() {
        long current = service.currentTimeStep();

        assertThat(service.verifyCode(RFC_SECRET, service.generateCode(RFC_SECRET, current - 1))).isTrue();
        assertThat(service.verifyCode(RFC_SECRET, service.generateCode(RFC_SECRET, current))).isTrue();
        assertThat(service.verifyCode(RFC_SECRET, service.generateCode(RFC_SECRET, current + 1))).isTrue();
        assertThat(service.matchStep(RFC_SECRET, service.generateCode(RFC_SECRET, current + 1)))
                .hasValue(current + 1);
    }

    @Test
    @DisplayName("codes two steps away are rejected")
    void rejectsStepsOutsideWindow() {
        long current = service.currentTimeStep();

        assertThat(service.verifyCode(RFC_SECRET, service.generateCode(RFC_SECRET, current - 2))).isFalse();
        assertThat(service.verifyCode(RFC_SECRET, service.generateCode(RFC_SECRET, current + 2))).isFalse();
    }

    @Test
    void rejectsMalformedCodes() {
        assertThat(service.verifyCode(RFC_SECRET, "12345")).isFalse();
        assertThat(service.verifyCode(RFC_SECRET, "12a456")).isFalse();
        assertThat(service.verifyCode(RFC_SECRET, null)).isFalse();
        assertThat(service.verifyCode(null, "123456")).isFalse();
    }

    @Test
    @DisplayName("provisioning URI encodes label and issuer as URI components")
    void buildsProvisioningUri() {
        assertThat(service.provisioningUri("u1@x.com", "JBSWY3DPEHPK3PXP")).isEqualTo(
                "otpauth://totp/Astral%20Core%3Au1%40x.com?secret=JBSWY3DPEHPK3PXP"
                        + "&issuer=Astral%20Core&digits=6&period=30");
    }

    @Test
    void generatesBase32Secrets() {
        String secret = service.generateSecret();

        assertThat(secret).hasSize(32).matches("[A-Z2-7]+");
        assertThat(service.generateSecret()).isNotEqualTo(secret);
    }

    @Test
    void rendersQrCodeAsPng() {
        byte[] png = Base64.getDecoder().decode(service.generateQrCode("otpauth://totp/x?secret=ABC"));

        assertThat(png).startsWith((byte) 0x89, (byte) 'P', (byte) 'N', (byte) 'G');
    }
}
