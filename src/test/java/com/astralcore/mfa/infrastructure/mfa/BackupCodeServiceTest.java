package com.astralcore.mfa.infrastructure.mfa;

import com.astralcore.mfa.config.MfaProperties;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BackupCodeServiceTest {

    private final BackupCodeService service = new BackupCodeService(new MfaProperties());

    @Test
    void generatesTenEightCharacterCodes() {
        List<String> codes = service.generateBackupCodes();

        assertThat(codes).hasSize(10).allMatch(code -> code.matches("^[A-Z0-9]{8}$"));
        assertThat(new HashSet<>(codes)).hasSize(10);
    }

    @Test
    void normalizesCaseAndWhitespace() {
        assertThat(service.normalize("  ab12cd34 ")).isEqualTo("AB12CD34");
        assertThat(service.normalize(null)).isNull();
    }

    @Test
    void validatesFormat() {
        assertThat(service.isValidFormat("AB12CD34")).isTrue();
        assertThat(service.isValidFormat("AB12CD3")).isFalse();
        assertThat(service.isValidFormat("AB12-D34")).isFalse();
        assertThat(service.isValidFormat(null)).isFalse();
    }
}
