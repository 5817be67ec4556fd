package com.astralcore.mfa.infrastructure.mfa;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MaskingTest {

    @Test
    void masksLastFourDigitsOfPhone() {
        assertThat(Masking.maskPhoneNumber("+15551234567")).isEqualTo("+1555123****");
        assertThat(Masking.maskPhoneNumber("123")).isEqualTo("****");
    }

    @Test
    void keepsFirstTwoCharactersOfEmail() {
        assertThat(Masking.maskEmail("jane@example.org")).isEqualTo("ja***@example.org");
        assertThat(Masking.maskEmail("jo@example.org")).isEqualTo("**@example.org");
        assertThat(Masking.maskEmail("nobody")).isEqualTo("****");
    }
}
