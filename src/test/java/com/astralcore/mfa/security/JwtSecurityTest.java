package com.astralcore.mfa.security;

import com.astralcore.mfa.config.JwtService;
import com.astralcore.mfa.support.MfaTestConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Import(MfaTestConfig.class)
class JwtSecurityTest {

    @Autowired
    private JwtService jwtService;

    @Test
    void shouldGenerateValidToken() {
        String token = jwtService.generateToken("therapist@astral.test", "user-42", Set.of("THERAPIST"));

        assertThat(token).isNotEmpty();
        assertThat(jwtService.getSubject(token)).contains("therapist@astral.test");
        assertThat(jwtService.getUserId(token)).contains("user-42");
    }

    @Test
    void shouldRejectInvalidToken() {
        assertThat(jwtService.getSubject("invalid-token")).isEmpty();
        assertThat(jwtService.getUserId("invalid-token")).isEmpty();
    }

    @Test
    void shouldExtractRolesCorrectly() {
        String token = jwtService.generateToken("admin@astral.test", "admin-1", Set.of("ADMIN", "COMPLIANCE_OFFICER"));

        assertThat(jwtService.getRoles(token)).containsExactlyInAnyOrder("ADMIN", "COMPLIANCE_OFFICER");
    }

    @Test
    void shouldHandleEmptyRoles() {
        String token = jwtService.generateToken("patient@astral.test", "user-7", Set.of());

        assertThat(jwtService.getRoles(token)).isEmpty();
    }

    @Test
    void shouldValidateTokenExpiration() {
        String token = jwtService.generateToken("patient@astral.test", "user-7", Set.of("USER"));

        assertThat(jwtService.isTokenExpired(token)).isFalse();
    }
}
