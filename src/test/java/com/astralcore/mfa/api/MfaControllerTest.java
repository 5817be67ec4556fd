package com.astralcore.mfa.api;

import com.astralcore.mfa.config.JwtService;
import com.astralcore.mfa.infrastructure.jpa.SpringUserRepository;
import com.astralcore.mfa.infrastructure.jpa.UserEntity;
import com.astralcore.mfa.support.MfaTestConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Set;
import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(MfaTestConfig.class)
@DisplayName("MFA API")
class MfaControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JwtService jwtService;

    @Autowired
    private SpringUserRepository users;

    private String userId;
    private String userToken;

    @BeforeEach
    void setUp() {
        userId = "api-" + UUID.randomUUID();
        userToken = bearer(userId + "@astral.test", userId, Set.of("USER"));
    }

    @Test
    @DisplayName("requests without a Bearer token get a JSON 401")
    void requiresAuthentication() throws Exception {
        mockMvc.perform(get("/mfa/status"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Unauthorized"));
    }

    @Test
    void tamperedTokenIsRejected() throws Exception {
        mockMvc.perform(get("/mfa/status").header(HttpHeaders.AUTHORIZATION, userToken + "x"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("status of a fresh user shows MFA off")
    void statusOfNewUser() throws Exception {
        mockMvc.perform(get("/mfa/status").header(HttpHeaders.AUTHORIZATION, userToken))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Request-Id"))
                .andExpect(jsonPath("$.enabled").value(false))
                .andExpect(jsonPath("$.status").value("DISABLED"))
                .andExpect(jsonPath("$.methods", hasSize(0)));
    }

    @Test
    @DisplayName("TOTP setup returns the provisioning URI, QR image and backup codes")
    void setupTotp() throws Exception {
        mockMvc.perform(post("/mfa/setup/totp").header(HttpHeaders.AUTHORIZATION, userToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.method").value("TOTP"))
                .andExpect(jsonPath("$.qrCodeUri", startsWith("otpauth://totp/Astral%20Core%3A")))
                .andExpect(jsonPath("$.qrCodeImage", startsWith("data:image/png;base64,")))
                .andExpect(jsonPath("$.backupCodes", hasSize(10)));

        mockMvc.perform(post("/mfa/setup/totp").header(HttpHeaders.AUTHORIZATION, userToken))
                .andExpect(status().isOk());
    }

    @Test
    void invalidPhoneNumberIsBadRequest() throws Exception {
        mockMvc.perform(post("/mfa/setup/sms")
                        .header(HttpHeaders.AUTHORIZATION, userToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phoneNumber\":\"555-1234\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MFA_VALIDATION_ERROR"));
    }

    @Test
    void missingFieldIsBadRequest() throws Exception {
        mockMvc.perform(post("/mfa/verify")
                        .header(HttpHeaders.AUTHORIZATION, userToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"method\":\"TOTP\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MFA_VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value("code is required"));
    }

    @Test
    void verifyWithoutPendingSetupIsNotFound() throws Exception {
        mockMvc.perform(post("/mfa/setup/verify")
                        .header(HttpHeaders.AUTHORIZATION, userToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"method\":\"TOTP\",\"code\":\"123456\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("MFA_NOT_FOUND"));
    }

    @Test
    void backupCodesCannotBeSentAsChallenge() throws Exception {
        mockMvc.perform(post("/mfa/challenge")
                        .header(HttpHeaders.AUTHORIZATION, userToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"method\":\"BACKUP_CODE\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MFA_UNSUPPORTED_METHOD"));
    }

    @Test
    void unknownMethodIsBadRequest() throws Exception {
        mockMvc.perform(delete("/mfa/FINGERPRINT").header(HttpHeaders.AUTHORIZATION, userToken))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("admin routes refuse non-admin tokens with a JSON 403")
    void adminRoutesNeedAdminRole() throws Exception {
        mockMvc.perform(get("/mfa/admin/users/{userId}/status", "someone")
                        .header(HttpHeaders.AUTHORIZATION, bearer("t@astral.test", "t1", Set.of("THERAPIST"))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("Forbidden"));
    }

    @Test
    void adminCanReadAnyStatus() throws Exception {
        mockMvc.perform(get("/mfa/admin/users/{userId}/status", userId)
                        .header(HttpHeaders.AUTHORIZATION,
                                bearer("admin@astral.test", "bootstrap-admin", Set.of("SUPER_ADMIN"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(false));
    }

    @Test
    @DisplayName("an administrator cannot disable their own MFA through the admin route")
    void adminCannotDisableOwnMfa() throws Exception {
        String adminId = "admin-" + UUID.randomUUID();
        users.save(new UserEntity(adminId, adminId + "@astral.test", "ADMIN"));

        mockMvc.perform(delete("/mfa/admin/users/{userId}/{method}", adminId, "TOTP")
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminId + "@astral.test", adminId, Set.of("ADMIN"))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("MFA_PERMISSION_DENIED"));
    }

    private String bearer(String email, String uid, Set<String> roles) {
        return "Bearer " + jwtService.generateToken(email, uid, roles);
    }
}
