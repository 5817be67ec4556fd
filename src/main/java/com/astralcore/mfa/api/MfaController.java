// ==============================================================================
// MFA API Controller - enrolment, verification and management endpoints
// File: src/main/java/com/astralcore/mfa/api/MfaController.java
// ==============================================================================

package com.astralcore.mfa.api;

import com.astralcore.mfa.api.dto.MethodRequest;
import com.astralcore.mfa.api.dto.SetupSmsRequest;
import com.astralcore.mfa.api.dto.TrustedDeviceCheckRequest;
import com.astralcore.mfa.api.dto.VerifyMfaRequest;
import com.astralcore.mfa.api.dto.VerifySetupRequest;
import com.astralcore.mfa.application.MfaEnrollmentService;
import com.astralcore.mfa.application.MfaStatusService;
import com.astralcore.mfa.application.MfaVerificationService;
import com.astralcore.mfa.config.AuthenticatedUser;
import com.astralcore.mfa.domain.mfa.MfaMethod;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/mfa")
@Tag(name = "Multi-Factor Authentication", description = "MFA setup, verification and management")
@SecurityRequirement(name = "Bearer Authentication")
public class MfaController {

    private static final Logger log = LoggerFactory.getLogger(MfaController.class);

    private final MfaEnrollmentService enrollmentService;
    private final MfaVerificationService verificationService;
    private final MfaStatusService statusService;

    public MfaController(MfaEnrollmentService enrollmentService, MfaVerificationService verificationService,
                         MfaStatusService statusService) {
        this.enrollmentService = enrollmentService;
        this.verificationService = verificationService;
        this.statusService = statusService;
    }

    // ==========================================================================
    // STATUS
    // ==========================================================================

    @GetMapping("/status")
    @Operation(summary = "MFA status of the authenticated user")
    public ResponseEntity<MfaStatusService.MfaStatusResult> status(@AuthenticationPrincipal AuthenticatedUser user) {
        return ResponseEntity.ok(statusService.getMfaStatus(user.userId()));
    }

    // ==========================================================================
    // SETUP
    // ==========================================================================

    @PostMapping("/setup/totp")
    @Operation(
        summary = "Start TOTP setup",
        description = """
        Generates a shared secret, an otpauth:// provisioning URI with its QR code, and a batch of backup codes.
        The method stays pending until the first code is verified with /mfa/setup/verify.
        """
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Setup started"),
        @ApiResponse(responseCode = "409", description = "TOTP already enabled"),
        @ApiResponse(responseCode = "423", description = "Too many failed attempts")
    })
    public ResponseEntity<Map<String, Object>> setupTotp(@AuthenticationPrincipal AuthenticatedUser user) {
        MfaEnrollmentService.TotpSetupResult result = enrollmentService.setupTotp(user.userId(), user.email());

        Map<String, Object> response = new HashMap<>();
        response.put("method", MfaMethod.TOTP);
        response.put("secret", result.getSecret());
        response.put("qrCodeUri", result.getProvisioningUri());
        response.put("qrCodeImage", "data:image/png;base64," + result.getQrCodeImage());
        response.put("backupCodes", result.getBackupCodes());
        response.put("instructions", "Scan the QR code with your authenticator app, then verify with the first code");
        return ResponseEntity.ok(response);
    }

    @PostMapping("/setup/sms")
    @Operation(summary = "Start SMS setup", description = "Sends a verification code to an E.164 phone number")
    public ResponseEntity<Map<String, Object>> setupSms(@AuthenticationPrincipal AuthenticatedUser user,
                                                        @Valid @RequestBody SetupSmsRequest request) {
        return ResponseEntity.ok(challengeSetupResponse(
                enrollmentService.setupSms(user.userId(), user.email(), request.phoneNumber())));
    }

    @PostMapping("/setup/email")
    @Operation(summary = "Start EMAIL setup", description = "Sends a verification code to the account email")
    public ResponseEntity<Map<String, Object>> setupEmail(@AuthenticationPrincipal AuthenticatedUser user) {
        return ResponseEntity.ok(challengeSetupResponse(enrollmentService.setupEmail(user.userId(), user.email())));
    }

    @PostMapping("/setup/verify")
    @Operation(summary = "Complete a pending setup with its first code")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Verified, or rejected with remaining attempts"),
        @ApiResponse(responseCode = "404", description = "No pending setup"),
        @ApiResponse(responseCode = "423", description = "Too many failed attempts")
    })
    public ResponseEntity<Map<String, Object>> verifySetup(@AuthenticationPrincipal AuthenticatedUser user,
                                                           @Valid @RequestBody VerifySetupRequest request) {
        MfaEnrollmentService.SetupVerificationResult result =
                enrollmentService.verifySetup(user.userId(), user.email(), request.method(), request.code());

        Map<String, Object> response = new HashMap<>();
        response.put("success", result.isSuccess());
        response.put("method", request.method());
        if (result.isSuccess()) {
            response.put("backupCodes", result.getBackupCodes());
            response.put("message", request.method() + " is now enabled");
        } else {
            response.put("remainingAttempts", result.getRemainingAttempts());
            if (result.getLockedUntil() != null) {
                response.put("lockedUntil", result.getLockedUntil().toString());
            }
            response.put("message", "Invalid verification code");
        }
        return ResponseEntity.ok(response);
    }

    // ==========================================================================
    // VERIFICATION
    // ==========================================================================

    @PostMapping("/verify")
    @Operation(summary = "Verify a login-time MFA code",
        description = "Accepts TOTP, SMS, EMAIL or BACKUP_CODE. With trustDevice=true a device trust token is returned.")
    public ResponseEntity<Map<String, Object>> verify(@AuthenticationPrincipal AuthenticatedUser user,
                                                      @Valid @RequestBody VerifyMfaRequest request) {
        MfaVerificationService.VerificationResult result = verificationService.verifyMfa(
                user.userId(), user.email(), request.method(), request.code(), request.trustDevice());

        Map<String, Object> response = new HashMap<>();
        response.put("success", result.isSuccess());
        response.put("method", result.getMethod());
        response.put("remainingAttempts", result.getRemainingAttempts());
        if (result.getLockedUntil() != null) {
            response.put("lockedUntil", result.getLockedUntil().toString());
        }
        if (result.getTrustToken() != null) {
            response.put("trustToken", result.getTrustToken());
        }
        return ResponseEntity.ok(response);
    }

    @PostMapping("/challenge")
    @Operation(summary = "Send a fresh SMS or EMAIL code")
    public ResponseEntity<Map<String, Object>> sendChallenge(@AuthenticationPrincipal AuthenticatedUser user,
                                                             @Valid @RequestBody MethodRequest request) {
        MfaVerificationService.ChallengeDispatchResult result =
                verificationService.sendChallenge(user.userId(), user.email(), request.method());

        Map<String, Object> response = new HashMap<>();
        response.put("method", result.getMethod());
        response.put("sent", result.isSent());
        if (result.isSent()) {
            response.put("destination", result.getMaskedDestination());
            response.put("expiresInSeconds", result.getExpiresInSeconds());
        }
        return ResponseEntity.ok(response);
    }

    @PostMapping("/trusted-device/check")
    @Operation(summary = "Check a device trust token of the authenticated user")
    public ResponseEntity<Map<String, Object>> checkTrustedDevice(@AuthenticationPrincipal AuthenticatedUser user,
                                                                  @Valid @RequestBody TrustedDeviceCheckRequest request) {
        return ResponseEntity.ok(Map.of("trusted", verificationService.isDeviceTrusted(user.userId(), request.token())));
    }

    // ==========================================================================
    // MANAGEMENT
    // ==========================================================================

    @PostMapping("/backup-codes/regenerate")
    @Operation(summary = "Replace the backup codes of an enabled method")
    public ResponseEntity<Map<String, Object>> regenerateBackupCodes(@AuthenticationPrincipal AuthenticatedUser user,
                                                                     @Valid @RequestBody MethodRequest request) {
        List<String> codes = enrollmentService.regenerateBackupCodes(user.userId(), user.email(), request.method());
        return ResponseEntity.ok(Map.of(
                "backupCodes", codes,
                "message", "Store these codes safely. Previous backup codes no longer work."));
    }

    @DeleteMapping("/{method}")
    @Operation(summary = "Disable one of your own MFA methods",
        description = "Refused with 403 for roles that require MFA; an administrator must do it.")
    public ResponseEntity<Map<String, Object>> disable(@AuthenticationPrincipal AuthenticatedUser user,
                                                       @PathVariable MfaMethod method) {
        verificationService.disableMfa(user.userId(), user.email(), method, null);
        return ResponseEntity.ok(Map.of("method", method, "status", "DISABLED"));
    }

    // ==========================================================================
    // ADMINISTRATION (ADMIN / SUPER_ADMIN only, see SecurityConfig)
    // ==========================================================================

    @GetMapping("/admin/users/{userId}/status")
    @Operation(summary = "MFA status of any user")
    public ResponseEntity<MfaStatusService.MfaStatusResult> adminStatus(@PathVariable String userId) {
        return ResponseEntity.ok(statusService.getMfaStatus(userId));
    }

    @DeleteMapping("/admin/users/{userId}/{method}")
    @Operation(summary = "Disable a user's MFA method as administrator")
    public ResponseEntity<Map<String, Object>> adminDisable(@AuthenticationPrincipal AuthenticatedUser admin,
                                                            @PathVariable String userId,
                                                            @PathVariable MfaMethod method) {
        log.info("Admin {} disabling {} for user {}", admin.userId(), method, userId);
        if (userId.equals(admin.userId())) {
            // own account: same rules as the self-service endpoint
            verificationService.disableMfa(userId, admin.email(), method, null);
        } else {
            verificationService.disableMfa(userId, null, method, admin.userId());
        }
        return ResponseEntity.ok(Map.of("userId", userId, "method", method, "status", "DISABLED"));
    }

    @PostMapping("/admin/users/{userId}/{method}/reset-failures")
    @Operation(summary = "Clear failed attempts and lockout of a user's MFA method")
    public ResponseEntity<Map<String, Object>> adminResetFailures(@AuthenticationPrincipal AuthenticatedUser admin,
                                                                  @PathVariable String userId,
                                                                  @PathVariable MfaMethod method) {
        log.info("Admin {} resetting failed attempts on {} for user {}", admin.userId(), method, userId);
        verificationService.resetFailedAttempts(userId, method, admin.userId());
        return ResponseEntity.ok(Map.of("userId", userId, "method", method, "failedAttempts", 0));
    }

    private static Map<String, Object> challengeSetupResponse(MfaEnrollmentService.ChallengeSetupResult result) {
        Map<String, Object> response = new HashMap<>();
        response.put("method", result.getMethod());
        response.put("destination", result.getMaskedDestination());
        response.put("backupCodes", result.getBackupCodes());
        response.put("instructions", "Enter the code we sent to " + result.getMaskedDestination() + " to finish setup");
        return response;
    }
}
