package com.astralcore.mfa.api;

import com.astralcore.mfa.exception.MfaAlreadyConfiguredException;
import com.astralcore.mfa.exception.MfaException;
import com.astralcore.mfa.exception.MfaIntegrityException;
import com.astralcore.mfa.exception.MfaLockedException;
import com.astralcore.mfa.exception.MfaNotFoundException;
import com.astralcore.mfa.exception.MfaPermissionException;
import com.astralcore.mfa.exception.MfaValidationException;
import com.astralcore.mfa.exception.UnsupportedMfaMethodException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps MFA exceptions to {@code {error, code, message}} JSON bodies.
 */
@RestControllerAdvice
public class MfaExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(MfaExceptionHandler.class);

    @ExceptionHandler(MfaValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MfaValidationException ex, HttpServletRequest request) {
        log.warn("MFA validation error on {}: {}", request.getRequestURI(), ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(UnsupportedMfaMethodException.class)
    public ResponseEntity<Map<String, Object>> handleUnsupported(UnsupportedMfaMethodException ex) {
        return body(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(MfaNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(MfaNotFoundException ex) {
        return body(HttpStatus.NOT_FOUND, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(MfaPermissionException.class)
    public ResponseEntity<Map<String, Object>> handlePermission(MfaPermissionException ex, HttpServletRequest request) {
        log.warn("MFA permission denied on {}: {}", request.getRequestURI(), ex.getMessage());
        return body(HttpStatus.FORBIDDEN, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(MfaAlreadyConfiguredException.class)
    public ResponseEntity<Map<String, Object>> handleAlreadyConfigured(MfaAlreadyConfiguredException ex) {
        return body(HttpStatus.CONFLICT, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(MfaLockedException.class)
    public ResponseEntity<Map<String, Object>> handleLocked(MfaLockedException ex) {
        ResponseEntity<Map<String, Object>> response = body(HttpStatus.LOCKED, ex.getErrorCode(), ex.getMessage());
        response.getBody().put("lockedUntil", ex.getLockedUntil().toString());
        return response;
    }

    /**
     * Details stay in the log and the CRITICAL audit event, never in the response.
     */
    @ExceptionHandler(MfaIntegrityException.class)
    public ResponseEntity<Map<String, Object>> handleIntegrity(MfaIntegrityException ex, HttpServletRequest request) {
        log.error("🚨 MFA integrity failure on {}: {}", request.getRequestURI(), ex.getMessage());
        return body(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(), "MFA verification is unavailable");
    }

    @ExceptionHandler(MfaException.class)
    public ResponseEntity<Map<String, Object>> handleOther(MfaException ex) {
        log.error("Unmapped MFA error: {}", ex.getMessage(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(ConcurrencyFailureException.class)
    public ResponseEntity<Map<String, Object>> handleConcurrency(ConcurrencyFailureException ex) {
        log.warn("Concurrent MFA update: {}", ex.getMessage());
        return body(HttpStatus.CONFLICT, "MFA_CONCURRENT_UPDATE", "Please retry the request");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(", "));
        return body(HttpStatus.BAD_REQUEST, "MFA_VALIDATION_ERROR", message);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadable(Exception ex) {
        log.debug("Unreadable MFA request: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, "MFA_VALIDATION_ERROR", "Malformed request or unknown MFA method");
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", status.getReasonPhrase());
        body.put("code", code);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
