package com.example.careaccess.common.exception;

import com.example.careaccess.audit.exception.AuditPersistenceException;
import com.example.careaccess.consent.exception.ConsentConflictException;
import com.example.careaccess.security.exception.AuthenticationException;
import com.example.careaccess.security.exception.AuthorizationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Global exception handler for REST controllers.
 *
 * <p>Error bodies carry {@code error}, {@code message} and {@code timestamp}; internal details
 * stay in the log.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final int MAX_LOG_MESSAGE_LENGTH = 200;

    @ExceptionHandler(ValidationException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleValidation(@NonNull ValidationException ex) {
        LOG.warn("Validation error: {}", sanitizeForLog(ex.getMessage()));

        Map<String, Object> response = new HashMap<>();
        response.put("error", "validation_error");
        response.put("message", "Request validation failed");
        response.put("details", ex.getErrors());
        response.put("timestamp", Instant.now().toString());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    /**
     * Handles validation errors from @Valid annotated request bodies in WebFlux.
     */
    @ExceptionHandler(WebExchangeBindException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleBindErrors(@NonNull WebExchangeBindException ex) {
        LOG.warn("Validation error: {} field errors", ex.getBindingResult().getFieldErrorCount());

        List<Map<String, String>> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> Map.of(
                        "field", error.getField(),
                        "message", error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value"))
                .toList();

        Map<String, Object> response = new HashMap<>();
        response.put("error", "validation_error");
        response.put("message", "Request validation failed");
        response.put("details", fieldErrors);
        response.put("timestamp", Instant.now().toString());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(ServerWebInputException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleInputException(@NonNull ServerWebInputException ex) {
        LOG.warn("Input error: {}", sanitizeForLog(ex.getMessage()));
        return body(HttpStatus.BAD_REQUEST, "invalid_request", "Invalid request format");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(@NonNull IllegalArgumentException ex) {
        LOG.warn("Illegal argument: {}", sanitizeForLog(ex.getMessage()));
        return body(HttpStatus.BAD_REQUEST, "invalid_argument", "Invalid request parameter");
    }

    @ExceptionHandler(AuthenticationException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleAuthentication(@NonNull AuthenticationException ex) {
        LOG.warn("Authentication failure: {}", sanitizeForLog(ex.getMessage()));
        return body(HttpStatus.UNAUTHORIZED, "unauthorized", "Authentication required");
    }

    @ExceptionHandler(AuthorizationException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleAuthorization(@NonNull AuthorizationException ex) {
        LOG.warn("Access denied for user {}: {}", sanitizeForLog(ex.getUserId()), sanitizeForLog(ex.getMessage()));
        return body(HttpStatus.FORBIDDEN, "access_denied", ex.getMessage());
    }

    @ExceptionHandler(NotFoundException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleNotFound(@NonNull NotFoundException ex) {
        LOG.debug("Not found: {}", sanitizeForLog(ex.getMessage()));
        return body(HttpStatus.NOT_FOUND, "not_found", ex.getResourceType() + " not found");
    }

    @ExceptionHandler(ConsentConflictException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleConsentConflict(@NonNull ConsentConflictException ex) {
        LOG.warn("Consent conflict: {}", sanitizeForLog(ex.getMessage()));
        return body(HttpStatus.CONFLICT, "consent_conflict", ex.getMessage());
    }

    @ExceptionHandler(BackendUnavailableException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleBackendUnavailable(@NonNull BackendUnavailableException ex) {
        LOG.error("Backend {} unavailable: {}", ex.getServiceName(), sanitizeForLog(ex.getMessage()));
        return body(HttpStatus.SERVICE_UNAVAILABLE, "backend_unavailable",
                "A required service is unavailable. Please try again later.");
    }

    @ExceptionHandler(AuditPersistenceException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleAuditPersistence(@NonNull AuditPersistenceException ex) {
        LOG.error("Audit persistence failure: {}", sanitizeForLog(ex.getMessage()), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "audit_unavailable",
                "The operation could not be recorded and was not completed");
    }

    @ExceptionHandler(Exception.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleGeneral(@NonNull Exception ex) {
        LOG.error("Unhandled exception: {}", sanitizeForLog(ex.getMessage()), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "An unexpected error occurred");
    }

    @NonNull
    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status)
                .body(Map.of(
                        "error", error,
                        "message", message,
                        "timestamp", Instant.now().toString()
                ));
    }

    @NonNull
    private String sanitizeForLog(@Nullable String value) {
        if (value == null) {
            return "null";
        }
        String sanitized = value
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");

        if (sanitized.length() > MAX_LOG_MESSAGE_LENGTH) {
            return sanitized.substring(0, MAX_LOG_MESSAGE_LENGTH) + "...";
        }
        return sanitized;
    }
}
