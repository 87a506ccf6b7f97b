package com.apogee.auth.exception;

import com.apogee.auth.dto.response.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * Translates error kinds into HTTP responses.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String RESTART_SIGN_IN = "Please sign in again.";

    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<ApiResponse<Object>> handleRateLimitedException(RateLimitedException ex) {
        log.warn("Rate limited: retry after {}s", ex.getRetryAfterSeconds());
        Map<String, Object> details = new HashMap<>();
        details.put("retryAfterSeconds", ex.getRetryAfterSeconds());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
                .body(ApiResponse.<Object>builder()
                        .status("error")
                        .message(ex.getMessage())
                        .errorCode(ex.getErrorCode())
                        .data(details)
                        .build());
    }

    @ExceptionHandler(MfaRequiredException.class)
    public ResponseEntity<ApiResponse<Object>> handleMfaRequiredException(MfaRequiredException ex) {
        log.info("MFA step-up required: {}", ex.getOperation());
        Map<String, Object> details = new HashMap<>();
        details.put("mfaRequired", true);
        details.put("operation", ex.getOperation());
        if (ex.getMethod() != null) {
            details.put("method", ex.getMethod());
        }
        return ResponseEntity.status(ex.getKind().getHttpStatus())
                .body(ApiResponse.<Object>builder()
                        .status("error")
                        .message(ex.getMessage())
                        .errorCode(ex.getErrorCode())
                        .data(details)
                        .build());
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ApiResponse<Object>> handleAuthenticationException(AuthenticationException ex) {
        HttpStatus status = ex.getKind().getHttpStatus();
        if (status.is5xxServerError()) {
            log.error("Authentication error [{}]: {}", ex.getKind(), ex.getMessage());
        } else {
            log.warn("Authentication error [{}]: {}", ex.getKind(), ex.getMessage());
        }

        String message = ex.getKind().requiresSignInRestart()
                ? ex.getMessage() + ". " + RESTART_SIGN_IN
                : ex.getMessage();
        return ResponseEntity.status(status)
                .body(ApiResponse.error(message, ex.getErrorCode()));
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ApiResponse<Object>> handleAccessDeniedException(AccessDeniedException ex) {
        log.warn("Access denied: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(ApiResponse.error("Access denied", "ACCESS_DENIED"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        log.warn("Validation error: {}", errors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.<Object>builder()
                        .status("error")
                        .message("Validation failed")
                        .errorCode("INVALID_REQUEST")
                        .data(errors)
                        .build());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ApiResponse<Object>> handleUnreadableRequest(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error("Malformed request", "INVALID_REQUEST"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> handleGlobalException(Exception ex) {
        log.error("Unexpected error: ", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("An unexpected error occurred", "INTERNAL_ERROR"));
    }
}
