package com.apogee.auth.enums;

import org.springframework.http.HttpStatus;

/**
 * Machine-readable failure kinds surfaced to callers. The HTTP status is a transport hint only.
 */
public enum ErrorKind {
    MISSING_CREDENTIAL(HttpStatus.UNAUTHORIZED),
    INVALID_CREDENTIAL(HttpStatus.UNAUTHORIZED),
    EXPIRED_CREDENTIAL(HttpStatus.UNAUTHORIZED),
    KIND_MISMATCH(HttpStatus.UNAUTHORIZED),
    ROTATION_CONFLICT(HttpStatus.UNAUTHORIZED),
    SESSION_ENDED_ELSEWHERE(HttpStatus.UNAUTHORIZED),
    MFA_REQUIRED(HttpStatus.FORBIDDEN),
    MFA_SESSION_INVALID(HttpStatus.UNAUTHORIZED),
    MFA_SESSION_EXPIRED(HttpStatus.UNAUTHORIZED),
    MFA_SESSION_ALREADY_USED(HttpStatus.UNAUTHORIZED),
    CODE_INVALID(HttpStatus.BAD_REQUEST),
    ALREADY_VERIFIED(HttpStatus.CONFLICT),
    NOT_REGISTERED(HttpStatus.NOT_FOUND),
    ALREADY_REGISTERED(HttpStatus.CONFLICT),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS),
    RESET_TOKEN_INVALID_OR_USED(HttpStatus.BAD_REQUEST),
    PROVIDER_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
    PASSWORD_POLICY_VIOLATION(HttpStatus.BAD_REQUEST),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST);

    private final HttpStatus httpStatus;

    ErrorKind(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    /**
     * MFA session failures require the client to start sign-in again.
     */
    public boolean requiresSignInRestart() {
        return this == MFA_SESSION_INVALID || this == MFA_SESSION_EXPIRED || this == MFA_SESSION_ALREADY_USED;
    }
}
