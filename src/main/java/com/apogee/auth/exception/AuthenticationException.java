package com.apogee.auth.exception;

import com.apogee.auth.enums.ErrorKind;

/**
 * Exception thrown for authentication and credential-lifecycle failures.
 * Carries the {@link ErrorKind} so the web layer can pick status and copy without inspecting messages.
 */
public class AuthenticationException extends RuntimeException {

    private final ErrorKind kind;

    public AuthenticationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AuthenticationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getErrorCode() {
        return kind.name();
    }
}
