package com.apogee.auth.exception;

import com.apogee.auth.enums.ErrorKind;

/**
 * Exception thrown when a signed credential fails verification: expired, malformed, bad signature,
 * wrong kind or issued before the account's logout watermark.
 */
public class InvalidTokenException extends AuthenticationException {

    public InvalidTokenException(ErrorKind kind, String message) {
        super(kind, message);
    }

    public InvalidTokenException(ErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }

    public static InvalidTokenException expired() {
        return new InvalidTokenException(ErrorKind.EXPIRED_CREDENTIAL, "Token has expired");
    }

    public static InvalidTokenException invalid(String reason) {
        return new InvalidTokenException(ErrorKind.INVALID_CREDENTIAL, reason);
    }
}
