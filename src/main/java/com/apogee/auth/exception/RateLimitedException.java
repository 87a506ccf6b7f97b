package com.apogee.auth.exception;

import com.apogee.auth.enums.ErrorKind;

/**
 * Exception thrown when a caller exhausted its attempts for the current window.
 */
public class RateLimitedException extends AuthenticationException {

    private final long retryAfterSeconds;

    public RateLimitedException(long retryAfterSeconds) {
        super(ErrorKind.RATE_LIMITED, "Too many attempts. Try again in " + retryAfterSeconds + " seconds");
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
