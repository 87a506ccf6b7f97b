package com.apogee.auth.enums;

/**
 * Independent rate-limit buckets. Each scope counts attempts per caller identity separately.
 */
public enum RateLimitScope {
    SIGN_IN,
    SIGN_UP,
    OTP_SEND,
    OTP_VERIFY,
    MFA_SEND,
    MFA_VERIFY,
    PASSWORD_RESET,
    PASSWORD_RESET_SUBMIT,
    TOKEN_REFRESH,
    BIOMETRIC
}
