package com.apogee.auth.enums;

public enum AuditEventType {
    SIGN_UP,
    SIGN_IN,
    SIGN_IN_FAILED,
    BIOMETRIC_SIGN_IN,
    TOKEN_REFRESH,
    TOKEN_REFRESH_REJECTED,
    LOGOUT,
    OTP_REQUESTED,
    OTP_CONFIRMED,
    MFA_CHALLENGE,
    MFA_VERIFIED,
    MFA_CHANGE,
    PASSWORD_RESET_REQUESTED,
    PASSWORD_RESET,
    PASSWORD_CHANGE,
    BIOMETRIC_CHANGE,
    RATE_LIMITED
}
