package com.apogee.auth.enums;

/**
 * Why a one-time code was requested. Each purpose has its own account-existence precondition.
 */
public enum OtpPurpose {
    SIGNUP("signup"),
    SIGNIN("signin"),
    MFA("mfa"),
    PASSWORD_RESET("password_reset"),
    PHONE_VERIFY("phone_verify");

    private final String value;

    OtpPurpose(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Purposes whose destination must not belong to another registered account.
     */
    public boolean requiresUnregisteredDestination() {
        return this == SIGNUP || this == PHONE_VERIFY;
    }

    /**
     * Purposes whose destination must belong to an existing, verified account.
     */
    public boolean requiresRegisteredDestination() {
        return this == SIGNIN || this == MFA;
    }

    /**
     * Purposes whose successful confirmation yields a credential pair.
     */
    public boolean issuesCredentials() {
        return this == SIGNIN || this == MFA;
    }
}
