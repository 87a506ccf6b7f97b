package com.apogee.auth.enums;

/**
 * Account changes that need a recent second-factor verification when MFA is enabled.
 */
public enum SensitiveOperation {
    UPDATE_EMAIL,
    UPDATE_PASSWORD,
    UPDATE_PHONE,
    DELETE_ACCOUNT,
    DISABLE_MFA,
    PAYMENT_UPDATE,
    SUBSCRIPTION_CHANGE
}
