package com.apogee.auth.enums;

/**
 * Login method the user prefers to be offered first on the device.
 */
public enum LoginMethod {
    EMAIL,
    PHONE,
    BIOMETRIC
}
