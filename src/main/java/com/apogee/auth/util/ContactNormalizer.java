package com.apogee.auth.util;

import com.apogee.auth.enums.ErrorKind;
import com.apogee.auth.exception.AuthenticationException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical forms for email addresses and phone numbers. Emails compare case-insensitively; phones are E.164.
 */
public final class ContactNormalizer {

    private static final Pattern E164 = Pattern.compile("^\\+[1-9]\\d{6,14}$");
    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private ContactNormalizer() {
    }

    public static boolean isEmail(String destination) {
        return destination != null && destination.contains("@");
    }

    public static String normalizeEmail(String email) {
        if (email == null) {
            throw new AuthenticationException(ErrorKind.INVALID_REQUEST, "Email is required");
        }
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        if (!EMAIL.matcher(normalized).matches()) {
            throw new AuthenticationException(ErrorKind.INVALID_REQUEST, "Invalid email address");
        }
        return normalized;
    }

    public static String normalizePhone(String phone) {
        if (phone == null) {
            throw new AuthenticationException(ErrorKind.INVALID_REQUEST, "Phone number is required");
        }
        String normalized = phone.replaceAll("[\\s\\-().]", "");
        if (!E164.matcher(normalized).matches()) {
            throw new AuthenticationException(ErrorKind.INVALID_REQUEST,
                    "Phone number must be in international format, e.g. +14155551234");
        }
        return normalized;
    }

    /**
     * Normalize either kind of destination.
     */
    public static String normalize(String destination) {
        return isEmail(destination) ? normalizeEmail(destination) : normalizePhone(destination);
    }

    public static String channelFor(String normalizedDestination) {
        return isEmail(normalizedDestination) ? "email" : "sms";
    }
}
