package com.apogee.auth.util;

/**
 * Masks contact details before they reach logs or responses.
 */
public final class MaskingUtil {

    private MaskingUtil() {
    }

    /**
     * "+14155551234" becomes "+1415***1234".
     */
    public static String maskPhone(String phone) {
        if (phone == null) {
            return null;
        }
        if (phone.length() <= 8) {
            return "***" + phone.substring(Math.max(0, phone.length() - 2));
        }
        return phone.substring(0, 5) + "***" + phone.substring(phone.length() - 4);
    }

    public static String maskEmail(String email) {
        if (email == null) {
            return null;
        }
        int at = email.indexOf('@');
        if (at <= 1) {
            return "***" + (at >= 0 ? email.substring(at) : "");
        }
        return email.charAt(0) + "***" + email.substring(at);
    }

    public static String maskDestination(String destination) {
        if (destination == null) {
            return null;
        }
        return destination.contains("@") ? maskEmail(destination) : maskPhone(destination);
    }
}
