package com.apogee.auth.util;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Random opaque values for challenge, reset and biometric tokens.
 */
public final class SecureTokens {

    private static final SecureRandom RANDOM = new SecureRandom();

    private SecureTokens() {
    }

    /**
     * URL-safe random token carrying {@code bytes} bytes of entropy.
     */
    public static String generate(int bytes) {
        byte[] buffer = new byte[bytes];
        RANDOM.nextBytes(buffer);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(buffer);
    }

    public static String generate() {
        return generate(32);
    }
}
