package com.apogee.auth.security.jwt;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Freshly issued access and refresh credentials.
 */
@Value
@Builder
public class TokenPair {
    String accessToken;
    String refreshToken;
    long accessExpiresInSeconds;
    // millisecond precision, equal to the iat_ms claim of both credentials
    Instant issuedAt;
    Instant refreshExpiresAt;
}
