package com.apogee.auth.security.jwt;

import com.apogee.auth.enums.TokenType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Claims of a credential that passed signature, expiry and kind checks.
 */
@Value
@Builder
public class TokenClaims {
    UUID accountId;
    TokenType type;
    String tokenId;
    Instant issuedAt;
    Instant expiresAt;
}
