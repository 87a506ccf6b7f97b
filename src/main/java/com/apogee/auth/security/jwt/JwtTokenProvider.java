package com.apogee.auth.security.jwt;

import com.apogee.auth.config.SecurityProperties;
import com.apogee.auth.enums.ErrorKind;
import com.apogee.auth.enums.TokenType;
import com.apogee.auth.exception.InvalidTokenException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.UUID;

/**
 * Issues and verifies signed access and refresh credentials.
 * <p>
 * Stateless apart from the signing key; safe for concurrent use.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtTokenProvider {

    static final String TYPE_CLAIM = "type";
    // the standard iat claim has second precision, the logout watermark needs milliseconds
    static final String ISSUED_AT_MILLIS_CLAIM = "iat_ms";

    private final SecurityProperties securityProperties;
    private final Clock clock;

    /**
     * Issue a new access/refresh pair for the account.
     */
    public TokenPair issuePair(UUID accountId) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        Instant accessExpiry = now.plusMillis(securityProperties.getJwt().getAccessTokenExpiration());
        Instant refreshExpiry = now.plusMillis(securityProperties.getJwt().getRefreshTokenExpiration());

        return TokenPair.builder()
                .accessToken(buildToken(accountId, TokenType.ACCESS, now, accessExpiry))
                .refreshToken(buildToken(accountId, TokenType.REFRESH, now, refreshExpiry))
                .accessExpiresInSeconds(getAccessTokenExpirationInSeconds())
                .issuedAt(now)
                .refreshExpiresAt(refreshExpiry)
                .build();
    }

    /**
     * Verify signature, expiry and kind.
     *
     * @throws InvalidTokenException with kind EXPIRED_CREDENTIAL, INVALID_CREDENTIAL, KIND_MISMATCH or
     *                               MISSING_CREDENTIAL
     */
    public TokenClaims verify(String token, TokenType expectedType) {
        if (!StringUtils.hasText(token)) {
            throw new InvalidTokenException(ErrorKind.MISSING_CREDENTIAL, "Token is missing");
        }

        Claims claims;
        try {
            claims = parser().parseSignedClaims(token).getPayload();
        } catch (ExpiredJwtException ex) {
            log.debug("JWT token is expired: {}", ex.getMessage());
            throw InvalidTokenException.expired();
        } catch (JwtException | IllegalArgumentException ex) {
            log.debug("Invalid JWT token: {}", ex.getMessage());
            throw InvalidTokenException.invalid("Invalid token");
        }

        TokenType actualType = TokenType.fromClaim(claims.get(TYPE_CLAIM, String.class));
        if (actualType == null) {
            throw InvalidTokenException.invalid("Token kind is missing");
        }
        if (actualType != expectedType) {
            throw new InvalidTokenException(ErrorKind.KIND_MISMATCH,
                    "Expected " + expectedType.getClaimValue() + " token but got " + actualType.getClaimValue());
        }

        return TokenClaims.builder()
                .accountId(parseAccountId(claims.getSubject()))
                .type(actualType)
                .tokenId(claims.getId())
                .issuedAt(readIssuedAt(claims))
                .expiresAt(claims.getExpiration().toInstant())
                .build();
    }

    /**
     * Whether a verified credential expires within the threshold.
     */
    public boolean isNearExpiry(TokenClaims claims, long thresholdSeconds) {
        Duration remaining = Duration.between(clock.instant(), claims.getExpiresAt());
        return remaining.getSeconds() <= thresholdSeconds;
    }

    public boolean isNearExpiry(String token, long thresholdSeconds) {
        try {
            Claims claims = parser().parseSignedClaims(token).getPayload();
            Duration remaining = Duration.between(clock.instant(), claims.getExpiration().toInstant());
            return remaining.getSeconds() <= thresholdSeconds;
        } catch (ExpiredJwtException ex) {
            return true;
        } catch (JwtException | IllegalArgumentException ex) {
            log.debug("Cannot evaluate expiry of invalid token: {}", ex.getMessage());
            return false;
        }
    }

    public long getAccessTokenExpirationInSeconds() {
        return securityProperties.getJwt().getAccessTokenExpiration() / 1000;
    }

    private String buildToken(UUID accountId, TokenType type, Instant issuedAt, Instant expiresAt) {
        return Jwts.builder()
                .claim(TYPE_CLAIM, type.getClaimValue())
                .claim(ISSUED_AT_MILLIS_CLAIM, issuedAt.toEpochMilli())
                .subject(accountId.toString())
                .issuer(securityProperties.getJwt().getIssuer())
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .id(UUID.randomUUID().toString())
                .signWith(getSigningKey(), Jwts.SIG.HS512)
                .compact();
    }

    private JwtParser parser() {
        return Jwts.parser()
                .verifyWith(getSigningKey())
                .requireIssuer(securityProperties.getJwt().getIssuer())
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    private Instant readIssuedAt(Claims claims) {
        Long millis = claims.get(ISSUED_AT_MILLIS_CLAIM, Long.class);
        if (millis != null) {
            return Instant.ofEpochMilli(millis);
        }
        if (claims.getIssuedAt() == null) {
            throw InvalidTokenException.invalid("Token has no issue time");
        }
        return claims.getIssuedAt().toInstant();
    }

    private UUID parseAccountId(String subject) {
        if (subject == null) {
            throw InvalidTokenException.invalid("Token has no subject");
        }
        try {
            return UUID.fromString(subject);
        } catch (IllegalArgumentException ex) {
            throw InvalidTokenException.invalid("Token subject is not an account id");
        }
    }

    private SecretKey getSigningKey() {
        byte[] keyBytes = securityProperties.getJwt().getSecret().getBytes(StandardCharsets.UTF_8);
        return Keys.hmacShaKeyFor(keyBytes);
    }
}
