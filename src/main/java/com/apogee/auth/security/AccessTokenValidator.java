package com.apogee.auth.security;

import com.apogee.auth.enums.ErrorKind;
import com.apogee.auth.enums.TokenType;
import com.apogee.auth.exception.AuthenticationException;
import com.apogee.auth.security.jwt.JwtTokenProvider;
import com.apogee.auth.security.jwt.TokenClaims;
import com.apogee.auth.service.CredentialStoreService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Access-credential check for protected calls: signature, expiry, kind, then the logout watermark.
 */
@Component
@RequiredArgsConstructor
public class AccessTokenValidator {

    private final JwtTokenProvider jwtTokenProvider;
    private final CredentialStoreService credentialStoreService;

    public TokenClaims validate(String accessToken) {
        TokenClaims claims = jwtTokenProvider.verify(accessToken, TokenType.ACCESS);
        if (!credentialStoreService.passesWatermark(claims.getAccountId(), claims.getIssuedAt())) {
            throw new AuthenticationException(ErrorKind.INVALID_CREDENTIAL, "Access token has been revoked");
        }
        return claims;
    }

    public boolean suggestRefresh(TokenClaims claims, long thresholdSeconds) {
        return jwtTokenProvider.isNearExpiry(claims, thresholdSeconds);
    }
}
