package com.apogee.auth.service;

import com.apogee.auth.entity.Account;
import com.apogee.auth.enums.ErrorKind;
import com.apogee.auth.enums.MfaState;
import com.apogee.auth.exception.AuthenticationException;
import com.apogee.auth.repository.AccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;

/**
 * Refresh-credential rotation, logout and the access-credential watermark.
 * <p>
 * All writes are conditional updates on the account row; no in-process locking is used.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialStoreService {

    private final AccountRepository accountRepository;
    private final Clock clock;

    /**
     * Record the refresh value of a new sign-in. Replaces whatever session the account had.
     *
     * @param issuedAt issue time carried by the refresh credential; it marks the start of the new session
     */
    public void storeRefresh(UUID accountId, String refreshToken, Instant issuedAt, Instant expiresAt) {
        int updated = accountRepository.storeRefreshToken(accountId, refreshToken, expiresAt,
                issuedAt.truncatedTo(ChronoUnit.MILLIS), clock.instant());
        if (updated == 0) {
            throw new AuthenticationException(ErrorKind.NOT_REGISTERED, "Account not found");
        }
        log.debug("Stored refresh token for account {}", accountId);
    }

    /**
     * Replace the stored refresh value only if it still equals the presented one and is unexpired.
     * Also clears the logout watermark.
     *
     * @param presentedIssuedAt issue time of the presented refresh credential
     * @throws AuthenticationException ROTATION_CONFLICT, SESSION_ENDED_ELSEWHERE, EXPIRED_CREDENTIAL or
     *                                 INVALID_CREDENTIAL when the swap did not apply
     */
    public void rotateRefresh(UUID accountId, String presentedOldValue, Instant presentedIssuedAt,
                              String newValue, Instant newExpiresAt) {
        int updated;
        try {
            updated = accountRepository.rotateRefreshToken(accountId, presentedOldValue, newValue, newExpiresAt,
                    clock.instant());
        } catch (ConcurrencyFailureException e) {
            log.warn("Concurrent write while rotating refresh token for account {}", accountId);
            throw new AuthenticationException(ErrorKind.ROTATION_CONFLICT,
                    "Refresh token was rotated by another request", e);
        }

        if (updated == 1) {
            log.info("Rotated refresh token for account {}", accountId);
            return;
        }

        ErrorKind kind = detectElsewhereLogin(accountId, presentedOldValue, presentedIssuedAt);
        log.warn("Refresh rotation rejected for account {}: {}", accountId, kind);
        throw new AuthenticationException(kind, messageFor(kind));
    }

    /**
     * Explain why a rotation did not apply.
     * <p>
     * A different, unexpired refresh value from a session that started after the presented credential was
     * issued means another device signed in. A different value within the same session means another
     * request already rotated it.
     */
    public ErrorKind detectElsewhereLogin(UUID accountId, String presentedOldValue, Instant presentedIssuedAt) {
        Optional<Account> found = accountRepository.findById(accountId);
        if (found.isEmpty()) {
            return ErrorKind.INVALID_CREDENTIAL;
        }

        Account account = found.get();
        Instant now = clock.instant();
        String stored = account.getRefreshToken();

        if (stored == null) {
            // cleared by logout or password reset
            return ErrorKind.INVALID_CREDENTIAL;
        }
        if (stored.equals(presentedOldValue)) {
            return ErrorKind.EXPIRED_CREDENTIAL;
        }

        boolean storedValid = account.getRefreshTokenExpiresAt() != null
                && account.getRefreshTokenExpiresAt().isAfter(now);
        // both sides carry millisecond precision, as in the token's iat_ms claim
        boolean newerSession = account.getSessionStartedAt() != null
                && presentedIssuedAt != null
                && presentedIssuedAt.truncatedTo(ChronoUnit.MILLIS).isBefore(account.getSessionStartedAt());
        if (storedValid && newerSession) {
            return ErrorKind.SESSION_ENDED_ELSEWHERE;
        }
        return ErrorKind.ROTATION_CONFLICT;
    }

    /**
     * Clear the refresh value and move the watermark to now, invalidating every access credential issued so far.
     */
    public Instant logout(UUID accountId) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        int updated = accountRepository.logout(accountId, MfaState.INVALIDATED,
                MfaState.sourcesOf(MfaState.INVALIDATED), now);
        if (updated == 0) {
            throw new AuthenticationException(ErrorKind.INVALID_CREDENTIAL, "Account not found");
        }
        log.info("Logged out account {}; tokens issued before {} are revoked", accountId, now);
        return now;
    }

    /**
     * Whether an access credential issued at {@code issuedAt} survives the account's logout watermark.
     * <p>
     * Fails open: if the lookup itself fails the credential is accepted on its signature alone.
     */
    public boolean passesWatermark(UUID accountId, Instant issuedAt) {
        Instant watermark;
        try {
            watermark = accountRepository.findTokenInvalidatedAt(accountId);
        } catch (DataAccessException e) {
            log.warn("Watermark lookup failed for account {}, accepting token on signature alone: {}",
                    accountId, e.getMessage());
            return true;
        }

        if (watermark == null) {
            return true;
        }
        return !issuedAt.isBefore(watermark);
    }

    private static String messageFor(ErrorKind kind) {
        switch (kind) {
            case SESSION_ENDED_ELSEWHERE:
                return "Your session ended because you signed in on another device";
            case EXPIRED_CREDENTIAL:
                return "Refresh token has expired";
            case ROTATION_CONFLICT:
                return "Refresh token was already used";
            default:
                return "Invalid refresh token";
        }
    }
}
