package com.apogee.auth.service;

import com.apogee.auth.config.SecurityProperties;
import com.apogee.auth.enums.ErrorKind;
import com.apogee.auth.exception.AuthenticationException;
import com.apogee.auth.repository.AccountRepository;
import com.apogee.auth.util.SecureTokens;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Single-use password reset tokens stored in the account's reset slot.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PasswordResetTokenService {

    private final AccountRepository accountRepository;
    private final SecurityProperties securityProperties;
    private final Clock clock;

    /**
     * Issue a fresh token, overwriting any earlier one.
     */
    public String issue(UUID accountId) {
        Instant now = clock.instant();
        String token = SecureTokens.generate();
        int updated = accountRepository.issueResetToken(accountId, token,
                now.plus(securityProperties.getResetToken().getTtl()), now);
        if (updated == 0) {
            throw new AuthenticationException(ErrorKind.NOT_REGISTERED, "Account not found");
        }
        log.info("Issued password reset token for account {}", accountId);
        return token;
    }

    /**
     * Set the new hash only while the presented token is still stored and unexpired.
     * The same update ends every session of the account.
     *
     * @throws AuthenticationException RESET_TOKEN_INVALID_OR_USED when the token was consumed, replaced or expired
     */
    public void consume(UUID accountId, String token, String newPasswordHash) {
        int updated;
        try {
            // the watermark is compared against millisecond issue times
            updated = accountRepository.consumeResetToken(accountId, token, newPasswordHash,
                    clock.instant().truncatedTo(ChronoUnit.MILLIS));
        } catch (ConcurrencyFailureException e) {
            throw new AuthenticationException(ErrorKind.RESET_TOKEN_INVALID_OR_USED,
                    "Reset token was used by another request", e);
        }

        if (updated == 0) {
            log.warn("Reset token for account {} was already used, replaced or expired", accountId);
            throw new AuthenticationException(ErrorKind.RESET_TOKEN_INVALID_OR_USED,
                    "Reset token is invalid, expired or already used. Request a new code.");
        }
        log.info("Password reset completed for account {}", accountId);
    }
}
