package com.apogee.auth.service;

import com.apogee.auth.config.SecurityProperties;
import com.apogee.auth.entity.Account;
import com.apogee.auth.entity.OtpVerification;
import com.apogee.auth.enums.AuditEventType;
import com.apogee.auth.enums.ErrorKind;
import com.apogee.auth.enums.MfaMethod;
import com.apogee.auth.enums.MfaState;
import com.apogee.auth.enums.OtpPurpose;
import com.apogee.auth.enums.RateLimitScope;
import com.apogee.auth.enums.SensitiveOperation;
import com.apogee.auth.exception.AuthenticationException;
import com.apogee.auth.exception.MfaRequiredException;
import com.apogee.auth.repository.AccountRepository;
import com.apogee.auth.util.ClientInfo;
import com.apogee.auth.util.MaskingUtil;
import com.apogee.auth.util.SecureTokens;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Second-factor orchestration: sign-in challenges, code dispatch and verification, MFA setup and step-up checks.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MfaService {

    private final AccountRepository accountRepository;
    private final OtpService otpService;
    private final RateLimitingService rateLimitingService;
    private final AuditService auditService;
    private final SecurityProperties securityProperties;
    private final Clock clock;

    // Sign-in challenge

    /**
     * Open a challenge for a password-verified sign-in, replacing any earlier one.
     */
    public MfaChallenge issueChallenge(Account account) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(securityProperties.getMfa().getChallengeTtl());
        String token = SecureTokens.generate();

        int updated = accountRepository.issueMfaChallenge(account.getId(), token, expiresAt, MfaState.CHALLENGE_ISSUED,
                MfaState.sourcesOf(MfaState.CHALLENGE_ISSUED), now);
        if (updated == 0) {
            throw new AuthenticationException(ErrorKind.NOT_REGISTERED, "Account not found");
        }
        log.info("Issued MFA challenge for account {}", account.getId());

        return MfaChallenge.builder()
                .accountId(account.getId())
                .challengeToken(token)
                .expiresAt(expiresAt)
                .availableMethods(availableMethods(account))
                .preferredMethod(account.getMfaMethod())
                .build();
    }

    /**
     * Send a sign-in code over the chosen method. Requires the live challenge token.
     *
     * @return masked destination the code went to
     */
    public String sendChallengeCode(UUID accountId, String challengeToken, MfaMethod method, ClientInfo client) {
        rateLimitingService.admitOrThrow(RateLimitScope.MFA_SEND, accountId.toString());

        Account account = loadAccount(accountId);
        requireLiveChallenge(account, challengeToken);
        String destination = destinationFor(account, method);

        otpService.dispatch(accountId, destination, OtpPurpose.MFA);

        int updated = accountRepository.markMfaCodeSent(accountId, challengeToken, MfaState.CODE_SENT,
                MfaState.sourcesOf(MfaState.CODE_SENT), clock.instant());
        if (updated == 0) {
            throw challengeFailure(accountId, challengeToken);
        }
        log.info("MFA code sent via {} for account {}", method.getChannel(), accountId);
        return MaskingUtil.maskDestination(destination);
    }

    /**
     * Verify the second factor and consume the challenge. Exactly one concurrent caller can consume a challenge.
     *
     * @return the verified account, ready for credential issuance
     */
    public Account verify(UUID accountId, String challengeToken, String code, MfaMethod method, ClientInfo client) {
        rateLimitingService.admitOrThrow(RateLimitScope.MFA_VERIFY, accountId.toString());

        Account account = loadAccount(accountId);
        requireLiveChallenge(account, challengeToken);
        String destination = destinationFor(account, method);

        OtpVerification attempt;
        try {
            attempt = otpService.checkCode(destination, OtpPurpose.MFA, code);
        } catch (AuthenticationException e) {
            if (e.getKind() == ErrorKind.ALREADY_VERIFIED) {
                // a concurrent request won the challenge between our read and the ledger check
                throw challengeFailure(accountId, challengeToken);
            }
            if (e.getKind() == ErrorKind.CODE_INVALID) {
                if (isConsumed(accountId, challengeToken)) {
                    // one-shot providers reject the code once the winner has used it
                    throw new AuthenticationException(ErrorKind.MFA_SESSION_ALREADY_USED,
                            "MFA session was already used", e);
                }
                auditService.logAuthenticationEvent(accountId, AuditEventType.MFA_VERIFIED, false, client);
            }
            throw e;
        }

        int consumed;
        try {
            consumed = accountRepository.consumeMfaChallenge(accountId, challengeToken, MfaState.VERIFIED,
                    MfaState.sourcesOf(MfaState.VERIFIED), clock.instant());
        } catch (ConcurrencyFailureException e) {
            log.warn("Concurrent write while consuming MFA challenge for account {}", accountId);
            throw new AuthenticationException(ErrorKind.MFA_SESSION_ALREADY_USED, "MFA session was already used", e);
        }
        if (consumed == 0) {
            throw challengeFailure(accountId, challengeToken);
        }

        if (!otpService.markApproved(attempt)) {
            // the challenge is already ours, only the ledger row lost its race
            log.warn("MFA code for account {} was closed in the ledger after the challenge was consumed", accountId);
        }
        rateLimitingService.resetOnSuccess(RateLimitScope.MFA_VERIFY, accountId.toString());
        auditService.logAuthenticationEvent(accountId, AuditEventType.MFA_VERIFIED, true, client,
                Map.of("method", method.getChannel()));
        log.info("MFA verification successful for account {}", accountId);
        return loadAccount(accountId);
    }

    // Setup and removal

    /**
     * Start enabling MFA by sending a code over the method to prove the destination.
     */
    public String setup(UUID accountId, MfaMethod method, ClientInfo client) {
        rateLimitingService.admitOrThrow(RateLimitScope.MFA_SEND, accountId.toString());
        Account account = loadAccount(accountId);

        String destination = setupDestination(account, method);
        otpService.dispatch(accountId, destination, OtpPurpose.MFA);
        log.info("Setting up {} MFA for account {}", method.getChannel(), accountId);
        return MaskingUtil.maskDestination(destination);
    }

    /**
     * Finish enabling MFA once the setup code checks out.
     */
    public Account confirmSetup(UUID accountId, MfaMethod method, String code, ClientInfo client) {
        rateLimitingService.admitOrThrow(RateLimitScope.MFA_VERIFY, accountId.toString());
        Account account = loadAccount(accountId);

        String destination = setupDestination(account, method);
        approve(otpService.checkCode(destination, OtpPurpose.MFA, code));

        account.setMfaEnabled(true);
        account.setMfaMethod(method);
        if (method == MfaMethod.SMS) {
            account.setPhoneVerified(true);
        }
        Account saved = accountRepository.save(account);

        rateLimitingService.resetOnSuccess(RateLimitScope.MFA_VERIFY, accountId.toString());
        auditService.logAuthenticationEvent(accountId, AuditEventType.MFA_CHANGE, true, client,
                Map.of("action", "enabled", "method", method.getChannel()));
        log.info("{} MFA enabled for account {}", method.getChannel(), accountId);
        return saved;
    }

    /**
     * Turn MFA off. Needs a recent second-factor verification.
     */
    public void disable(UUID accountId, ClientInfo client) {
        requireRecentVerification(accountId, SensitiveOperation.DISABLE_MFA);
        Account account = loadAccount(accountId);
        if (!account.isMfaEnabled()) {
            throw new AuthenticationException(ErrorKind.INVALID_REQUEST, "MFA is not enabled");
        }

        MfaMethod previous = account.getMfaMethod();
        account.setMfaEnabled(false);
        account.setMfaMethod(null);
        accountRepository.save(account);

        auditService.logAuthenticationEvent(accountId, AuditEventType.MFA_CHANGE, true, client,
                Map.of("action", "disabled", "method", previous != null ? previous.getChannel() : "none"));
        log.info("MFA disabled for account {}", accountId);
    }

    // Step-up for sensitive operations

    public String sendStepUpCode(UUID accountId, ClientInfo client) {
        rateLimitingService.admitOrThrow(RateLimitScope.MFA_SEND, accountId.toString());
        Account account = loadAccount(accountId);
        if (!account.isMfaEnabled()) {
            throw new AuthenticationException(ErrorKind.INVALID_REQUEST, "MFA is not enabled");
        }

        String destination = destinationFor(account, account.getMfaMethod());
        otpService.dispatch(accountId, destination, OtpPurpose.MFA);
        return MaskingUtil.maskDestination(destination);
    }

    public void verifyStepUpCode(UUID accountId, String code, ClientInfo client) {
        rateLimitingService.admitOrThrow(RateLimitScope.MFA_VERIFY, accountId.toString());
        Account account = loadAccount(accountId);
        if (!account.isMfaEnabled()) {
            throw new AuthenticationException(ErrorKind.INVALID_REQUEST, "MFA is not enabled");
        }

        String destination = destinationFor(account, account.getMfaMethod());
        approve(otpService.checkCode(destination, OtpPurpose.MFA, code));
        rateLimitingService.resetOnSuccess(RateLimitScope.MFA_VERIFY, accountId.toString());
        auditService.logAuthenticationEvent(accountId, AuditEventType.MFA_VERIFIED, true, client,
                Map.of("stepUp", true));
    }

    /**
     * Passes when MFA is off or the account verified a second factor within the step-up window.
     *
     * @throws MfaRequiredException otherwise
     */
    public void requireRecentVerification(UUID accountId, SensitiveOperation operation) {
        Account account = loadAccount(accountId);
        if (!account.isMfaEnabled()) {
            return;
        }
        if (otpService.isAccountFreshlyVerified(accountId, OtpPurpose.MFA, securityProperties.getMfa().getStepUpWindow())) {
            return;
        }
        log.info("Step-up verification required for {} on account {}", operation, accountId);
        throw new MfaRequiredException(account.getMfaMethod(), operation);
    }

    /**
     * Email is always offered; SMS only with a verified phone.
     */
    public List<MfaMethod> availableMethods(Account account) {
        List<MfaMethod> methods = new ArrayList<>();
        if (account.hasVerifiedPhone()) {
            methods.add(MfaMethod.SMS);
        }
        methods.add(MfaMethod.EMAIL);
        return methods;
    }

    private void requireLiveChallenge(Account account, String challengeToken) {
        if (challengeToken == null || challengeToken.isBlank()) {
            throw new AuthenticationException(ErrorKind.MFA_SESSION_INVALID, "MFA session token is missing");
        }
        if (challengeToken.equals(account.getMfaConsumedToken())) {
            throw new AuthenticationException(ErrorKind.MFA_SESSION_ALREADY_USED, "MFA session was already used");
        }
        if (!challengeToken.equals(account.getMfaSessionToken()) || !account.getMfaState().isLive()) {
            throw new AuthenticationException(ErrorKind.MFA_SESSION_INVALID, "Invalid MFA session");
        }
        if (!account.getMfaSessionExpiresAt().isAfter(clock.instant())) {
            accountRepository.expireMfaChallenge(account.getId(), challengeToken, MfaState.EXPIRED,
                    MfaState.sourcesOf(MfaState.EXPIRED));
            throw new AuthenticationException(ErrorKind.MFA_SESSION_EXPIRED, "MFA session has expired");
        }
    }

    private void approve(OtpVerification attempt) {
        if (!otpService.markApproved(attempt)) {
            throw new AuthenticationException(ErrorKind.ALREADY_VERIFIED, "This code was already verified");
        }
    }

    private boolean isConsumed(UUID accountId, String challengeToken) {
        return challengeToken.equals(loadAccount(accountId).getMfaConsumedToken());
    }

    /**
     * Re-read the account to explain why a conditional challenge update matched nothing.
     */
    private AuthenticationException challengeFailure(UUID accountId, String challengeToken) {
        Account current = loadAccount(accountId);
        if (challengeToken.equals(current.getMfaConsumedToken())) {
            return new AuthenticationException(ErrorKind.MFA_SESSION_ALREADY_USED, "MFA session was already used");
        }
        if (challengeToken.equals(current.getMfaSessionToken())
                && current.getMfaSessionExpiresAt() != null
                && !current.getMfaSessionExpiresAt().isAfter(clock.instant())) {
            return new AuthenticationException(ErrorKind.MFA_SESSION_EXPIRED, "MFA session has expired");
        }
        return new AuthenticationException(ErrorKind.MFA_SESSION_INVALID, "Invalid MFA session");
    }

    private String destinationFor(Account account, MfaMethod method) {
        if (method == null) {
            throw new AuthenticationException(ErrorKind.INVALID_REQUEST, "MFA method is required");
        }
        if (!availableMethods(account).contains(method)) {
            throw new AuthenticationException(ErrorKind.INVALID_REQUEST,
                    method.getDescription() + " is not available for this account");
        }
        return method == MfaMethod.SMS ? account.getPhoneNumber() : account.getEmail();
    }

    private String setupDestination(Account account, MfaMethod method) {
        if (method == null) {
            throw new AuthenticationException(ErrorKind.INVALID_REQUEST, "MFA method is required");
        }
        if (method == MfaMethod.SMS) {
            if (account.getPhoneNumber() == null) {
                throw new AuthenticationException(ErrorKind.INVALID_REQUEST, "Add a phone number before enabling SMS MFA");
            }
            return account.getPhoneNumber();
        }
        return account.getEmail();
    }

    private Account loadAccount(UUID accountId) {
        return accountRepository.findById(accountId)
                .orElseThrow(() -> new AuthenticationException(ErrorKind.NOT_REGISTERED, "Account not found"));
    }
}
