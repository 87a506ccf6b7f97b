package com.apogee.auth.service;

import com.apogee.auth.config.SecurityProperties;
import com.apogee.auth.entity.Account;
import com.apogee.auth.entity.OtpVerification;
import com.apogee.auth.enums.AuditEventType;
import com.apogee.auth.enums.ErrorKind;
import com.apogee.auth.enums.OtpPurpose;
import com.apogee.auth.enums.RateLimitScope;
import com.apogee.auth.enums.VerificationStatus;
import com.apogee.auth.exception.AuthenticationException;
import com.apogee.auth.integration.ProviderCheckResult;
import com.apogee.auth.integration.ProviderSendResult;
import com.apogee.auth.integration.VerificationProvider;
import com.apogee.auth.repository.AccountRepository;
import com.apogee.auth.repository.OtpVerificationRepository;
import com.apogee.auth.util.ClientInfo;
import com.apogee.auth.util.ContactNormalizer;
import com.apogee.auth.util.MaskingUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Purpose-scoped one-time code flow and the verification ledger behind it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OtpService {

    static final String PASSWORD_RESET_MESSAGE = "If an account exists, a reset code has been sent.";

    private final OtpVerificationRepository otpVerificationRepository;
    private final AccountRepository accountRepository;
    private final VerificationProvider verificationProvider;
    private final PasswordResetTokenService passwordResetTokenService;
    private final RateLimitingService rateLimitingService;
    private final AuditService auditService;
    private final SecurityProperties securityProperties;
    private final Clock clock;

    /**
     * Dispatch a code for the purpose after checking its account-existence precondition.
     *
     * @param callerAccountId authenticated caller, only meaningful for phone_verify
     */
    public OtpDispatch requestCode(String rawDestination, OtpPurpose purpose, UUID callerAccountId, ClientInfo client) {
        String destination = ContactNormalizer.normalize(rawDestination);
        RateLimitScope scope = purpose == OtpPurpose.PASSWORD_RESET ? RateLimitScope.PASSWORD_RESET : RateLimitScope.OTP_SEND;
        rateLimitingService.admitOrThrow(scope, identity(client, destination));

        if (purpose == OtpPurpose.PASSWORD_RESET) {
            return requestPasswordResetCode(destination, client);
        }

        UUID accountId = checkPrecondition(destination, purpose, callerAccountId);
        dispatch(accountId, destination, purpose);
        auditService.logAuthenticationEvent(accountId, AuditEventType.OTP_REQUESTED, true, client,
                Map.of("purpose", purpose.getValue()));

        return OtpDispatch.builder()
                .message("Verification code sent")
                .maskedDestination(MaskingUtil.maskDestination(destination))
                .expiresInSeconds(securityProperties.getOtp().getCodeTtl().getSeconds())
                .build();
    }

    /**
     * Check a submitted code and produce what the purpose grants.
     */
    public OtpConfirmation confirmCode(String rawDestination, OtpPurpose purpose, String code,
                                       UUID callerAccountId, ClientInfo client) {
        String destination = ContactNormalizer.normalize(rawDestination);
        rateLimitingService.admitOrThrow(RateLimitScope.OTP_VERIFY, destination);

        OtpVerification attempt = checkCode(destination, purpose, code);
        if (!markApproved(attempt)) {
            throw new AuthenticationException(ErrorKind.ALREADY_VERIFIED, "This code was already verified");
        }
        rateLimitingService.resetOnSuccess(RateLimitScope.OTP_VERIFY, destination);
        auditService.logAuthenticationEvent(attempt.getAccountId(), AuditEventType.OTP_CONFIRMED, true, client,
                Map.of("purpose", purpose.getValue()));

        OtpConfirmation.OtpConfirmationBuilder result = OtpConfirmation.builder()
                .purpose(purpose)
                .verified(true);

        switch (purpose) {
            case SIGNIN:
            case MFA:
                return result.account(findVerifiedAccount(destination)).build();
            case PASSWORD_RESET:
                Account account = accountRepository.findByEmail(destination)
                        .orElseThrow(() -> new AuthenticationException(ErrorKind.CODE_INVALID, "Invalid code"));
                return result.resetToken(passwordResetTokenService.issue(account.getId())).build();
            case PHONE_VERIFY:
                if (callerAccountId != null) {
                    attachVerifiedPhone(callerAccountId, destination);
                }
                return result.build();
            default:
                return result.build();
        }
    }

    /**
     * Whether the destination has an approved attempt for the purpose inside the purpose's freshness window.
     */
    public boolean isFreshlyVerified(String destination, OtpPurpose purpose) {
        Instant since = clock.instant().minus(securityProperties.getOtp().freshnessFor(purpose));
        return otpVerificationRepository.existsByDestinationAndPurposeAndStatusAndVerifiedAtAfter(
                destination, purpose, VerificationStatus.APPROVED, since);
    }

    /**
     * Whether the account has an approved attempt for the purpose within {@code window}.
     */
    public boolean isAccountFreshlyVerified(UUID accountId, OtpPurpose purpose, Duration window) {
        Instant since = clock.instant().minus(window);
        return otpVerificationRepository.existsByAccountIdAndPurposeAndStatusAndVerifiedAtAfter(
                accountId, purpose, VerificationStatus.APPROVED, since);
    }

    /**
     * Send a code through the provider and append a pending ledger record.
     *
     * @throws AuthenticationException PROVIDER_UNAVAILABLE or INVALID_REQUEST when the provider did not send
     */
    public OtpVerification dispatch(UUID accountId, String destination, OtpPurpose purpose) {
        String channel = ContactNormalizer.channelFor(destination);
        ProviderSendResult sent = verificationProvider.send(destination, channel);
        switch (sent.getOutcome()) {
            case UNAVAILABLE:
                throw new AuthenticationException(ErrorKind.PROVIDER_UNAVAILABLE,
                        "Verification service is temporarily unavailable");
            case REJECTED:
                throw new AuthenticationException(ErrorKind.INVALID_REQUEST,
                        "Unable to send a code to " + MaskingUtil.maskDestination(destination));
            default:
                break;
        }

        Instant now = clock.instant();
        OtpVerification attempt = OtpVerification.builder()
                .accountId(accountId)
                .destination(destination)
                .channel(channel)
                .purpose(purpose)
                .providerReference(sent.getProviderReference())
                .status(VerificationStatus.PENDING)
                .createdAt(now)
                .expiresAt(now.plus(securityProperties.getOtp().getCodeTtl()))
                .build();
        log.info("Sent {} code for {} to {}", channel, purpose.getValue(), MaskingUtil.maskDestination(destination));
        return otpVerificationRepository.save(attempt);
    }

    /**
     * Check a code against the latest attempt for the destination and purpose. A rejected code marks the attempt
     * failed; an approved one is returned still open so the caller decides when to mark it approved.
     */
    public OtpVerification checkCode(String destination, OtpPurpose purpose, String code) {
        OtpVerification attempt = otpVerificationRepository
                .findFirstByDestinationAndPurposeOrderByCreatedAtDesc(destination, purpose)
                .orElseThrow(() -> new AuthenticationException(ErrorKind.CODE_INVALID,
                        "No verification code was requested"));

        if (attempt.getStatus() == VerificationStatus.APPROVED) {
            throw new AuthenticationException(ErrorKind.ALREADY_VERIFIED, "This code was already verified");
        }
        if (attempt.getStatus() == VerificationStatus.EXPIRED) {
            throw new AuthenticationException(ErrorKind.CODE_INVALID, "Code has expired. Request a new code.");
        }
        if (attempt.isExpired(clock.instant())) {
            transition(attempt, VerificationStatus.EXPIRED, 0);
            throw new AuthenticationException(ErrorKind.CODE_INVALID, "Code has expired. Request a new code.");
        }

        ProviderCheckResult result = verificationProvider.check(destination, code);
        switch (result.getOutcome()) {
            case UNAVAILABLE:
                // the attempt stays open, an outage never counts as verified
                throw new AuthenticationException(ErrorKind.PROVIDER_UNAVAILABLE,
                        "Verification service is temporarily unavailable");
            case REJECTED:
                transition(attempt, VerificationStatus.FAILED, 1);
                throw new AuthenticationException(ErrorKind.CODE_INVALID, "Invalid verification code");
            default:
                return attempt;
        }
    }

    /**
     * Approve an attempt returned by {@link #checkCode}.
     *
     * @return false when a concurrent request closed the attempt first
     */
    public boolean markApproved(OtpVerification attempt) {
        Instant now = clock.instant();
        int updated = otpVerificationRepository.markApproved(attempt.getId(), VerificationStatus.APPROVED,
                VerificationStatus.sourcesOf(VerificationStatus.APPROVED), now);
        if (updated == 0) {
            log.warn("Verification {} was closed before it could be approved", attempt.getId());
            return false;
        }
        attempt.setAttemptCount(attempt.getAttemptCount() + 1);
        attempt.setVerifiedAt(now);
        attempt.setStatus(VerificationStatus.APPROVED);
        return true;
    }

    public int purgeOlderThan(Duration retention) {
        return otpVerificationRepository.deleteCreatedBefore(clock.instant().minus(retention));
    }

    private OtpDispatch requestPasswordResetCode(String destination, ClientInfo client) {
        OtpDispatch generic = OtpDispatch.builder()
                .message(PASSWORD_RESET_MESSAGE)
                .expiresInSeconds(securityProperties.getOtp().getCodeTtl().getSeconds())
                .build();

        Optional<Account> account = ContactNormalizer.isEmail(destination)
                ? accountRepository.findByEmail(destination)
                : Optional.empty();
        if (account.isEmpty()) {
            log.info("Password reset requested for unknown destination {}", MaskingUtil.maskDestination(destination));
            return generic;
        }

        try {
            dispatch(account.get().getId(), destination, OtpPurpose.PASSWORD_RESET);
        } catch (AuthenticationException e) {
            // surfacing this would reveal that the account exists
            log.error("Password reset code for account {} not sent: {}", account.get().getId(), e.getMessage());
        }
        auditService.logAuthenticationEvent(account.get().getId(), AuditEventType.PASSWORD_RESET_REQUESTED, true, client);
        return generic;
    }

    private UUID checkPrecondition(String destination, OtpPurpose purpose, UUID callerAccountId) {
        Optional<Account> owner = findByDestination(destination);

        if (purpose.requiresUnregisteredDestination()) {
            if (purpose == OtpPurpose.PHONE_VERIFY && ContactNormalizer.isEmail(destination)) {
                throw new AuthenticationException(ErrorKind.INVALID_REQUEST, "Phone verification needs a phone number");
            }
            if (owner.isPresent() && !owner.get().getId().equals(callerAccountId)) {
                throw new AuthenticationException(ErrorKind.ALREADY_REGISTERED,
                        "This " + describe(destination) + " is already registered");
            }
            if (purpose == OtpPurpose.PHONE_VERIFY && owner.isPresent() && owner.get().isPhoneVerified()) {
                throw new AuthenticationException(ErrorKind.ALREADY_VERIFIED, "Phone number is already verified");
            }
            return callerAccountId;
        }

        if (purpose.requiresRegisteredDestination()) {
            Account account = owner.filter(a -> isDestinationVerified(a, destination))
                    .orElseThrow(() -> new AuthenticationException(ErrorKind.NOT_REGISTERED,
                            "No verified account uses this " + describe(destination)));
            return account.getId();
        }
        return null;
    }

    private Account findVerifiedAccount(String destination) {
        return findByDestination(destination)
                .filter(a -> isDestinationVerified(a, destination))
                .orElseThrow(() -> new AuthenticationException(ErrorKind.NOT_REGISTERED,
                        "No verified account uses this " + describe(destination)));
    }

    private void attachVerifiedPhone(UUID accountId, String phone) {
        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> new AuthenticationException(ErrorKind.NOT_REGISTERED, "Account not found"));
        Optional<Account> owner = accountRepository.findByPhoneNumber(phone);
        if (owner.isPresent() && !owner.get().getId().equals(accountId)) {
            throw new AuthenticationException(ErrorKind.ALREADY_REGISTERED, "This phone number is already registered");
        }
        account.setPhoneNumber(phone);
        account.setPhoneVerified(true);
        accountRepository.save(account);
        log.info("Verified phone {} for account {}", MaskingUtil.maskPhone(phone), accountId);
    }

    private Optional<Account> findByDestination(String destination) {
        return ContactNormalizer.isEmail(destination)
                ? accountRepository.findByEmail(destination)
                : accountRepository.findByPhoneNumber(destination);
    }

    private boolean transition(OtpVerification attempt, VerificationStatus target, int attempts) {
        if (!attempt.getStatus().canTransitionTo(target)) {
            throw new IllegalStateException("Illegal verification transition " + attempt.getStatus() + " -> " + target);
        }
        int updated = otpVerificationRepository.updateStatus(attempt.getId(), target,
                VerificationStatus.sourcesOf(target), attempts);
        if (updated == 0) {
            // a concurrent request already closed the attempt, its status stands
            log.warn("Verification {} not moved to {}, it was closed concurrently", attempt.getId(), target);
            return false;
        }
        attempt.setAttemptCount(attempt.getAttemptCount() + attempts);
        attempt.setStatus(target);
        return true;
    }

    private static boolean isDestinationVerified(Account account, String destination) {
        return ContactNormalizer.isEmail(destination) ? account.isEmailVerified() : account.isPhoneVerified();
    }

    private static String describe(String destination) {
        return ContactNormalizer.isEmail(destination) ? "email" : "phone number";
    }

    private static String identity(ClientInfo client, String destination) {
        return client != null && client.getIpAddress() != null ? client.getIpAddress() : destination;
    }
}
